/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The outcome of a batch: the files that passed, in input order, with their
 * archive metadata, the files that were quarantined, and the totals reported
 * once the batch is complete.
 */
public class BatchResult {

    /**
     * A file that was quarantined.
     */
    public static class Quarantined {

        private final Path path;
        private final QuarantineReason reason;
        private final String detail;

        public Quarantined(Path path, QuarantineReason reason, String detail) {
            this.path = path;
            this.reason = reason;
            this.detail = detail;
        }

        public Path getPath() {
            return path;
        }

        public QuarantineReason getReason() {
            return reason;
        }

        /**
         * The failed step or offending identifier, if known.
         */
        public String getDetail() {
            return detail;
        }

        @Override
        public String toString() {
            return path + " (" + reason + (detail == null ? "" : ": " + detail) + ")";
        }
    }

    private final String instrument;
    private final LocalDate date;
    private final List<String> metadataKeywords = new ArrayList<String>();
    private final List<BatchRecord> records = new ArrayList<BatchRecord>();
    private final Map<String, Map<String, Object>> metadata = new LinkedHashMap<String, Map<String, Object>>();
    private final List<Quarantined> quarantined = new ArrayList<Quarantined>();

    private String principalInvestigators = "";
    private String storagePartitions = "";

    public BatchResult(String instrument, LocalDate date, List<String> metadataKeywords) {
        this.instrument = instrument;
        this.date = date;
        if (metadataKeywords != null) {
            this.metadataKeywords.addAll(metadataKeywords);
        }
    }

    public String getInstrument() {
        return instrument;
    }

    public LocalDate getDate() {
        return date;
    }

    /**
     * The columns of the metadata table, in order.
     */
    public List<String> getMetadataKeywords() {
        return Collections.unmodifiableList(metadataKeywords);
    }

    /**
     * Records a file that passed, with its metadata table row.
     */
    public void addRecord(BatchRecord record, Map<String, Object> values) {
        records.add(record);
        metadata.put(record.getIdentifier(), values);
    }

    public List<BatchRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    /**
     * Returns the metadata row of an identifier, or null.
     */
    public Map<String, Object> getMetadata(String identifier) {
        return metadata.get(identifier);
    }

    public void addQuarantined(Path path, QuarantineReason reason, String detail) {
        quarantined.add(new Quarantined(path, reason, detail));
    }

    public List<Quarantined> getQuarantined() {
        return Collections.unmodifiableList(quarantined);
    }

    public int getPassedCount() {
        return records.size();
    }

    public int getScienceCount() {
        int count = 0;
        for (BatchRecord record : records) {
            if (record.isScience()) {
                ++count;
            }
        }
        return count;
    }

    /**
     * The distinct semester_progid values of the passed files, in order of
     * first appearance.
     */
    public Set<String> getSemesterProgramIds() {
        Set<String> ids = new LinkedHashSet<String>();
        for (BatchRecord record : records) {
            ids.add(record.getSemesterProgramId());
        }
        return ids;
    }

    /**
     * The distinct principal investigators of the night joined with '/'.
     */
    public String getPrincipalInvestigators() {
        return principalInvestigators;
    }

    public void setPrincipalInvestigators(String principalInvestigators) {
        this.principalInvestigators = principalInvestigators;
    }

    /**
     * The distinct storage partition numbers of the night joined with '/'.
     */
    public String getStoragePartitions() {
        return storagePartitions;
    }

    public void setStoragePartitions(String storagePartitions) {
        this.storagePartitions = storagePartitions;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
