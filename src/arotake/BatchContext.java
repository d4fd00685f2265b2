/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.time.LocalDate;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import arotake.archive.ProgramInfo;

/**
 * State shared by every exposure of one processing run: the date being
 * processed, the program lookup results, and the identifiers of auxiliary
 * (FCS) images found before the main loop. Owned by the batch orchestrator
 * and only read by the validation steps.
 */
public class BatchContext {

    private final String instrument;
    private final LocalDate processingDate;
    private final String dqaVersion;

    /**
     * Program lookup results keyed by input file path.
     */
    private final Map<String, ProgramInfo> programs = new HashMap<String, ProgramInfo>();

    /**
     * Identifiers of auxiliary images keyed by their file name.
     */
    private final Map<String, String> auxiliaryIdentifiers = new HashMap<String, String>();

    public BatchContext(String instrument, LocalDate processingDate, String dqaVersion) {
        if (instrument == null || processingDate == null) {
            throw new IllegalArgumentException("A batch needs an instrument and a processing date.");
        }
        this.instrument = instrument;
        this.processingDate = processingDate;
        this.dqaVersion = dqaVersion;
    }

    public String getInstrument() {
        return instrument;
    }

    /**
     * The UT date of the observing night being processed.
     */
    public LocalDate getProcessingDate() {
        return processingDate;
    }

    public String getDqaVersion() {
        return dqaVersion;
    }

    public void setPrograms(Map<String, ProgramInfo> programs) {
        this.programs.clear();
        if (programs != null) {
            this.programs.putAll(programs);
        }
    }

    public Map<String, ProgramInfo> getPrograms() {
        return Collections.unmodifiableMap(programs);
    }

    public ProgramInfo getProgramInfo(String path) {
        return programs.get(path);
    }

    public void putAuxiliaryIdentifier(String fileName, String identifier) {
        auxiliaryIdentifiers.put(fileName, identifier);
    }

    public String getAuxiliaryIdentifier(String fileName) {
        return auxiliaryIdentifiers.get(fileName);
    }

    public int getAuxiliaryIdentifierCount() {
        return auxiliaryIdentifiers.size();
    }
}
