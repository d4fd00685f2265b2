/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * The directories used while processing one night of one instrument:
 * <pre>
 *   &lt;root&gt;/&lt;INSTR&gt;/&lt;yyyyMMdd&gt;/stage   input lists and program table
 *   &lt;root&gt;/&lt;INSTR&gt;/&lt;yyyyMMdd&gt;/lev0    archived files and tables
 *   &lt;root&gt;/&lt;INSTR&gt;/&lt;yyyyMMdd&gt;/udf     quarantined files
 *   &lt;root&gt;/&lt;INSTR&gt;/&lt;yyyyMMdd&gt;/anc     ancillary files
 * </pre>
 */
public class ArchiveLayout {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Path root;
    private final String instrument;
    private final LocalDate date;

    public ArchiveLayout(Path root, String instrument, LocalDate date) {
        if (root == null || instrument == null || date == null) {
            throw new IllegalArgumentException("A layout needs a root directory, an instrument and a date.");
        }
        this.root = root;
        this.instrument = instrument.trim().toUpperCase();
        this.date = date;
    }

    public Path getRoot() {
        return root;
    }

    public String getInstrument() {
        return instrument;
    }

    public LocalDate getDate() {
        return date;
    }

    /**
     * The date as used in directory and table names (yyyyMMdd).
     */
    public String getDateText() {
        return DATE_FORMAT.format(date);
    }

    public Path getNightDirectory() {
        return root.resolve(instrument).resolve(getDateText());
    }

    public Path getStageDirectory() {
        return getNightDirectory().resolve("stage");
    }

    public Path getLevel0Directory() {
        return getNightDirectory().resolve("lev0");
    }

    public Path getQuarantineDirectory() {
        return getNightDirectory().resolve("udf");
    }

    public Path getAncillaryDirectory() {
        return getNightDirectory().resolve("anc");
    }

    /**
     * The list of files to process.
     */
    public Path getManifest() {
        return getStageDirectory().resolve("dep_locate" + instrument + ".txt");
    }

    /**
     * The list of files that passed assessment.
     */
    public Path getPassedList() {
        return getStageDirectory().resolve("dep_dqa" + instrument + ".txt");
    }

    /**
     * Creates any of the output directories that do not exist.
     */
    public void createDirectories() throws IOException {
        Files.createDirectories(getStageDirectory());
        Files.createDirectories(getLevel0Directory());
        Files.createDirectories(getQuarantineDirectory());
        Files.createDirectories(getAncillaryDirectory());
    }

    @Override
    public String toString() {
        return getNightDirectory().toString();
    }
}
