/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.nio.file.Path;

/**
 * A file that passed assessment.
 */
public class BatchRecord {

    private final Path inputPath;
    private final String identifier;
    private final String semesterProgramId;
    private final boolean science;

    public BatchRecord(Path inputPath, String identifier, String semesterProgramId, boolean science) {
        this.inputPath = inputPath;
        this.identifier = identifier;
        this.semesterProgramId = semesterProgramId;
        this.science = science;
    }

    public Path getInputPath() {
        return inputPath;
    }

    public String getIdentifier() {
        return identifier;
    }

    /**
     * The program as semester_progid, for example 2018A_C123.
     */
    public String getSemesterProgramId() {
        return semesterProgramId;
    }

    public boolean isScience() {
        return science;
    }

    @Override
    public String toString() {
        return inputPath.getFileName() + " -> " + identifier;
    }
}
