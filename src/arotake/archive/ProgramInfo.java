/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.archive;

/**
 * The observing program an exposure was taken for, as known to the program
 * database.
 */
public class ProgramInfo {

    private final String file;
    private final String semester;
    private final String programId;
    private final String institution;
    private final String principalInvestigator;
    private final String title;
    private final int proprietaryMonths;

    public ProgramInfo(String file, String semester, String programId, String institution,
            String principalInvestigator, String title, int proprietaryMonths) {
        this.file = file;
        this.semester = semester;
        this.programId = programId;
        this.institution = institution;
        this.principalInvestigator = principalInvestigator;
        this.title = title;
        this.proprietaryMonths = proprietaryMonths;
    }

    /**
     * The path of the raw file the entry belongs to.
     */
    public String getFile() {
        return file;
    }

    public String getSemester() {
        return semester;
    }

    public String getProgramId() {
        return programId;
    }

    public String getInstitution() {
        return institution;
    }

    public String getPrincipalInvestigator() {
        return principalInvestigator;
    }

    public String getTitle() {
        return title;
    }

    /**
     * The number of months the data stays proprietary to the program.
     */
    public int getProprietaryMonths() {
        return proprietaryMonths;
    }

    @Override
    public String toString() {
        return file + " " + semester + "_" + programId + " (" + principalInvestigator + ")";
    }
}
