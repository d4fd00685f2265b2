/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.archive;

import java.util.Set;

/**
 * Reports the progress of a night to the archive's tracking database.
 */
public interface StatusUpdater {

    /**
     * Sets one column of the night's tracking record.
     *
     * @return true if the update was accepted.
     */
    boolean update(String instrument, String date, String column, String value);

    /**
     * Flags the programs whose principal investigators should be told that
     * new data has been archived.
     *
     * @param semesterProgramIds identifiers of the form semester_progid.
     * @return true if the notification was accepted.
     */
    boolean notifyPrograms(String instrument, String date, Set<String> semesterProgramIds);
}
