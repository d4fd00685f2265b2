/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.archive;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A status updater for running without the tracking database. Each update
 * is written to the log and reported as accepted.
 */
public class LoggingStatusUpdater implements StatusUpdater {

    private static final Logger logger = LoggerFactory.getLogger(LoggingStatusUpdater.class);

    public boolean update(String instrument, String date, String column, String value) {
        logger.info("Status {} {}: {} = {}", instrument, date, column, value);
        return true;
    }

    public boolean notifyPrograms(String instrument, String date, Set<String> semesterProgramIds) {
        logger.info("Notify {} {}: {}", instrument, date, semesterProgramIds);
        return true;
    }
}
