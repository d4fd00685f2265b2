/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.archive;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads program information from the tab-separated program table in the
 * stage directory. Each line holds the file, semester, program id,
 * institution, PI, title and proprietary period in months. Blank lines and
 * lines starting with '#' are ignored.
 */
public class ProgramTableLookup implements ProgramLookup {

    private static final Logger logger = LoggerFactory.getLogger(ProgramTableLookup.class);

    public static final String TABLE_NAME = "newproginfo.txt";

    static final int NUM_COLUMNS = 7;

    public Map<String, ProgramInfo> lookup(ArchiveLayout layout, List<Path> files) throws IOException {
        Path table = layout.getStageDirectory().resolve(TABLE_NAME);
        Map<String, ProgramInfo> programs = new LinkedHashMap<String, ProgramInfo>();
        if (!Files.exists(table)) {
            logger.warn("No program table at {}, all files will have program NONE", table);
            return programs;
        }

        BufferedReader reader = Files.newBufferedReader(table, StandardCharsets.UTF_8);
        try {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                ++lineNumber;
                if (line.trim().length() == 0 || line.trim().startsWith("#")) {
                    continue;
                }
                ProgramInfo info = parseLine(line);
                if (info == null) {
                    logger.warn("Ignoring malformed line {} of {}", lineNumber, table);
                    continue;
                }
                programs.put(info.getFile(), info);
            }
        } finally {
            reader.close();
        }

        logger.info("Read program information for {} files", programs.size());
        return programs;
    }

    /**
     * Parses one line of the table, returning null if it is malformed.
     */
    static ProgramInfo parseLine(String line) {
        String[] columns = line.split("\t", -1);
        if (columns.length < NUM_COLUMNS) {
            return null;
        }
        for (int index = 0; index < columns.length; ++index) {
            columns[index] = columns[index].trim();
        }
        if (columns[0].length() == 0) {
            return null;
        }

        int months;
        try {
            months = columns[6].length() == 0 ? 0 : Integer.parseInt(columns[6]);
        } catch (NumberFormatException ex) {
            return null;
        }
        return new ProgramInfo(columns[0], columns[1], columns[2], columns[3], columns[4], columns[5], months);
    }
}
