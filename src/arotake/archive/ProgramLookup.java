/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.archive;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Finds the observing program of each file of a batch.
 */
public interface ProgramLookup {

    /**
     * Returns the program information known for the batch, keyed by raw file
     * path. Files with no known program are absent from the result.
     *
     * @param layout the directories of the batch.
     * @param files the files of the batch.
     * @throws IOException if the program information cannot be read.
     */
    Map<String, ProgramInfo> lookup(ArchiveLayout layout, List<Path> files) throws IOException;
}
