/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.archive;

import java.io.IOException;

import arotake.BatchResult;

/**
 * Persists the results of a batch once every file has been assessed.
 */
public interface ArchiveWriter {

    void write(BatchResult result, ArchiveLayout layout) throws IOException;
}
