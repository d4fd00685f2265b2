/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.archive;

import java.io.IOException;
import java.nio.file.Path;

import arotake.QuarantineReason;

/**
 * Receives the files that failed assessment.
 */
public interface QuarantineSink {

    void quarantine(Path file, QuarantineReason reason) throws IOException;
}
