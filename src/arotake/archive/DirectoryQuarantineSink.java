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
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.QuarantineReason;

/**
 * Copies quarantined files, unchanged and with their timestamps, into a
 * directory. The original file is left in place.
 */
public class DirectoryQuarantineSink implements QuarantineSink {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryQuarantineSink.class);

    private final Path directory;

    public DirectoryQuarantineSink(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("A quarantine directory is required.");
        }
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    public void quarantine(Path file, QuarantineReason reason) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(file.getFileName().toString());
        logger.info("Quarantining {} ({}) to {}", file, reason, directory);
        Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
    }
}
