/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.archive.ArchiveLayout;
import arotake.instrument.InstrumentProfile;
import arotake.instrument.InstrumentProfiles;

/**
 * Runs the assessment of one night from the command line:
 * <pre>
 *   arotake.Main &lt;instrument&gt; &lt;yyyy-MM-dd&gt; [rootdir]
 * </pre>
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    /**
     * @param args the command line arguments
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs a batch and returns the process exit status.
     */
    static int run(String[] args) {
        if (args.length < 2 || args.length > 3) {
            System.err.println("Usage: arotake.Main <instrument> <yyyy-MM-dd> [rootdir]");
            return 2;
        }

        InstrumentProfile profile;
        LocalDate date;
        try {
            profile = InstrumentProfiles.forName(args[0]);
            date = LocalDate.parse(args[1]);
        } catch (IllegalArgumentException ex) {
            System.err.println(ex.getMessage());
            return 2;
        } catch (DateTimeParseException ex) {
            System.err.println("Expected a date of the form yyyy-MM-dd, got '" + args[1] + "'");
            return 2;
        }

        Settings settings = new Settings();
        settings.loadPropertiesFromFile();
        if (args.length == 3) {
            settings.setRootDirectory(args[2]);
        }
        logger.info("Settings: {}", settings);

        ArchiveLayout layout = new ArchiveLayout(Paths.get(settings.getRootDirectory()), profile.getName(), date);
        BatchOrchestrator orchestrator = new BatchOrchestrator(profile, layout, settings);
        try {
            BatchResult result = orchestrator.run();
            logger.info("{} files archived, {} quarantined", result.getPassedCount(), result.getQuarantined().size());
            return 0;
        } catch (BatchSetupException ex) {
            logger.error("Unable to start the batch", ex);
            return 1;
        } catch (IOException ex) {
            logger.error("Unable to write the archive tables", ex);
            return 1;
        }
    }
}
