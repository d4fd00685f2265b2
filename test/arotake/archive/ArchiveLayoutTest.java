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
import java.nio.file.Paths;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

import arotake.Fixtures;

/**
 * Unit tests for the ArchiveLayout class.
 */
public class ArchiveLayoutTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testPaths() {
        ArchiveLayout layout = new ArchiveLayout(Paths.get("/koadata"), "mosfire", Fixtures.NIGHT);

        assertEquals("MOSFIRE", layout.getInstrument());
        assertEquals("20180304", layout.getDateText());
        assertEquals(Paths.get("/koadata/MOSFIRE/20180304"), layout.getNightDirectory());
        assertEquals(Paths.get("/koadata/MOSFIRE/20180304/lev0"), layout.getLevel0Directory());
        assertEquals(Paths.get("/koadata/MOSFIRE/20180304/udf"), layout.getQuarantineDirectory());
        assertEquals(Paths.get("/koadata/MOSFIRE/20180304/stage/dep_locateMOSFIRE.txt"), layout.getManifest());
        assertEquals(Paths.get("/koadata/MOSFIRE/20180304/stage/dep_dqaMOSFIRE.txt"), layout.getPassedList());
    }

    @Test
    public void testCreateDirectories() throws IOException {
        Path root = folder.getRoot().toPath();
        ArchiveLayout layout = new ArchiveLayout(root, "DEIMOS", Fixtures.NIGHT);

        layout.createDirectories();
        layout.createDirectories();

        assertTrue(Files.isDirectory(layout.getStageDirectory()));
        assertTrue(Files.isDirectory(layout.getLevel0Directory()));
        assertTrue(Files.isDirectory(layout.getQuarantineDirectory()));
        assertTrue(Files.isDirectory(layout.getAncillaryDirectory()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDateRequired() {
        new ArchiveLayout(Paths.get("/koadata"), "DEIMOS", null);
    }
}
