/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.archive;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

import arotake.Fixtures;

/**
 * Unit tests for the ProgramTableLookup class.
 */
public class ProgramTableLookupTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ArchiveLayout layout;

    @Before
    public void setUp() throws IOException {
        layout = new ArchiveLayout(folder.getRoot().toPath(), "MOSFIRE", Fixtures.NIGHT);
        layout.createDirectories();
    }

    /**
     * Test of lookup method, of class ProgramTableLookup.
     */
    @Test
    public void testLookupReadsTable() throws IOException {
        Path table = layout.getStageDirectory().resolve(ProgramTableLookup.TABLE_NAME);
        Files.write(table, Arrays.asList(
                "# file\tsemester\tprogid\tinst\tpi\ttitle\tpropint",
                "/s/sdata1300/m1.fits\t2018A\tC123\tCIT\tSmith\tDistant galaxies\t18",
                "",
                "/s/sdata1300/m2.fits\t2018A\tENG\tKECK\tStaff\tEngineering",
                "/s/sdata1300/m3.fits\t2018A\tU045\tUC\tJones\tNearby stars\t"), StandardCharsets.UTF_8);

        Map<String, ProgramInfo> programs = new ProgramTableLookup().lookup(layout,
                Collections.<Path>emptyList());

        assertEquals(2, programs.size());
        ProgramInfo first = programs.get("/s/sdata1300/m1.fits");
        assertEquals("2018A", first.getSemester());
        assertEquals("C123", first.getProgramId());
        assertEquals("CIT", first.getInstitution());
        assertEquals("Smith", first.getPrincipalInvestigator());
        assertEquals("Distant galaxies", first.getTitle());
        assertEquals(18, first.getProprietaryMonths());
        assertEquals(0, programs.get("/s/sdata1300/m3.fits").getProprietaryMonths());
    }

    @Test
    public void testMissingTableGivesNoPrograms() throws IOException {
        assertTrue(new ProgramTableLookup().lookup(layout, Collections.<Path>emptyList()).isEmpty());
    }

    /**
     * Test of parseLine method, of class ProgramTableLookup.
     */
    @Test
    public void testParseLine() {
        assertNull(ProgramTableLookup.parseLine("only\tthree\tcolumns"));
        assertNull(ProgramTableLookup.parseLine("\t2018A\tC123\tCIT\tSmith\tTitle\t18"));
        assertNull(ProgramTableLookup.parseLine("/m.fits\t2018A\tC123\tCIT\tSmith\tTitle\tlong"));

        ProgramInfo info = ProgramTableLookup.parseLine(" /m.fits \t2018A\tC123\tCIT\tSmith\tTitle\t 12 ");
        assertEquals("/m.fits", info.getFile());
        assertEquals(12, info.getProprietaryMonths());
    }
}
