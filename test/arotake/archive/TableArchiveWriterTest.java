/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

import arotake.BatchRecord;
import arotake.BatchResult;
import arotake.Fixtures;

/**
 * Unit tests for the TableArchiveWriter class.
 */
public class TableArchiveWriterTest {

    private static final String FIRST = "MF.20180304.101530.25.fits";
    private static final String SECOND = "MF.20180304.102000.00.fits";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ArchiveLayout layout;
    private BatchResult result;

    @Before
    public void setUp() throws IOException {
        layout = new ArchiveLayout(folder.getRoot().toPath(), "MOSFIRE", Fixtures.NIGHT);
        layout.createDirectories();
        result = new BatchResult("MOSFIRE", Fixtures.NIGHT, Arrays.asList("KOAID", "PROGTITL", "PROPINT"));

        Map<String, Object> first = new LinkedHashMap<String, Object>();
        first.put("KOAID", FIRST);
        first.put("PROGTITL", "Stars | planets");
        first.put("PROPINT", Integer.valueOf(18));
        result.addRecord(new BatchRecord(Paths.get("/s/sdata1300/m180304_0001.fits"), FIRST, "2018A_C123", true),
                first);

        Map<String, Object> second = new LinkedHashMap<String, Object>();
        second.put("KOAID", SECOND);
        second.put("PROGTITL", null);
        result.addRecord(new BatchRecord(Paths.get("/s/sdata1300/m180304_0002.fits"), SECOND, "2018A_NONE", false),
                second);

        Path lev0 = layout.getLevel0Directory();
        Files.write(lev0.resolve(FIRST), "abc".getBytes(StandardCharsets.US_ASCII));
        Files.write(lev0.resolve(SECOND), new byte[0]);
        Files.write(lev0.resolve("MF.20180304.101530.25.jpg"), "abc".getBytes(StandardCharsets.US_ASCII));
    }

    private List<String> lines(String name) throws IOException {
        return Files.readAllLines(layout.getLevel0Directory().resolve(name), StandardCharsets.UTF_8);
    }

    /**
     * Test of write method, of class TableArchiveWriter.
     */
    @Test
    public void testWriteTables() throws IOException {
        new TableArchiveWriter().write(result, layout);

        assertEquals(Arrays.asList("/s/sdata1300/m180304_0001.fits", "/s/sdata1300/m180304_0002.fits"),
                Files.readAllLines(layout.getPassedList(), StandardCharsets.UTF_8));

        assertEquals(Arrays.asList("m180304_0001.fits " + FIRST, "m180304_0002.fits " + SECOND,
                "    2 Total FITS files"), lines("20180304.filelist.table"));

        assertEquals(Arrays.asList("|KOAID|PROGTITL|PROPINT|", "|" + FIRST + "|Stars / planets|18|",
                "|" + SECOND + "|null|null|"), lines("20180304.metadata.table"));

        assertEquals(Arrays.asList("900150983cd24fb0d6963f7d28e17f72  " + FIRST,
                "d41d8cd98f00b204e9800998ecf8427e  " + SECOND), lines("20180304.FITS.md5sum.table"));
        assertEquals(Arrays.asList("900150983cd24fb0d6963f7d28e17f72  MF.20180304.101530.25.jpg"),
                lines("20180304.JPEG.md5sum.table"));
    }

    @Test
    public void testFitsFilesAreCompressed() throws IOException {
        new TableArchiveWriter().write(result, layout);

        Path lev0 = layout.getLevel0Directory();
        assertFalse(Files.exists(lev0.resolve(FIRST)));
        Path compressed = lev0.resolve(FIRST + ".gz");
        assertTrue(Files.exists(compressed));
        assertTrue(Files.exists(lev0.resolve("MF.20180304.101530.25.jpg")));

        InputStream in = new GZIPInputStream(Files.newInputStream(compressed));
        try {
            byte[] buffer = new byte[16];
            int count = in.read(buffer);
            assertEquals("abc", new String(buffer, 0, count, StandardCharsets.US_ASCII));
        } finally {
            in.close();
        }
    }

    /**
     * Test of md5 method, of class TableArchiveWriter.
     */
    @Test
    public void testMd5() throws IOException {
        assertEquals("900150983cd24fb0d6963f7d28e17f72",
                TableArchiveWriter.md5(layout.getLevel0Directory().resolve(FIRST)));
    }
}
