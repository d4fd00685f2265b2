/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for the HeaderStore class.
 */
public class HeaderStoreTest {

    private HeaderStore header;

    @Before
    public void setUp() {
        header = new HeaderStore();
        header.load("INSTRUME", "MOSFIRE", "Instrument");
        header.load("FRAMENUM", Long.valueOf(12), null);
        header.load("ITIME", Double.valueOf(1.5), null);
        header.load("COADDS", "3", null);
    }

    /**
     * Test of get method, of class HeaderStore.
     */
    @Test
    public void testKeywordsAreCaseInsensitive() {
        assertEquals("MOSFIRE", header.get(" instrume "));
        assertTrue(header.contains("Instrume"));
        assertNull(header.get("DATE-OBS"));
    }

    @Test
    public void testTypedAccessors() {
        assertEquals(Long.valueOf(12), header.getInteger("FRAMENUM"));
        assertEquals(Long.valueOf(3), header.getInteger("COADDS"));
        assertNull(header.getInteger("ITIME"));
        assertEquals(1.5, header.getDouble("ITIME").doubleValue(), 0.0);
        assertEquals(12.0, header.getDouble("FRAMENUM").doubleValue(), 0.0);
        assertNull(header.getDouble("INSTRUME"));
        assertEquals(7, header.getInteger("MISSING", 7));
        assertEquals("none", header.getString("MISSING", "none"));
    }

    @Test
    public void testSetTracksModifiedKeywords() {
        assertTrue(header.getModifiedEntries().isEmpty());

        header.set("FRAMENO", Integer.valueOf(12), "frame");
        header.set("instrume", "MOSFIRE", "Instrument");

        assertTrue(header.isModified("FRAMENO"));
        assertEquals(Long.valueOf(12), header.get("FRAMENO"));
        List<HeaderStore.Entry> modified = header.getModifiedEntries();
        assertEquals(2, modified.size());
        // Header order is kept: INSTRUME was loaded first.
        assertEquals("INSTRUME", modified.get(0).getKeyword());
        assertEquals("FRAMENO", modified.get(1).getKeyword());
        assertEquals(Arrays.asList("INSTRUME", "FRAMENUM", "ITIME", "COADDS", "FRAMENO"), header.getKeywords());
    }

    @Test
    public void testIdentifierCannotChange() {
        header.set(HeaderStore.IDENTIFIER_KEYWORD, "MF.20180304.101530.25.fits", null);
        header.set(HeaderStore.IDENTIFIER_KEYWORD, "MF.20180304.101530.25.fits", null);
        try {
            header.set(HeaderStore.IDENTIFIER_KEYWORD, "MF.20180304.101531.00.fits", null);
            fail("Changing the identifier should not be allowed");
        } catch (IllegalStateException ex) {
            // expected
        }
        assertEquals("MF.20180304.101530.25.fits", header.get("KOAID"));
        try {
            header.remove("KOAID");
            fail("Removing the identifier should not be allowed");
        } catch (IllegalStateException ex) {
            // expected
        }
    }

    @Test
    public void testBlankFcsIdentifierCanBeFilledIn() {
        header.set(HeaderStore.FCS_IDENTIFIER_KEYWORD, "", null);
        header.set(HeaderStore.FCS_IDENTIFIER_KEYWORD, "DF.20180304.101000.00.fits", null);
        assertEquals("DF.20180304.101000.00.fits", header.getString("FCSKOAID"));
    }

    @Test
    public void testSelect() {
        Map<String, Object> values = header.select(Arrays.asList("itime", "DATE-OBS"));
        assertEquals(2, values.size());
        assertEquals(Double.valueOf(1.5), values.get("ITIME"));
        assertTrue(values.containsKey("DATE-OBS"));
        assertNull(values.get("DATE-OBS"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlankKeywordIsRejected() {
        header.set("  ", "value", null);
    }

    @Test
    public void testBooleanReadsAsFitsLogical() {
        header.set("SIMULATE", Boolean.TRUE, null);
        assertEquals("T", header.getString("SIMULATE"));
    }
}
