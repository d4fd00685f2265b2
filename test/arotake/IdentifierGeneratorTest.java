/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.time.LocalDateTime;

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for the IdentifierGenerator class.
 */
public class IdentifierGeneratorTest {

    private final IdentifierGenerator generator = new IdentifierGenerator();

    /**
     * Test of generate method, of class IdentifierGenerator.
     */
    @Test
    public void testGenerate() {
        assertEquals("MF.20180304.101530.25.fits", generator.generate("MF", "2018-03-04", "10:15:30.25"));
        assertEquals("DE.20180304.010203.00.fits", generator.generate("DE", "2018-03-04", "1:2:3"));
    }

    @Test
    public void testHundredthsAreTruncated() {
        assertEquals("MF.20180304.235959.99.fits", generator.generate("MF", "2018-03-04", "23:59:59.999"));
        assertEquals("MF.20180304.101530.10.fits", generator.generate("MF", "2018-03-04", "10:15:30.1"));
    }

    @Test
    public void testDateWithTimeAttached() {
        assertEquals("DF.20180304.101530.00.fits", generator.generate("DF", "2018-03-04T10:15:30", "10:15:30.00"));
    }

    @Test
    public void testGenerateFromTimestamp() {
        LocalDateTime timestamp = LocalDateTime.of(2018, 3, 4, 5, 6, 7, 890000000);
        String identifier = generator.generate("MF", timestamp);
        assertEquals("MF.20180304.050607.89.fits", identifier);

        ArchiveIdentifier parsed = ArchiveIdentifier.parse(identifier);
        assertNotNull(parsed);
        assertEquals("MF", parsed.getPrefix());
        assertEquals("050607.89", parsed.getTime());
        assertEquals(50607.89, parsed.getTimeValue(), 1e-9);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlankPrefix() {
        generator.generate("", "2018-03-04", "10:15:30.25");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadDate() {
        generator.generate("MF", "04/03/18", "10:15:30.25");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadTime() {
        generator.generate("MF", "2018-03-04", "25:15:30");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingTime() {
        generator.generate("MF", "2018-03-04", null);
    }
}
