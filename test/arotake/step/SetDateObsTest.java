/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.step;

import org.junit.Test;
import static org.junit.Assert.*;

import arotake.Fixtures;
import arotake.HeaderStore;

/**
 * Unit tests for the SetDateObs class.
 */
public class SetDateObsTest {

    private final SetDateObs step = new SetDateObs();

    @Test
    public void testIsoDateIsKept() {
        HeaderStore header = Fixtures.mosfireHeader("2018-03-04", "10:15:30.25", 1);
        assertTrue(step.apply(Fixtures.mosfireContext(header)));
        assertEquals("2018-03-04", header.getString("DATE-OBS"));
        assertFalse(header.isModified("DATE-OBS"));
    }

    @Test
    public void testMissingDateObsTakenFromDate() {
        HeaderStore header = Fixtures.mosfireHeader("2018-03-04", "10:15:30.25", 1);
        header.remove("DATE-OBS");
        header.load("DATE", "2018-03-05T02:10:00", "File creation date");

        assertTrue(step.apply(Fixtures.mosfireContext(header)));
        assertEquals("2018-03-05", header.getString("DATE-OBS"));
        assertEquals("KOA: Added missing keyword 'DATE-OBS'", header.getComment("DATE-OBS"));
    }

    @Test
    public void testOldFormatIsConverted() {
        HeaderStore header = Fixtures.mosfireHeader("04/03/18", "10:15:30.25", 1);
        assertTrue(step.apply(Fixtures.mosfireContext(header)));
        assertEquals("2018-03-04", header.getString("DATE-OBS"));
        assertTrue(header.isModified("DATE-OBS"));
    }

    @Test
    public void testUnrecognisedDateFails() {
        HeaderStore header = Fixtures.mosfireHeader("March 4", "10:15:30.25", 1);
        assertFalse(step.apply(Fixtures.mosfireContext(header)));
    }

    @Test
    public void testNoDateAtAllFails() {
        HeaderStore header = Fixtures.mosfireHeader("2018-03-04", "10:15:30.25", 1);
        header.remove("DATE-OBS");
        assertFalse(step.apply(Fixtures.mosfireContext(header)));
    }
}
