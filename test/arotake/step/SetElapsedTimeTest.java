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
 * Unit tests for the SetElapsedTime class.
 */
public class SetElapsedTimeTest {

    private final SetElapsedTime step = new SetElapsedTime();

    @Test
    public void testProductOfIntegrationTimeAndCoadds() {
        HeaderStore header = Fixtures.mosfireHeader("2018-03-04", "10:15:30.25", 1);
        assertTrue(step.apply(Fixtures.mosfireContext(header)));
        assertEquals(21.0, header.getDouble("ELAPTIME").doubleValue(), 1e-9);
    }

    @Test
    public void testMissingCoaddsFails() {
        HeaderStore header = Fixtures.mosfireHeader("2018-03-04", "10:15:30.25", 1);
        header.remove("COADDS");
        assertFalse(step.apply(Fixtures.mosfireContext(header)));
        assertFalse(header.contains("ELAPTIME"));
    }

    @Test
    public void testExistingValueIsKept() {
        HeaderStore header = Fixtures.mosfireHeader("2018-03-04", "10:15:30.25", 1);
        header.load("ELAPTIME", Double.valueOf(5.0), null);
        assertTrue(step.apply(Fixtures.mosfireContext(header)));
        assertEquals(5.0, header.getDouble("ELAPTIME").doubleValue(), 1e-9);
    }
}
