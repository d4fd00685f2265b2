/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.instrument;

/**
 * Selects the profile of a named instrument.
 */
public final class InstrumentProfiles {

    private InstrumentProfiles() {
    }

    /**
     * Returns a profile for the named instrument (case-insensitive).
     *
     * @throws IllegalArgumentException if the instrument is not supported.
     */
    public static InstrumentProfile forName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("No instrument name was given.");
        }
        String instrument = name.trim().toUpperCase();
        if (DeimosProfile.NAME.equals(instrument)) {
            return new DeimosProfile();
        }
        if (MosfireProfile.NAME.equals(instrument)) {
            return new MosfireProfile();
        }
        throw new IllegalArgumentException("Unsupported instrument '" + name + "'");
    }
}
