/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.StepContext;
import arotake.ValidationStep;

/**
 * Confirms that the file was written by the instrument being processed.
 */
public class CheckInstrument extends ValidationStep {

    private static final Logger logger = LoggerFactory.getLogger(CheckInstrument.class);

    public CheckInstrument() {
        super("check_instr");
    }

    @Override
    public boolean apply(StepContext context) {
        String expected = context.getProfile().getName();
        String instrument = context.getHeader().getString("INSTRUME", "");
        if (!instrument.toUpperCase().contains(expected.toUpperCase())) {
            logger.error("{}: INSTRUME is '{}', expected {}", context.getExposure().getFileName(), instrument, expected);
            return false;
        }
        return true;
    }
}
