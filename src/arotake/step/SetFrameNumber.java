/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.HeaderStore;
import arotake.StepContext;
import arotake.ValidationStep;

/**
 * Adds FRAMENO when it is missing, from FRAMENUM or else from the number
 * after the last underscore of the DATAFILE name (for example
 * m180304_0123.fits gives 123).
 */
public class SetFrameNumber extends ValidationStep {

    private static final Logger logger = LoggerFactory.getLogger(SetFrameNumber.class);

    public SetFrameNumber() {
        super("set_frameno");
    }

    @Override
    public boolean apply(StepContext context) {
        HeaderStore header = context.getHeader();
        String fileName = context.getExposure().getFileName();
        if (header.get("FRAMENO") != null) {
            return true;
        }

        Long frameNumber = header.getInteger("FRAMENUM");
        if (frameNumber == null) {
            frameNumber = fromDataFile(header.getString("DATAFILE"));
        }
        if (frameNumber == null) {
            logger.error("{}: cannot find value for FRAMENO", fileName);
            return false;
        }

        header.set("FRAMENO", frameNumber, "KOA: Image frame number");
        return true;
    }

    /**
     * Returns the frame number embedded in a data file name, or null.
     */
    static Long fromDataFile(String dataFile) {
        if (dataFile == null) {
            return null;
        }
        String name = dataFile.trim();
        if (name.endsWith(".fits")) {
            name = name.substring(0, name.length() - ".fits".length());
        }
        String digits = name.substring(name.lastIndexOf('_') + 1);
        try {
            return Long.valueOf(digits);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
