/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.Segment;
import arotake.StepContext;
import arotake.ValidationStep;

/**
 * Counts the pixels at or above the saturation level over all image
 * segments and writes the total to NPIXSAT. The level is fixed for some
 * instruments and read from SATURATE for others.
 */
public class SetSaturatedPixels extends ValidationStep {

    private static final Logger logger = LoggerFactory.getLogger(SetSaturatedPixels.class);

    private final Double saturation;

    /**
     * Uses the SATURATE keyword of each exposure.
     */
    public SetSaturatedPixels() {
        this(null);
    }

    public SetSaturatedPixels(Double saturation) {
        super("set_npixsat");
        this.saturation = saturation;
    }

    @Override
    public boolean apply(StepContext context) {
        Double level = saturation;
        if (level == null) {
            level = context.getHeader().getDouble("SATURATE");
        }
        if (level == null) {
            logger.warn("{}: could not find SATURATE keyword", context.getExposure().getFileName());
            return true;
        }

        long count = 0;
        for (Segment segment : context.getExposure().getSegments()) {
            count += countAtOrAbove(segment.getPixels(), level.doubleValue());
        }
        context.getHeader().set("NPIXSAT", Long.valueOf(count), "KOA: Number of saturated pixels");
        return true;
    }

    static long countAtOrAbove(int[][] pixels, double level) {
        long count = 0;
        for (int[] row : pixels) {
            for (int value : row) {
                if (value >= level) {
                    ++count;
                }
            }
        }
        return count;
    }
}
