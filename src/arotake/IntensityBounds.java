/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

/**
 * Running minimum and maximum intensity over the segments of a mosaic. These
 * become the display limits of the whole preview. The minimum is never
 * allowed below zero.
 */
public class IntensityBounds {

    private double min = Double.NaN;
    private double max = Double.NaN;

    /**
     * Merges the limits of one segment into the running bounds.
     */
    public void include(double segmentMin, double segmentMax) {
        if (Double.isNaN(min) || segmentMin < min) {
            min = segmentMin;
        }
        if (Double.isNaN(max) || segmentMax > max) {
            max = segmentMax;
        }
        if (min < 0) {
            min = 0;
        }
    }

    /**
     * True once at least one segment has been included.
     */
    public boolean isSet() {
        return !Double.isNaN(min);
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
