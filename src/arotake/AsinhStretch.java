/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

/**
 * Maps intensities between a lower and upper limit onto [0, 1] with an
 * inverse hyperbolic sine curve. Faint detail is lifted while bright sources
 * are compressed, which suits sky images better than a linear scale.
 */
public class AsinhStretch {

    /**
     * The default softening parameter. Smaller values stretch faint levels
     * more strongly.
     */
    public static final double DEFAULT_SOFTENING = 0.1;

    private final double softening;
    private final double scale;

    public AsinhStretch() {
        this(DEFAULT_SOFTENING);
    }

    public AsinhStretch(double softening) {
        if (!(softening > 0)) {
            throw new IllegalArgumentException("The stretch softening must be positive, the value given was " + softening);
        }
        this.softening = softening;
        this.scale = asinh(1.0 / softening);
    }

    static double asinh(double x) {
        return Math.log(x + Math.sqrt(x * x + 1.0));
    }

    /**
     * Stretches one value.
     *
     * @param value the intensity.
     * @param min the intensity that maps to 0.
     * @param max the intensity that maps to 1.
     */
    public double apply(double value, double min, double max) {
        double range = max - min;
        double x;
        if (range > 0) {
            x = (value - min) / range;
        } else {
            x = value > min ? 1.0 : 0.0;
        }
        if (x < 0) {
            x = 0;
        } else if (x > 1) {
            x = 1;
        }
        return asinh(x / softening) / scale;
    }

    /**
     * Stretches a whole image into a new array.
     */
    public double[][] apply(double[][] data, double min, double max) {
        double[][] result = new double[data.length][];
        for (int row = 0; row < data.length; ++row) {
            result[row] = new double[data[row].length];
            for (int column = 0; column < data[row].length; ++column) {
                result[row][column] = apply(data[row][column], min, max);
            }
        }
        return result;
    }
}
