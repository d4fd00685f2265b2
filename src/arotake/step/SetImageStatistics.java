/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.step;

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.HeaderStore;
import arotake.Segment;
import arotake.StepContext;
import arotake.ValidationStep;

/**
 * Writes the mean, median and standard deviation of the central half of the
 * image (IMAGEMN, IMAGEMD, IMAGESD).
 */
public class SetImageStatistics extends ValidationStep {

    private static final Logger logger = LoggerFactory.getLogger(SetImageStatistics.class);

    public SetImageStatistics() {
        super("set_image_stats");
    }

    @Override
    public boolean apply(StepContext context) {
        List<Segment> segments = context.getExposure().getSegments();
        if (segments.isEmpty()) {
            logger.warn("{}: no image data for statistics", context.getExposure().getFileName());
            return true;
        }

        double[] values = centralValues(segments.get(0).getPixels());
        if (values.length == 0) {
            logger.warn("{}: image is empty, no statistics", context.getExposure().getFileName());
            return true;
        }

        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        double mean = sum / values.length;

        double squares = 0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        double deviation = Math.sqrt(squares / values.length);

        Arrays.sort(values);
        int middle = values.length / 2;
        double median = (values.length % 2 == 1) ? values[middle] : (values[middle - 1] + values[middle]) / 2.0;

        HeaderStore header = context.getHeader();
        header.set("IMAGEMN", Double.valueOf(round(mean)), "KOA: Image data mean");
        header.set("IMAGEMD", Double.valueOf(round(median)), "KOA: Image data median");
        header.set("IMAGESD", Double.valueOf(round(deviation)), "KOA: Image data standard deviation");
        return true;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    // Pixels of the box spanning the middle half of each dimension.
    static double[] centralValues(int[][] pixels) {
        int numRows = pixels.length;
        int numColumns = numRows == 0 ? 0 : pixels[0].length;
        int rowStart = numRows / 4;
        int rowEnd = numRows - numRows / 4;
        int columnStart = numColumns / 4;
        int columnEnd = numColumns - numColumns / 4;

        double[] values = new double[Math.max(0, (rowEnd - rowStart) * (columnEnd - columnStart))];
        int index = 0;
        for (int row = rowStart; row < rowEnd; ++row) {
            for (int column = columnStart; column < columnEnd; ++column) {
                values[index++] = pixels[row][column];
            }
        }
        return values;
    }
}
