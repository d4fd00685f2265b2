/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */

/******************************************************************************
*
*  File      :  MosaicReconstructor.java
*
*  Overview
*  ========
*
*    The MosaicReconstructor takes the segments read out through each
*  amplifier of a mosaic detector and stitches them back into a single
*  image. Each segment has its bias level (measured in the overscan columns)
*  removed, is trimmed of its pre-scan and overscan bands, and is flipped as
*  its DETSEC geometry requires. Segments are then placed left to right in
*  the order of their position on the detector, the two physical rows of
*  the detector are stacked, and the result is stretched for display.
*
******************************************************************************/

package arotake;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MosaicReconstructor {

    private static final Logger logger = LoggerFactory.getLogger(MosaicReconstructor.class);

    /**
     * Fraction of each dimension trimmed from every edge of a segment when
     * measuring its intensity limits.
     */
    static final double SAMPLE_MARGIN = 0.10;

    private final AsinhStretch stretch;

    public MosaicReconstructor() {
        this(new AsinhStretch());
    }

    public MosaicReconstructor(AsinhStretch stretch) {
        this.stretch = stretch;
    }

    /**
     * A segment paired with its parsed geometry.
     */
    private static class Placed {
        final Segment segment;
        final SegmentGeometry geometry;

        Placed(Segment segment, SegmentGeometry geometry) {
            this.segment = segment;
            this.geometry = geometry;
        }
    }

    //****************************************************************************
    /**
     * Reassembles the segments into one normalised image with fresh intensity
     * bounds.
     *
     * @see #reconstruct(List, OverscanRegion, IntensityBounds)
     */
    public double[][] reconstruct(List<Segment> segments, OverscanRegion overscan) throws GeometryParseException {
        return reconstruct(segments, overscan, new IntensityBounds());
    }

    //****************************************************************************
    /**
     * Reassembles the segments into one normalised image.
     *
     * @param segments the detector segments, in any order.
     * @param overscan the pre-scan and overscan widths of every segment.
     * @param bounds accumulates the intensity limits used for the stretch.
     * @return the stretched mosaic with values in [0, 1], indexed [row][column].
     * @throws GeometryParseException if any segment's placement cannot be
     *         determined, the segments do not fit together, or none is large
     *         enough to sample display limits from. No partial mosaic is
     *         produced.
     */
    public double[][] reconstruct(List<Segment> segments, OverscanRegion overscan, IntensityBounds bounds)
            throws GeometryParseException {
        if (segments == null || segments.isEmpty()) {
            throw new GeometryParseException("There are no segments to reconstruct a mosaic from.");
        }
        if (overscan == null) {
            throw new IllegalArgumentException("Cannot reconstruct a mosaic without the overscan region.");
        }
        if (bounds == null) {
            throw new IllegalArgumentException("Cannot reconstruct a mosaic without intensity bounds to fill.");
        }

        List<List<Placed>> rows = partitionRows(segments);

        List<double[][]> rowImages = new ArrayList<double[][]>();
        for (List<Placed> row : rows) {
            if (row.isEmpty()) {
                rowImages.add(null);
                continue;
            }
            List<double[][]> tiles = new ArrayList<double[][]>();
            for (Placed placed : row) {
                tiles.add(prepareSegment(placed, overscan, bounds));
            }
            rowImages.add(concatenateHorizontally(tiles));
        }

        double[][] mosaic;
        double[][] first = rowImages.get(0);
        double[][] second = rowImages.get(1);
        if (first != null && second != null) {
            mosaic = rotateClockwise(stackVertically(first, second));
        } else if (first != null) {
            mosaic = first;
        } else {
            mosaic = second;
        }

        if (!bounds.isSet()) {
            throw new GeometryParseException("No segment is large enough to measure display limits from ("
                    + segments.size() + " segments, overscan " + overscan + ").");
        }

        logger.debug("Reconstructed a {}x{} mosaic from {} segments, display limits {}",
                mosaic.length, mosaic[0].length, segments.size(), bounds);

        return stretch.apply(mosaic, bounds.getMin(), bounds.getMax());
    }

    //****************************************************************************
    // Splits the segments into the two physical rows of the detector and sorts
    // each row into left-to-right order.
    private List<List<Placed>> partitionRows(List<Segment> segments) throws GeometryParseException {
        List<List<Placed>> rows = new ArrayList<List<Placed>>();
        rows.add(new ArrayList<Placed>());
        rows.add(new ArrayList<Placed>());

        for (Segment segment : segments) {
            SegmentGeometry geometry = segment.getGeometry();
            rows.get(geometry.getMosaicRow()).add(new Placed(segment, geometry));
        }

        Comparator<Placed> byColumn = new Comparator<Placed>() {
            public int compare(Placed a, Placed b) {
                return Integer.compare(a.geometry.getX1(), b.geometry.getX1());
            }
        };
        for (List<Placed> row : rows) {
            Collections.sort(row, byColumn);
        }
        return rows;
    }

    //****************************************************************************
    // Removes the bias, records the intensity limits, trims and orients one
    // segment.
    private double[][] prepareSegment(Placed placed, OverscanRegion overscan, IntensityBounds bounds)
            throws GeometryParseException {
        int[][] pixels = placed.segment.getPixels();
        final int numRows = placed.segment.getHeight();
        final int numColumns = placed.segment.getWidth();

        for (int row = 0; row < numRows; ++row) {
            if (pixels[row].length != numColumns) {
                throw new GeometryParseException("Segment from extension " + placed.segment.getExtension()
                        + " is not rectangular (row " + row + " has " + pixels[row].length + " columns, expected "
                        + numColumns + ")");
            }
        }

        double[][] data = subtractBias(pixels, overscan.getPostpix());

        double[] limits = sampleLimits(data, overscan);
        if (limits != null) {
            bounds.include(limits[0], limits[1]);
        }

        double[][] active = trim(data, overscan);
        if (active.length == 0 || active[0].length == 0) {
            throw new GeometryParseException("Segment from extension " + placed.segment.getExtension()
                    + " has no active area once the overscan (" + overscan + ") is removed.");
        }

        if (placed.geometry.isColumnDescending()) {
            active = flipHorizontally(active);
        }
        if (placed.geometry.isRowDescending()) {
            active = flipVertically(active);
        }
        return active;
    }

    //****************************************************************************
    /**
     * Subtracts from every row the median of that row's trailing overscan
     * band. The median is truncated to a whole number of counts.
     */
    static double[][] subtractBias(int[][] pixels, int postpix) {
        final int numRows = pixels.length;
        final int numColumns = numRows == 0 ? 0 : pixels[0].length;

        // The band skips the first and last overscan columns, which can carry
        // charge from the active area and the readout transient.
        int bandStart = numColumns - postpix + 1;
        int bandEnd = numColumns - 1;
        if (bandStart >= bandEnd) {
            bandStart = numColumns - postpix;
            bandEnd = numColumns;
        }

        double[][] result = new double[numRows][numColumns];
        double[] band = new double[Math.max(0, bandEnd - bandStart)];
        for (int row = 0; row < numRows; ++row) {
            long bias = 0;
            if (postpix > 0 && band.length > 0) {
                for (int column = bandStart; column < bandEnd; ++column) {
                    band[column - bandStart] = pixels[row][column];
                }
                bias = (long) median(band);
            }
            for (int column = 0; column < numColumns; ++column) {
                result[row][column] = pixels[row][column] - bias;
            }
        }
        return result;
    }

    /**
     * Returns the median of the values, averaging the two central values
     * when there is an even number. The array is sorted in place.
     */
    static double median(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot take the median of an empty array.");
        }
        java.util.Arrays.sort(values);
        int middle = values.length / 2;
        if (values.length % 2 == 1) {
            return values[middle];
        }
        return (values[middle - 1] + values[middle]) / 2.0;
    }

    //****************************************************************************
    /**
     * Returns {min, max} over the central box of the active area, trimmed by
     * the pre/post bands and a further 10% of each dimension. Returns null if
     * the box is empty.
     */
    static double[] sampleLimits(double[][] data, OverscanRegion overscan) {
        final int numRows = data.length;
        final int numColumns = numRows == 0 ? 0 : data[0].length;

        int rowStart = (int) (overscan.getPreline() + numRows * SAMPLE_MARGIN);
        int rowEnd = (int) (numRows - overscan.getPostline() - numRows * SAMPLE_MARGIN);
        int columnStart = (int) (overscan.getPrecol() + numColumns * SAMPLE_MARGIN);
        int columnEnd = (int) (numColumns - overscan.getPostpix() - numColumns * SAMPLE_MARGIN);

        if (rowStart >= rowEnd || columnStart >= columnEnd) {
            return null;
        }

        double minValue = Double.MAX_VALUE;
        double maxValue = -Double.MAX_VALUE;
        for (int row = rowStart; row < rowEnd; ++row) {
            for (int column = columnStart; column < columnEnd; ++column) {
                double value = data[row][column];
                if (value < minValue) {
                    minValue = value;
                }
                if (value > maxValue) {
                    maxValue = value;
                }
            }
        }
        return new double[] {minValue, maxValue};
    }

    //****************************************************************************
    /**
     * Removes the pre-scan and overscan columns and rows.
     */
    static double[][] trim(double[][] data, OverscanRegion overscan) {
        final int numRows = data.length;
        final int numColumns = numRows == 0 ? 0 : data[0].length;

        int rowStart = overscan.getPreline();
        int rowEnd = numRows - overscan.getPostline();
        int columnStart = overscan.getPrecol();
        int columnEnd = numColumns - overscan.getPostpix();

        if (rowStart >= rowEnd || columnStart >= columnEnd) {
            return new double[0][0];
        }

        double[][] result = new double[rowEnd - rowStart][columnEnd - columnStart];
        for (int row = rowStart; row < rowEnd; ++row) {
            System.arraycopy(data[row], columnStart, result[row - rowStart], 0, columnEnd - columnStart);
        }
        return result;
    }

    static double[][] flipHorizontally(double[][] data) {
        double[][] result = new double[data.length][];
        for (int row = 0; row < data.length; ++row) {
            int numColumns = data[row].length;
            result[row] = new double[numColumns];
            for (int column = 0; column < numColumns; ++column) {
                result[row][column] = data[row][numColumns - 1 - column];
            }
        }
        return result;
    }

    static double[][] flipVertically(double[][] data) {
        double[][] result = new double[data.length][];
        for (int row = 0; row < data.length; ++row) {
            result[row] = data[data.length - 1 - row].clone();
        }
        return result;
    }

    //****************************************************************************
    // Places the tiles side by side. All tiles must have the same height.
    static double[][] concatenateHorizontally(List<double[][]> tiles) throws GeometryParseException {
        final int numRows = tiles.get(0).length;
        int totalColumns = 0;
        for (double[][] tile : tiles) {
            if (tile.length != numRows) {
                throw new GeometryParseException("Cannot place segments of height " + tile.length + " and "
                        + numRows + " in the same mosaic row.");
            }
            totalColumns += tile[0].length;
        }

        double[][] result = new double[numRows][totalColumns];
        int offset = 0;
        for (double[][] tile : tiles) {
            int tileColumns = tile[0].length;
            for (int row = 0; row < numRows; ++row) {
                System.arraycopy(tile[row], 0, result[row], offset, tileColumns);
            }
            offset += tileColumns;
        }
        return result;
    }

    //****************************************************************************
    // Places the first array above the second. Both must have the same width.
    static double[][] stackVertically(double[][] top, double[][] bottom) throws GeometryParseException {
        if (top[0].length != bottom[0].length) {
            throw new GeometryParseException("Cannot stack mosaic rows of width " + top[0].length + " and "
                    + bottom[0].length);
        }
        double[][] result = new double[top.length + bottom.length][];
        for (int row = 0; row < top.length; ++row) {
            result[row] = top[row];
        }
        for (int row = 0; row < bottom.length; ++row) {
            result[top.length + row] = bottom[row];
        }
        return result;
    }

    //****************************************************************************
    /**
     * Rotates the array a quarter turn clockwise: the first row becomes the
     * last column.
     */
    static double[][] rotateClockwise(double[][] data) {
        final int numRows = data.length;
        final int numColumns = data[0].length;
        double[][] result = new double[numColumns][numRows];
        for (int row = 0; row < numColumns; ++row) {
            for (int column = 0; column < numRows; ++column) {
                result[row][column] = data[numRows - 1 - column][row];
            }
        }
        return result;
    }
}
