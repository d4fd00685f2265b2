/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The placement of one detector segment within the mosaic coordinate space,
 * as given by a DETSEC header value of the form [x1:x2,y1:y2]. A segment that
 * was read out right-to-left has x1 greater than x2 (and likewise for rows).
 */
public class SegmentGeometry {

    /**
     * Segments with a row coordinate beyond this value belong to the second
     * physical row of the mosaic.
     */
    public static final int ROW_BOUNDARY = 4096;

    private static final Pattern DETSEC_PATTERN = Pattern.compile("(-?\\d+):(-?\\d+),(-?\\d+):(-?\\d+)");

    private final int x1;
    private final int x2;
    private final int y1;
    private final int y2;

    public SegmentGeometry(int x1, int x2, int y1, int y2) {
        this.x1 = x1;
        this.x2 = x2;
        this.y1 = y1;
        this.y2 = y2;
    }

    /**
     * Parses a detector section string.
     *
     * @param detsec the section, for example "[1:2048,1:4096]".
     * @return the geometry described by the section.
     * @throws GeometryParseException if the section is missing or malformed.
     */
    public static SegmentGeometry parse(String detsec) throws GeometryParseException {
        if (detsec == null) {
            throw new GeometryParseException("No detector section was given.");
        }
        Matcher matcher = DETSEC_PATTERN.matcher(detsec);
        if (!matcher.find()) {
            throw new GeometryParseException("Cannot parse the detector section '" + detsec + "'");
        }
        try {
            return new SegmentGeometry(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)), Integer.parseInt(matcher.group(4)));
        } catch (NumberFormatException ex) {
            throw new GeometryParseException("Detector section '" + detsec + "' is out of range", ex);
        }
    }

    public int getX1() {
        return x1;
    }

    public int getX2() {
        return x2;
    }

    public int getY1() {
        return y1;
    }

    public int getY2() {
        return y2;
    }

    /**
     * True if the segment's columns run right-to-left in the mosaic.
     */
    public boolean isColumnDescending() {
        return x1 > x2;
    }

    /**
     * True if the segment's rows run top-to-bottom in the mosaic.
     */
    public boolean isRowDescending() {
        return y1 > y2;
    }

    /**
     * Returns the physical mosaic row (0 for the first row, 1 for the second).
     */
    public int getMosaicRow() {
        return (y1 > ROW_BOUNDARY || y2 > ROW_BOUNDARY) ? 1 : 0;
    }

    @Override
    public String toString() {
        return "[" + x1 + ":" + x2 + "," + y1 + ":" + y2 + "]";
    }
}
