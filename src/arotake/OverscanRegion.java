/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

/**
 * The widths (in binned pixels) of the pre-scan and overscan bands that
 * surround the active area of each detector segment.
 */
public class OverscanRegion {

    /**
     * Leading columns before the active area.
     */
    private final int precol;

    /**
     * Trailing overscan columns after the active area.
     */
    private final int postpix;

    /**
     * Leading rows before the active area.
     */
    private final int preline;

    /**
     * Trailing overscan rows after the active area.
     */
    private final int postline;

    public OverscanRegion(int precol, int postpix, int preline, int postline) {
        if (precol < 0 || postpix < 0 || preline < 0 || postline < 0) {
            throw new IllegalArgumentException("Overscan widths cannot be negative, the values given were precol="
                    + precol + ", postpix=" + postpix + ", preline=" + preline + ", postline=" + postline);
        }
        this.precol = precol;
        this.postpix = postpix;
        this.preline = preline;
        this.postline = postline;
    }

    /**
     * Reads the overscan widths from a primary header using the PRECOL,
     * POSTPIX, PRELINE and POSTLINE keywords, divided by the BINNING factors
     * (given as "columns,rows"). Missing widths are taken as zero.
     */
    public static OverscanRegion fromHeader(HeaderStore header) {
        int columnBinning = 1;
        int rowBinning = 1;
        String binning = header.getString("BINNING", "1,1");
        String[] parts = binning.split(",");
        try {
            if (parts.length > 0) {
                columnBinning = Math.max(1, Integer.parseInt(parts[0].trim()));
            }
            if (parts.length > 1) {
                rowBinning = Math.max(1, Integer.parseInt(parts[1].trim()));
            }
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Cannot interpret the BINNING value '" + binning + "'", ex);
        }

        int precol = (int) (header.getInteger("PRECOL", 0) / columnBinning);
        int postpix = (int) (header.getInteger("POSTPIX", 0) / columnBinning);
        int preline = (int) (header.getInteger("PRELINE", 0) / rowBinning);
        int postline = (int) (header.getInteger("POSTLINE", 0) / rowBinning);
        return new OverscanRegion(precol, postpix, preline, postline);
    }

    public int getPrecol() {
        return precol;
    }

    public int getPostpix() {
        return postpix;
    }

    public int getPreline() {
        return preline;
    }

    public int getPostline() {
        return postline;
    }

    @Override
    public String toString() {
        return "precol=" + precol + ", postpix=" + postpix + ", preline=" + preline + ", postline=" + postline;
    }
}
