/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;

import arotake.instrument.InstrumentProfile;
import arotake.instrument.MosfireProfile;

/**
 * Builds the headers, exposures and files used by the tests.
 */
public class Fixtures {

    public static final LocalDate NIGHT = LocalDate.of(2018, 3, 4);

    private Fixtures() {
    }

    /**
     * A MOSFIRE science header that passes every MOSFIRE step.
     */
    public static HeaderStore mosfireHeader(String dateObs, String utc, int frame) {
        HeaderStore header = new HeaderStore();
        header.load("INSTRUME", "MOSFIRE", "Instrument");
        header.load("DATE-OBS", dateObs, "UT date of observation");
        header.load("UTC", utc, "UT time of observation");
        header.load("ITIME", Double.valueOf(10.5), "Integration time per coadd");
        header.load("COADDS", Long.valueOf(2), "Number of coadds");
        header.load("OBSTYPE", "object", "Observation type");
        header.load("FLATSPEC", Long.valueOf(0), "Flat lamp");
        header.load("PWSTATA7", Long.valueOf(0), "Ne lamp power");
        header.load("PWSTATA8", Long.valueOf(0), "Ar lamp power");
        header.load("DATAFILE", String.format("m180304_%04d", frame), "Data file name");
        header.load("FRAMENUM", Long.valueOf(frame), "Frame number");
        header.load("SATURATE", Long.valueOf(30000), "Saturation level");
        return header;
    }

    /**
     * An 8x8 image with values rising from 100 to 163.
     */
    public static int[][] ramp() {
        int[][] pixels = new int[8][8];
        for (int row = 0; row < 8; ++row) {
            for (int column = 0; column < 8; ++column) {
                pixels[row][column] = 100 + row * 8 + column;
            }
        }
        return pixels;
    }

    public static Exposure exposure(String fileName, HeaderStore header, int[][] pixels) {
        Exposure exposure = new Exposure(Paths.get("/s/sdata1300/mosfire1/" + fileName), header);
        if (pixels != null) {
            exposure.addSegment(new Segment(pixels, header, 0));
        }
        return exposure;
    }

    public static StepContext context(Exposure exposure, InstrumentProfile profile) {
        return new StepContext(exposure, profile, new BatchContext(profile.getName(), NIGHT, "test-1.0"));
    }

    public static StepContext mosfireContext(HeaderStore header) {
        return context(exposure("m180304_0001.fits", header, ramp()), new MosfireProfile());
    }

    /**
     * Writes a MOSFIRE exposure to disk as a single-HDU FITS file.
     */
    public static Path writeMosfire(Path directory, String fileName, String dateObs, String utc, int frame)
            throws IOException {
        Path file = directory.resolve(fileName);
        FitsFiles.saveImage(file, mosfireHeader(dateObs, utc, frame), ramp());
        return file;
    }
}
