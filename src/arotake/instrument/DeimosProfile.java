/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.instrument;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.BatchContext;
import arotake.DecisionList;
import arotake.Exposure;
import arotake.FitsFiles;
import arotake.HeaderStore;
import arotake.IdentifierGenerator;
import arotake.Segment;
import arotake.StepContext;
import arotake.ValidationStep;
import arotake.step.CheckInstrument;
import arotake.step.CopyKeyword;
import arotake.step.SetDataLevel;
import arotake.step.SetDateObs;
import arotake.step.SetDqaDate;
import arotake.step.SetDqaVersion;
import arotake.step.SetIdentifier;
import arotake.step.SetImageType;
import arotake.step.SetProgramInfo;
import arotake.step.SetProprietaryPeriod;
import arotake.step.SetSaturatedPixels;
import arotake.step.SetSemester;

/**
 * The DEIMOS multi-object spectrograph. Science exposures are written as one
 * image extension per detector amplifier, and the flexure compensation
 * system (FCS) camera writes its own single images alongside them.
 */
public class DeimosProfile extends AbstractInstrumentProfile {

    private static final Logger logger = LoggerFactory.getLogger(DeimosProfile.class);

    public static final String NAME = "DEIMOS";

    /**
     * Identifier prefix of science and calibration exposures.
     */
    public static final String PREFIX = "DE";

    /**
     * Identifier prefix of FCS images.
     */
    public static final String FCS_PREFIX = "DF";

    /**
     * Written for values that cannot be determined.
     */
    public static final String NULL_VALUE = "null";

    /**
     * The pixel value at which the DEIMOS detectors saturate.
     */
    public static final double SATURATION = 65535;

    /**
     * The spatial pixel scale in arcsec per pixel.
     */
    public static final double SPATIAL_SCALE = 0.1185;

    static final int MAX_EXTENSIONS = 16;

    /**
     * The properties of a grating.
     */
    public static class Grating {

        private final int wavelength;
        private final double dispersion;
        private final int length;

        Grating(int wavelength, double dispersion, int length) {
            this.wavelength = wavelength;
            this.dispersion = dispersion;
            this.length = length;
        }

        /**
         * The blaze wavelength in angstroms.
         */
        public int getWavelength() {
            return wavelength;
        }

        /**
         * The dispersion in angstroms per pixel.
         */
        public double getDispersion() {
            return dispersion;
        }

        /**
         * The spectral coverage in angstroms.
         */
        public int getLength() {
            return length;
        }
    }

    /**
     * The pass band of an imaging filter, in angstroms.
     */
    public static class Filter {

        private final int blue;
        private final int centre;
        private final int red;

        Filter(int blue, int centre, int red) {
            this.blue = blue;
            this.centre = centre;
            this.red = red;
        }

        public int getBlue() {
            return blue;
        }

        public int getCentre() {
            return centre;
        }

        public int getRed() {
            return red;
        }
    }

    private static final Map<String, Grating> GRATINGS;
    private static final Map<String, Filter> FILTERS;

    static {
        Map<String, Grating> gratings = new LinkedHashMap<String, Grating>();
        gratings.put("600ZD", new Grating(7500, 0.65, 5300));
        gratings.put("830G", new Grating(8640, 0.47, 3840));
        gratings.put("900ZD", new Grating(5500, 0.44, 3530));
        gratings.put("1200G", new Grating(7760, 0.33, 2630));
        gratings.put("1200B", new Grating(4500, 0.33, 2630));
        GRATINGS = Collections.unmodifiableMap(gratings);

        Map<String, Filter> filters = new LinkedHashMap<String, Filter>();
        filters.put("B", new Filter(4200, 4400, 4600));
        filters.put("V", new Filter(5150, 5450, 5750));
        filters.put("R", new Filter(6100, 6500, 6900));
        filters.put("I", new Filter(7600, 8400, 9200));
        filters.put("Z", new Filter(8600, 9100, 9600));
        filters.put("GG400", new Filter(4000, 7250, 10500));
        filters.put("GG455", new Filter(4550, 7525, 10500));
        filters.put("GG495", new Filter(4950, 7725, 10500));
        filters.put("OG550", new Filter(5500, 8000, 10500));
        filters.put("NG8560", new Filter(8400, 8550, 8700));
        filters.put("NG8580", new Filter(8550, 8600, 8650));
        FILTERS = Collections.unmodifiableMap(filters);
    }

    private final DecisionList<String> observingModes = observingModeRules();

    public DeimosProfile() {
        super(NAME, DEFAULT_END_OF_NIGHT);

        addAlias("OFNAME", "DATAFILE");

        addStep(new CheckInstrument());
        addStep(new SetFcsDateTime());
        addStep(new SetDateObs());
        addStep(CopyKeyword.ut());
        addStep(new SetImageType(imageTypeRules()));
        addStep(new SetIdentifier());
        addStep(new SetFcsIdentifier());
        addStep(new SetOriginalFileName());
        addStep(new SetSemester());
        addStep(new SetProgramInfo());
        addStep(new SetProprietaryPeriod());
        addStep(new SetDataLevel(0));
        addStep(new SetDqaVersion());
        addStep(new SetDqaDate());
        addStep(new SetCamera());
        addStep(new SetFilter());
        addStep(new SetModifiedJulianDate());
        addStep(new SetObservingMode());
        addStep(new SetExtensionCount());
        addStep(new SetDetectorSections());
        addStep(new SetSaturatedPixels(Double.valueOf(SATURATION)));
        addStep(new SetWavelengths());
        addStep(new SetSpatialScale());
        addStep(new SetDispersionScale());
        addStep(new SetSpectralResolution());

        addMetadataKeywords("KOAID", "OFNAME", "INSTRUME", "DATE-OBS", "UTC", "UT", "KOAIMTYP", "SEMESTER",
                "PROGID", "PROGINST", "PROGPI", "PROGTITL", "PROPINT", "DATLEVEL", "CAMERA", "FILTER", "MJD",
                "OBSMODE", "GRATENAM", "SLMSKNAM", "NEXTEN", "NPIXSAT", "WAVEBLUE", "WAVECNTR", "WAVERED",
                "SPATSCAL", "DISPSCAL", "SPECRES", "FCSKOAID", "DQA_VERS", "DQA_DATE");
    }

    public static Map<String, Grating> getGratings() {
        return GRATINGS;
    }

    public static Map<String, Filter> getFilters() {
        return FILTERS;
    }

    /**
     * Returns true if the header belongs to an image from the FCS camera.
     */
    static boolean isFcsImage(HeaderStore header) {
        return header.getString("OUTDIR", "").contains("/fcs");
    }

    public String getIdentifierPrefix(HeaderStore header) {
        if (isFcsImage(header)) {
            return FCS_PREFIX;
        }
        if (lower(header, "INSTRUME").contains("deimos")) {
            return PREFIX;
        }
        return "";
    }

    /**
     * FCS images are single frames; everything else is a detector mosaic.
     */
    @Override
    public boolean usesMosaicPreview(Exposure exposure) {
        String identifier = exposure.getIdentifier();
        if (identifier != null && identifier.startsWith(FCS_PREFIX + ".")) {
            return false;
        }
        return !isFcsImage(exposure.getHeader());
    }

    /**
     * Assigns identifiers to the FCS images of the batch, so that science
     * exposures can refer to the FCS image taken with them.
     */
    @Override
    public void prepareBatch(List<Path> files, FitsFiles loader, BatchContext batch) {
        IdentifierGenerator generator = new IdentifierGenerator();
        ValidationStep[] timing = new ValidationStep[] {
            new SetFcsDateTime(), CopyKeyword.utc(), new SetDateObs()
        };

        for (Path file : files) {
            Exposure exposure;
            try {
                exposure = loader.load(file);
            } catch (IOException ex) {
                logger.warn("Unable to read {} while listing FCS images: {}", file, ex.getMessage());
                continue;
            }

            HeaderStore header = exposure.getHeader();
            if (!FCS_PREFIX.equals(getIdentifierPrefix(header))) {
                continue;
            }

            StepContext context = new StepContext(exposure, this, batch);
            for (ValidationStep step : timing) {
                step.apply(context);
            }
            try {
                String identifier = generator.generate(FCS_PREFIX, header.getString("DATE-OBS"),
                        header.getString("UTC"));
                batch.putAuxiliaryIdentifier(exposure.getFileName(), identifier);
            } catch (IllegalArgumentException ex) {
                logger.warn("Unable to identify FCS image {}: {}", file, ex.getMessage());
            }
        }
        logger.info("Found {} FCS images", batch.getAuxiliaryIdentifierCount());
    }

    /**
     * The ordered image type rules.
     */
    static DecisionList<String> imageTypeRules() {
        DecisionList<String> rules = new DecisionList<String>(SetImageType.UNDEFINED);
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return isFcsImage(header);
            }
        }, "fcscal");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return "bias".equals(lower(header, "OBSTYPE"));
            }
        }, "bias");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return "dark".equals(lower(header, "OBSTYPE"));
            }
        }, "dark");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return lower(header, "SLMSKNAM").startsWith("goh");
            }
        }, "focus");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return "closed".equals(lower(header, "HATCHPOS")) && lower(header, "LAMPS").contains("qz");
            }
        }, "flatlamp");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return "open".equals(lower(header, "HATCHPOS"))
                        && ("on".equals(lower(header, "FLIMAGIN")) || "on".equals(lower(header, "FLSPECTR")));
            }
        }, "flatlamp");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                String lamps = lower(header, "LAMPS");
                return "closed".equals(lower(header, "HATCHPOS")) && !lamps.contains("off") && !lamps.contains("qz")
                        && isSpectroscopicPosition(header);
            }
        }, "arclamp");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return "open".equals(lower(header, "HATCHPOS"));
            }
        }, "object");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return header.getString("OUTDIR", "").contains("fcs");
            }
        }, "fcscal");
        return rules;
    }

    /**
     * The ordered observing mode rules.
     */
    static DecisionList<String> observingModeRules() {
        DecisionList<String> rules = new DecisionList<String>(NULL_VALUE);
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                String grating = lower(header, "GRATENAM");
                return grating.length() == 0 || "unknown".equals(grating) || "none".equals(grating);
            }
        }, "unknown");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return "mirror".equals(lower(header, "GRATENAM"));
            }
        }, "imaging");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return isSpectroscopicPosition(header)
                        && "zeroth_order".equals(lower(header, "G" + header.getInteger("GRATEPOS", 0) + "TLTNAM"));
            }
        }, "imaging");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                String mask = header.getString("SLMSKNAM", "");
                return isSpectroscopicPosition(header) && (mask.startsWith("LVM") || mask.startsWith("Long"));
            }
        }, "longslit");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return isSpectroscopicPosition(header);
            }
        }, "mos");
        return rules;
    }

    // Gratings are mounted in slider positions 3 and 4.
    static boolean isSpectroscopicPosition(HeaderStore header) {
        long position = header.getInteger("GRATEPOS", 0);
        return position == 3 || position == 4;
    }

    static boolean isSpectroscopic(String observingMode) {
        return "longslit".equals(observingMode) || "mos".equals(observingMode);
    }

    /**
     * Rounds to the nearest ten, halves to even.
     */
    static long roundToTens(double value) {
        return BigDecimal.valueOf(value).setScale(-1, RoundingMode.HALF_EVEN).longValue();
    }

    /**
     * FCS images carry their write time in DATE rather than in DATE-OBS and
     * UTC.
     */
    static class SetFcsDateTime extends ValidationStep {

        SetFcsDateTime() {
            super("set_fcs_date_time");
        }

        @Override
        public boolean apply(StepContext context) {
            HeaderStore header = context.getHeader();
            String date = header.getString("DATE", "");
            if (!isFcsImage(header) || date.indexOf('T') < 0) {
                return true;
            }

            int split = date.indexOf('T');
            logger.info("{}: setting DATE-OBS and UTC from DATE", context.getExposure().getFileName());
            header.set("DATE-OBS", date.substring(0, split), "KOA: Observing date");
            header.set("UTC", date.substring(split + 1) + ".00", "KOA: Observing time");
            return true;
        }
    }

    /**
     * Records the identifier of the FCS image named by FCSIMGFI.
     */
    static class SetFcsIdentifier extends ValidationStep {

        SetFcsIdentifier() {
            super("set_fcskoaid");
        }

        @Override
        public boolean apply(StepContext context) {
            String fcsFile = context.getHeader().getString("FCSIMGFI", "").trim();
            fcsFile = fcsFile.substring(fcsFile.lastIndexOf('/') + 1);

            String identifier = fcsFile.length() == 0 ? null : context.getBatch().getAuxiliaryIdentifier(fcsFile);
            context.getHeader().set(HeaderStore.FCS_IDENTIFIER_KEYWORD, identifier == null ? "" : identifier,
                    "KOA: associated fcs file");
            return true;
        }
    }

    /**
     * OFNAME is OUTFILE followed by the four digit frame number.
     */
    static class SetOriginalFileName extends ValidationStep {

        SetOriginalFileName() {
            super("set_ofName");
        }

        @Override
        public boolean apply(StepContext context) {
            HeaderStore header = context.getHeader();
            String outFile = header.getString("OUTFILE");
            Long frameNumber = header.getInteger("FRAMENO");
            if (outFile == null || frameNumber == null) {
                logger.error("{}: could not determine OFNAME", context.getExposure().getFileName());
                return false;
            }

            String fileName = outFile.trim() + String.format("%04d", frameNumber) + ".fits";
            header.set("OFNAME", fileName, "KOA: Original file name");
            return true;
        }
    }

    static class SetCamera extends ValidationStep {

        SetCamera() {
            super("set_camera");
        }

        @Override
        public boolean apply(StepContext context) {
            if (context.getHeader().get("CAMERA") == null) {
                context.getHeader().set("CAMERA", NAME, "KOA: Camera name");
            }
            return true;
        }
    }

    static class SetFilter extends ValidationStep {

        SetFilter() {
            super("set_filter");
        }

        @Override
        public boolean apply(StepContext context) {
            String filter = context.getHeader().getString("DWFILNAM");
            if (filter == null) {
                logger.info("{}: could not set FILTER, no DWFILNAM value", context.getExposure().getFileName());
            } else {
                context.getHeader().set("FILTER", filter, "KOA: Filter name");
            }
            return true;
        }
    }

    static class SetModifiedJulianDate extends ValidationStep {

        SetModifiedJulianDate() {
            super("set_mjd");
        }

        @Override
        public boolean apply(StepContext context) {
            Double mjd = context.getHeader().getDouble("MJD-OBS");
            if (mjd == null) {
                logger.info("{}: could not set MJD, no MJD-OBS value", context.getExposure().getFileName());
            } else {
                context.getHeader().set("MJD", mjd, "KOA: Modified julian day");
            }
            return true;
        }
    }

    class SetObservingMode extends ValidationStep {

        SetObservingMode() {
            super("set_obsmode");
        }

        @Override
        public boolean apply(StepContext context) {
            String mode = observingModes.evaluate(context.getHeader());
            context.getHeader().set("OBSMODE", mode, "KOA: Observing mode");
            return true;
        }
    }

    static class SetExtensionCount extends ValidationStep {

        SetExtensionCount() {
            super("set_nexten");
        }

        @Override
        public boolean apply(StepContext context) {
            context.getHeader().set("NEXTEN", Long.valueOf(context.getExposure().getExtensionCount()),
                    "KOA: Number of image extensions");
            return true;
        }
    }

    /**
     * Copies the DETSEC of each image extension into DETSEC01 to DETSEC16
     * of the primary header.
     */
    static class SetDetectorSections extends ValidationStep {

        SetDetectorSections() {
            super("set_detsec");
        }

        @Override
        public boolean apply(StepContext context) {
            Map<Integer, String> sections = new LinkedHashMap<Integer, String>();
            for (Segment segment : context.getExposure().getSegments()) {
                String detsec = segment.getDetectorSection();
                if (segment.getExtension() > 0 && detsec != null) {
                    sections.put(Integer.valueOf(segment.getExtension()), detsec);
                }
            }

            for (int extension = 1; extension <= MAX_EXTENSIONS; ++extension) {
                String number = String.format("%02d", extension);
                String detsec = sections.get(Integer.valueOf(extension));
                context.getHeader().set("DETSEC" + number, detsec == null ? NULL_VALUE : detsec,
                        "KOA: Mosaic detector section for HDU" + number);
            }
            return true;
        }
    }

    /**
     * Sets WAVEBLUE, WAVECNTR and WAVERED from the filter for imaging and
     * from the grating tilt for spectroscopy.
     */
    static class SetWavelengths extends ValidationStep {

        SetWavelengths() {
            super("set_wavelengths");
        }

        @Override
        public boolean apply(StepContext context) {
            HeaderStore header = context.getHeader();
            String mode = header.getString("OBSMODE", NULL_VALUE);
            Object blue = NULL_VALUE;
            Object centre = NULL_VALUE;
            Object red = NULL_VALUE;

            if ("imaging".equals(mode)) {
                Filter filter = FILTERS.get(header.getString("FILTER", "").trim());
                if (filter != null) {
                    blue = Long.valueOf(filter.getBlue());
                    centre = Long.valueOf(filter.getCentre());
                    red = Long.valueOf(filter.getRed());
                }
            } else if (isSpectroscopic(mode)) {
                Grating grating = GRATINGS.get(header.getString("GRATENAM", "").trim());
                Double tilt = header.getDouble("G" + header.getInteger("GRATEPOS", 0) + "TLTWAV");
                if (grating != null && tilt != null) {
                    long middle = roundToTens(tilt.doubleValue());
                    double half = grating.getLength() / 2.0;
                    centre = Long.valueOf(middle);
                    blue = Long.valueOf(roundToTens(middle - half));
                    red = Long.valueOf(roundToTens(middle + half));
                }
            }

            header.set("WAVEBLUE", blue, "KOA: Blue end wavelength");
            header.set("WAVECNTR", centre, "KOA: Center wavelength");
            header.set("WAVERED", red, "KOA: Red end wavelength");
            return true;
        }
    }

    static class SetSpatialScale extends ValidationStep {

        SetSpatialScale() {
            super("set_spatscal");
        }

        @Override
        public boolean apply(StepContext context) {
            context.getHeader().set("SPATSCAL", Double.valueOf(SPATIAL_SCALE), "KOA: CCD spatial pixel scale");
            return true;
        }
    }

    static class SetDispersionScale extends ValidationStep {

        SetDispersionScale() {
            super("set_dispscal");
        }

        @Override
        public boolean apply(StepContext context) {
            HeaderStore header = context.getHeader();
            String mode = header.getString("OBSMODE", NULL_VALUE);
            Object scale = NULL_VALUE;
            String units = "";

            if ("imaging".equals(mode)) {
                scale = Double.valueOf(header.getDouble("SPATSCAL", SPATIAL_SCALE));
                units = " (arcsec/pix)";
            } else if (isSpectroscopic(mode)) {
                Grating grating = GRATINGS.get(header.getString("GRATENAM", "").trim());
                if (grating != null) {
                    scale = Double.valueOf(grating.getDispersion());
                    units = " (A/pix)";
                }
            }

            header.set("DISPSCAL", scale, "KOA: CCD dispersion pixel scale" + units);
            return true;
        }
    }

    static class SetSpectralResolution extends ValidationStep {

        SetSpectralResolution() {
            super("set_specres");
        }

        @Override
        public boolean apply(StepContext context) {
            HeaderStore header = context.getHeader();
            Grating grating = GRATINGS.get(header.getString("GRATENAM", "").trim());
            Object resolution = NULL_VALUE;
            if (grating != null) {
                double scale = header.getDouble("SPATSCAL", SPATIAL_SCALE);
                resolution = Double.valueOf(roundToTens(grating.getWavelength() * scale / grating.getDispersion()));
            }
            header.set("SPECRES", resolution, "KOA: nominal spectral resolution");
            return true;
        }
    }
}
