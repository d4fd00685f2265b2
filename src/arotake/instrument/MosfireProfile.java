/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.instrument;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.DecisionList;
import arotake.HeaderStore;
import arotake.StepContext;
import arotake.ValidationStep;
import arotake.step.CheckInstrument;
import arotake.step.CopyKeyword;
import arotake.step.SetDataLevel;
import arotake.step.SetDateObs;
import arotake.step.SetDqaDate;
import arotake.step.SetDqaVersion;
import arotake.step.SetElapsedTime;
import arotake.step.SetFrameNumber;
import arotake.step.SetIdentifier;
import arotake.step.SetImageStatistics;
import arotake.step.SetImageType;
import arotake.step.SetProgramInfo;
import arotake.step.SetProprietaryPeriod;
import arotake.step.SetSaturatedPixels;
import arotake.step.SetSemester;

/**
 * The MOSFIRE near-infrared spectrograph. Exposures are single images.
 */
public class MosfireProfile extends AbstractInstrumentProfile {

    private static final Logger logger = LoggerFactory.getLogger(MosfireProfile.class);

    public static final String NAME = "MOSFIRE";
    public static final String PREFIX = "MF";

    public MosfireProfile() {
        super(NAME, DEFAULT_END_OF_NIGHT);

        addAlias("OFNAME", "DATAFILE");
        addAlias("FRAMENO", "FRAMENUM");

        addStep(new CheckInstrument());
        addStep(new SetDateObs());
        addStep(CopyKeyword.utc());
        addStep(new SetElapsedTime());
        addStep(new SetImageType(imageTypeRules()));
        addStep(new SetIdentifier());
        addStep(CopyKeyword.ut());
        addStep(new SetFrameNumber());
        addStep(new SetOriginalFileName());
        addStep(new SetSemester());
        addStep(new SetProgramInfo());
        addStep(new SetProprietaryPeriod());
        addStep(new SetDataLevel(0));
        addStep(new SetImageStatistics());
        addStep(new SetSaturatedPixels());
        addStep(new SetDqaDate());
        addStep(new SetDqaVersion());

        addMetadataKeywords("KOAID", "OFNAME", "INSTRUME", "DATE-OBS", "UTC", "UT", "KOAIMTYP", "SEMESTER",
                "PROGID", "PROGINST", "PROGPI", "PROGTITL", "PROPINT", "DATLEVEL", "ELAPTIME", "ITIME", "COADDS",
                "FRAMENO", "OBSTYPE", "IMAGEMN", "IMAGEMD", "IMAGESD", "NPIXSAT", "DQA_VERS", "DQA_DATE");
    }

    /**
     * The ordered image type rules. The Ne and Ar arc lamps are reported by
     * power strip outlets 7 and 8.
     */
    static DecisionList<String> imageTypeRules() {
        DecisionList<String> rules = new DecisionList<String>(SetImageType.UNDEFINED);
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return "dark".equals(lower(header, "OBSTYPE"));
            }
        }, "dark");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return header.getInteger("FLATSPEC", 0) == 1;
            }
        }, "flatlamp");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return header.getInteger("PWSTATA7", 0) == 1 || header.getInteger("PWSTATA8", 0) == 1;
            }
        }, "arclamp");
        rules.add(new DecisionList.Condition() {
            public boolean matches(HeaderStore header) {
                return "object".equals(lower(header, "OBSTYPE"));
            }
        }, "object");
        return rules;
    }

    public String getIdentifierPrefix(HeaderStore header) {
        return lower(header, "INSTRUME").contains("mosfire") ? PREFIX : "";
    }

    /**
     * OFNAME is the DATAFILE keyword with the .fits extension that older
     * files leave off.
     */
    static class SetOriginalFileName extends ValidationStep {

        SetOriginalFileName() {
            super("set_ofName");
        }

        @Override
        public boolean apply(StepContext context) {
            String fileName = context.getKeyword("OFNAME");
            if (fileName == null || fileName.trim().length() == 0) {
                logger.error("{}: cannot find value for OFNAME", context.getExposure().getFileName());
                return false;
            }
            fileName = fileName.trim();
            if (!fileName.endsWith(".fits")) {
                fileName += ".fits";
            }
            context.getHeader().set("OFNAME", fileName, "KOA: Original file name");
            return true;
        }
    }
}
