/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.HeaderStore;
import arotake.StepContext;
import arotake.ValidationStep;
import arotake.archive.ProgramInfo;

/**
 * Writes the program id, institution, PI and title found by the program
 * lookup. A file the lookup knows nothing about gets "NONE" for each.
 */
public class SetProgramInfo extends ValidationStep {

    private static final Logger logger = LoggerFactory.getLogger(SetProgramInfo.class);

    public static final String NONE = "NONE";

    public SetProgramInfo() {
        super("set_prog_info");
    }

    @Override
    public boolean apply(StepContext context) {
        HeaderStore header = context.getHeader();
        ProgramInfo info = context.getProgramInfo();
        if (info == null) {
            logger.warn("{}: no program information found", context.getExposure().getFileName());
        }

        header.set("PROGID", valueOf(info == null ? null : info.getProgramId()), "KOA: Program ID");
        header.set("PROGINST", valueOf(info == null ? null : info.getInstitution()), "KOA: Program institution");
        header.set("PROGPI", valueOf(info == null ? null : info.getPrincipalInvestigator()), "KOA: Program principal investigator");
        header.set("PROGTITL", valueOf(info == null ? null : info.getTitle()), "KOA: Program title");
        return true;
    }

    private static String valueOf(String text) {
        return (text == null || text.trim().length() == 0) ? NONE : text.trim();
    }
}
