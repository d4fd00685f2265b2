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

/**
 * Derives a missing ELAPTIME as the integration time per coadd (ITIME)
 * multiplied by the number of coadds (COADDS).
 */
public class SetElapsedTime extends ValidationStep {

    private static final Logger logger = LoggerFactory.getLogger(SetElapsedTime.class);

    public SetElapsedTime() {
        super("set_elaptime");
    }

    @Override
    public boolean apply(StepContext context) {
        HeaderStore header = context.getHeader();
        if (header.get("ELAPTIME") != null) {
            return true;
        }

        Double itime = header.getDouble("ITIME");
        Long coadds = header.getInteger("COADDS");
        if (itime == null || coadds == null) {
            logger.error("{}: ITIME and COADDS values needed to set ELAPTIME", context.getExposure().getFileName());
            return false;
        }

        double elapsed = itime.doubleValue() * coadds.longValue();
        logger.info("{}: ELAPTIME = {} from ITIME/COADDS", context.getExposure().getFileName(), elapsed);
        header.set("ELAPTIME", Double.valueOf(elapsed), "KOA: Total integration time");
        return true;
    }
}
