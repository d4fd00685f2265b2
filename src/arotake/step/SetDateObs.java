/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.step;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.HeaderStore;
import arotake.StepContext;
import arotake.ValidationStep;

/**
 * Makes sure DATE-OBS holds the UT date as yyyy-mm-dd. A missing value is
 * taken from the date part of the DATE (file write) keyword, and the old
 * dd/mm/yy form is rewritten.
 */
public class SetDateObs extends ValidationStep {

    private static final Logger logger = LoggerFactory.getLogger(SetDateObs.class);

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern OLD_DATE = Pattern.compile("^(\\d{2})/(\\d{2})/(\\d{2})$");

    public SetDateObs() {
        super("set_dateObs");
    }

    @Override
    public boolean apply(StepContext context) {
        HeaderStore header = context.getHeader();
        String fileName = context.getExposure().getFileName();
        String dateObs = header.getString("DATE-OBS", "").trim();

        if (dateObs.length() == 0) {
            String date = header.getString("DATE", "").trim();
            if (date.length() < 10) {
                logger.error("{}: cannot determine DATE-OBS", fileName);
                return false;
            }
            dateObs = date.substring(0, 10);
            logger.info("{}: setting DATE-OBS to {} from DATE", fileName, dateObs);
            header.set("DATE-OBS", dateObs, "KOA: Added missing keyword 'DATE-OBS'");
        }

        Matcher old = OLD_DATE.matcher(dateObs);
        if (old.matches()) {
            String converted = "20" + old.group(3) + "-" + old.group(2) + "-" + old.group(1);
            logger.info("{}: converting DATE-OBS {} to {}", fileName, dateObs, converted);
            header.set("DATE-OBS", converted, "KOA: Value corrected (" + dateObs + ")");
            return true;
        }

        if (!ISO_DATE.matcher(dateObs).matches()) {
            logger.error("{}: unrecognised DATE-OBS value '{}'", fileName, dateObs);
            return false;
        }
        return true;
    }
}
