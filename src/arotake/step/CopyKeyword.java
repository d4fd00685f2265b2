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
 * Fills a missing keyword with the value of another keyword. Used for the
 * UT/UTC pair, which instruments write under either name.
 */
public class CopyKeyword extends ValidationStep {

    private static final Logger logger = LoggerFactory.getLogger(CopyKeyword.class);

    private final String target;
    private final String source;
    private final String comment;

    public CopyKeyword(String name, String target, String source, String comment) {
        super(name);
        this.target = target;
        this.source = source;
        this.comment = comment;
    }

    /**
     * Sets UTC from UT when UTC is missing.
     */
    public static CopyKeyword utc() {
        return new CopyKeyword("set_utc", "UTC", "UT", "KOA: UTC keyword value");
    }

    /**
     * Sets UT from UTC when UT is missing.
     */
    public static CopyKeyword ut() {
        return new CopyKeyword("set_ut", "UT", "UTC", "KOA: UT keyword value");
    }

    @Override
    public boolean apply(StepContext context) {
        HeaderStore header = context.getHeader();
        if (header.getString(target, "").trim().length() > 0) {
            return true;
        }

        Object value = header.get(source);
        if (value == null || value.toString().trim().length() == 0) {
            logger.error("{}: cannot set {} as {} is missing", context.getExposure().getFileName(), target, source);
            return false;
        }

        logger.info("{}: setting {} from {}", context.getExposure().getFileName(), target, source);
        header.set(target, value, comment);
        return true;
    }
}
