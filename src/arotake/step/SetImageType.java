/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.DecisionList;
import arotake.StepContext;
import arotake.ValidationStep;

/**
 * Classifies the exposure (bias, dark, flat, arc, object, ...) with the
 * instrument's rules and records the result in KOAIMTYP. An exposure no rule
 * recognises is marked "undefined"; that is not a failure.
 */
public class SetImageType extends ValidationStep {

    private static final Logger logger = LoggerFactory.getLogger(SetImageType.class);

    public static final String KEYWORD = "KOAIMTYP";
    public static final String UNDEFINED = "undefined";

    private final DecisionList<String> rules;

    public SetImageType(DecisionList<String> rules) {
        super("set_koaimtyp");
        if (rules == null) {
            throw new IllegalArgumentException("Image type rules are required.");
        }
        this.rules = rules;
    }

    @Override
    public boolean apply(StepContext context) {
        String imageType = rules.evaluate(context.getHeader());
        if (imageType == null || UNDEFINED.equals(imageType)) {
            imageType = UNDEFINED;
            logger.info("{}: could not determine KOAIMTYP", context.getExposure().getFileName());
        }
        context.getHeader().set(KEYWORD, imageType, "KOA: Image type");
        return true;
    }
}
