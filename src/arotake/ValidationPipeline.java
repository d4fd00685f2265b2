/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.instrument.InstrumentProfile;

/**
 * Applies an instrument's validation steps to one exposure, in order,
 * stopping at the first step that fails. The remaining steps are not run and
 * nothing is retried; the caller decides what to do with the exposure.
 */
public class ValidationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ValidationPipeline.class);

    /**
     * Runs every step of the profile against the exposure in the context.
     *
     * @param profile the instrument whose steps are applied.
     * @param context the exposure and batch. Its header is modified in place.
     * @return true if every step succeeded.
     */
    public boolean run(InstrumentProfile profile, StepContext context) {
        List<ValidationStep> steps = profile.getSteps();
        String fileName = context.getExposure().getFileName();

        for (ValidationStep step : steps) {
            boolean ok;
            try {
                ok = step.apply(context);
            } catch (RuntimeException ex) {
                logger.error("{}: step {} raised an error", fileName, step.getName(), ex);
                ok = false;
            }

            if (!ok) {
                context.setFailedStep(step.getName());
                logger.error("{}: validation failed at step {}", fileName, step.getName());
                return false;
            }
            logger.debug("{}: step {} ok", fileName, step.getName());
        }
        return true;
    }
}
