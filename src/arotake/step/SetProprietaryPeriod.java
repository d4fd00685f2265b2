/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.step;

import arotake.StepContext;
import arotake.ValidationStep;
import arotake.archive.ProgramInfo;

/**
 * Records the proprietary period (in months) of the exposure's program in
 * the archive metadata. Files without program information get 0.
 */
public class SetProprietaryPeriod extends ValidationStep {

    public static final String KEYWORD = "PROPINT";

    public SetProprietaryPeriod() {
        super("set_propint");
    }

    @Override
    public boolean apply(StepContext context) {
        ProgramInfo info = context.getProgramInfo();
        int months = (info == null) ? 0 : info.getProprietaryMonths();
        context.getAuxiliaryMetadata().put(KEYWORD, Integer.valueOf(months));
        return true;
    }
}
