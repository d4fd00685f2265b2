/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.step;

import arotake.StepContext;
import arotake.ValidationStep;

public class SetDataLevel extends ValidationStep {

    private final int level;

    public SetDataLevel(int level) {
        super("set_datlevel");
        this.level = level;
    }

    @Override
    public boolean apply(StepContext context) {
        context.getHeader().set("DATLEVEL", Long.valueOf(level), "KOA: Data reduction level");
        return true;
    }
}
