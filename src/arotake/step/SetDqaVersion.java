/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.step;

import arotake.StepContext;
import arotake.ValidationStep;

public class SetDqaVersion extends ValidationStep {

    public SetDqaVersion() {
        super("set_dqa_vers");
    }

    @Override
    public boolean apply(StepContext context) {
        String version = context.getBatch().getDqaVersion();
        context.getHeader().set("DQA_VERS", version == null ? "unknown" : version, "KOA: Data quality assess. code version");
        return true;
    }
}
