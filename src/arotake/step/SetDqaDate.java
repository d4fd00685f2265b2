/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.step;

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.TimeZone;

import arotake.StepContext;
import arotake.ValidationStep;

/**
 * Stamps the header with the UTC time the assessment was made.
 */
public class SetDqaDate extends ValidationStep {

    public SetDqaDate() {
        super("set_dqa_date");
    }

    @Override
    public boolean apply(StepContext context) {
        SimpleDateFormat formatter = new SimpleDateFormat("yyyy-MM-dd'T'HH:mm:ss");
        formatter.setTimeZone(TimeZone.getTimeZone("UTC"));
        context.getHeader().set("DQA_DATE", formatter.format(new Date()), "KOA: Data quality assess. time");
        return true;
    }
}
