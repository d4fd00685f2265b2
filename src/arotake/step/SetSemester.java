/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.step;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.StepContext;
import arotake.ValidationStep;

/**
 * Sets SEMESTER from DATE-OBS. Semester A runs from 1 February to 31 July,
 * semester B from 1 August to 31 January (January belongs to the previous
 * year's B semester).
 */
public class SetSemester extends ValidationStep {

    private static final Logger logger = LoggerFactory.getLogger(SetSemester.class);

    public SetSemester() {
        super("set_semester");
    }

    /**
     * Returns the semester containing the given date, for example "2018A".
     */
    public static String semesterOf(LocalDate date) {
        int year = date.getYear();
        int month = date.getMonthValue();
        if (month == 1) {
            return (year - 1) + "B";
        }
        return year + (month < 8 ? "A" : "B");
    }

    @Override
    public boolean apply(StepContext context) {
        String dateObs = context.getHeader().getString("DATE-OBS", "");
        LocalDate date;
        try {
            date = LocalDate.parse(dateObs.trim());
        } catch (DateTimeParseException ex) {
            logger.error("{}: cannot determine semester from DATE-OBS '{}'", context.getExposure().getFileName(), dateObs);
            return false;
        }
        context.getHeader().set("SEMESTER", semesterOf(date), "KOA: Calculated SEMESTER from DATE-OBS");
        return true;
    }
}
