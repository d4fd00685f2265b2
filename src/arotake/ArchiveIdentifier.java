/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The parts of an archive identifier such as "DE.20180304.071532.25.fits":
 * the instrument prefix, the UT date (yyyyMMdd), the UT time of day
 * (HHmmss.ff) and the fixed ".fits" suffix.
 */
public class ArchiveIdentifier {

    public static final String SUFFIX = ".fits";

    static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private static final Pattern PATTERN =
            Pattern.compile("^([A-Z]+)\\.(\\d{8})\\.((\\d{2})(\\d{2})(\\d{2})\\.(\\d{2}))" + Pattern.quote(SUFFIX) + "$");

    private final String prefix;
    private final LocalDate date;
    private final String time;

    private ArchiveIdentifier(String prefix, LocalDate date, String time) {
        this.prefix = prefix;
        this.date = date;
        this.time = time;
    }

    /**
     * Splits an identifier into its parts.
     *
     * @return the parsed identifier, or null if the text is not a well formed
     *         identifier.
     */
    public static ArchiveIdentifier parse(String identifier) {
        if (identifier == null) {
            return null;
        }
        Matcher matcher = PATTERN.matcher(identifier.trim());
        if (!matcher.matches()) {
            return null;
        }

        LocalDate date;
        try {
            date = LocalDate.parse(matcher.group(2), DATE_FORMAT);
        } catch (DateTimeParseException ex) {
            return null;
        }

        int hours = Integer.parseInt(matcher.group(4));
        int minutes = Integer.parseInt(matcher.group(5));
        int seconds = Integer.parseInt(matcher.group(6));
        if (hours > 23 || minutes > 59 || seconds > 60) {
            return null;
        }
        return new ArchiveIdentifier(matcher.group(1), date, matcher.group(3));
    }

    public String getPrefix() {
        return prefix;
    }

    public LocalDate getDate() {
        return date;
    }

    /**
     * The date as it appears in the identifier (yyyyMMdd).
     */
    public String getDateText() {
        return date.format(DATE_FORMAT);
    }

    /**
     * The time of day as it appears in the identifier (HHmmss.ff).
     */
    public String getTime() {
        return time;
    }

    /**
     * The time of day read as a plain number, so 10:15:30.25 is 101530.25.
     */
    public double getTimeValue() {
        return Double.parseDouble(time);
    }

    @Override
    public String toString() {
        return prefix + "." + getDateText() + "." + time + SUFFIX;
    }
}
