/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds archive identifiers of the form
 * {@code <prefix>.<yyyyMMdd>.<HHmmss.ff>.fits} from an exposure's UT date
 * and time. Fractions of a second are truncated to hundredths so that an
 * identifier never rounds into the following second.
 */
public class IdentifierGenerator {

    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{1,2}):(\\d{1,2})(?:\\.(\\d+))?$");

    /**
     * Builds the identifier for an observation timestamp.
     *
     * @param prefix the instrument prefix, for example "DE".
     * @param timestamp the UT start of the exposure.
     * @throws IllegalArgumentException if the prefix is blank.
     */
    public String generate(String prefix, LocalDateTime timestamp) {
        if (prefix == null || prefix.trim().length() == 0) {
            throw new IllegalArgumentException("Cannot create an identifier without an instrument prefix.");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Cannot create an identifier without an observation time.");
        }
        int hundredths = timestamp.getNano() / 10000000;
        return String.format("%s.%s.%02d%02d%02d.%02d%s", prefix.trim(), timestamp.toLocalDate().format(ArchiveIdentifier.DATE_FORMAT),
                timestamp.getHour(), timestamp.getMinute(), timestamp.getSecond(), hundredths, ArchiveIdentifier.SUFFIX);
    }

    /**
     * Builds the identifier from the DATE-OBS and UTC header values.
     *
     * @param prefix the instrument prefix.
     * @param dateObs the UT date, yyyy-MM-dd.
     * @param utc the UT time, HH:mm:ss with an optional fraction.
     * @throws IllegalArgumentException if the date or time cannot be parsed.
     */
    public String generate(String prefix, String dateObs, String utc) {
        return generate(prefix, parseTimestamp(dateObs, utc));
    }

    /**
     * Combines DATE-OBS and UTC header values into a timestamp.
     *
     * @throws IllegalArgumentException if either value cannot be parsed.
     */
    public static LocalDateTime parseTimestamp(String dateObs, String utc) {
        if (dateObs == null || utc == null) {
            throw new IllegalArgumentException("Both the date and the time of the observation are needed, got '"
                    + dateObs + "' and '" + utc + "'");
        }

        LocalDate date;
        try {
            String text = dateObs.trim();
            date = LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Cannot parse the observation date '" + dateObs + "'", ex);
        }

        Matcher matcher = TIME_PATTERN.matcher(utc.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Cannot parse the observation time '" + utc + "'");
        }
        int hours = Integer.parseInt(matcher.group(1));
        int minutes = Integer.parseInt(matcher.group(2));
        int seconds = Integer.parseInt(matcher.group(3));
        if (hours > 23 || minutes > 59 || seconds > 59) {
            throw new IllegalArgumentException("The observation time '" + utc + "' is out of range");
        }

        int nanos = 0;
        String fraction = matcher.group(4);
        if (fraction != null) {
            StringBuilder digits = new StringBuilder(fraction.length() > 9 ? fraction.substring(0, 9) : fraction);
            while (digits.length() < 9) {
                digits.append('0');
            }
            nanos = Integer.parseInt(digits.toString());
        }
        return date.atTime(hours, minutes, seconds, nanos);
    }
}
