/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that an exposure's archive identifier is usable within a processing
 * run: present and well formed, not already used by another exposure of the
 * run, and dated within the night being processed.
 * <p>
 * The date check only rejects identifiers more than one day away from the
 * processing date, and then only when their time of day falls before the
 * end-of-night cutoff. Files written around midnight therefore pass. The
 * identifier's HHmmss.ff is compared as written (101530.25) against the
 * cutoff in seconds since midnight, which is the archive's existing rule.
 */
public class IdentifierValidator {

    private static final Logger logger = LoggerFactory.getLogger(IdentifierValidator.class);

    /**
     * The result of checking one identifier.
     */
    public enum Outcome {
        VALID,
        MISSING,
        MALFORMED,
        DUPLICATE,
        OUT_OF_WINDOW
    }

    private final LocalDate processingDate;
    private final double endOfNightSeconds;

    /**
     * @param processingDate the UT date being processed.
     * @param endOfNightTime the UT end of the observing night, HH:mm:ss.
     */
    public IdentifierValidator(LocalDate processingDate, String endOfNightTime) {
        if (processingDate == null) {
            throw new IllegalArgumentException("Cannot validate identifiers without a processing date.");
        }
        this.processingDate = processingDate;
        this.endOfNightSeconds = toSeconds(endOfNightTime);
    }

    /**
     * Converts HH:mm:ss (with optional fraction) into seconds since midnight.
     */
    public static double toSeconds(String time) {
        if (time == null) {
            throw new IllegalArgumentException("No time of day was given.");
        }
        String[] parts = time.trim().split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Expected a time of the form HH:mm:ss, got '" + time + "'");
        }
        try {
            return Double.parseDouble(parts[0]) * 3600.0 + Double.parseDouble(parts[1]) * 60.0
                    + Double.parseDouble(parts[2]);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Expected a time of the form HH:mm:ss, got '" + time + "'", ex);
        }
    }

    /**
     * Checks an identifier and, if it is valid, adds it to the set of
     * identifiers seen in this run.
     */
    public Outcome check(String identifier, Set<String> seenSet) {
        if (identifier == null || identifier.trim().length() == 0) {
            return Outcome.MISSING;
        }

        ArchiveIdentifier parsed = ArchiveIdentifier.parse(identifier);
        if (parsed == null) {
            return Outcome.MALFORMED;
        }

        if (seenSet.contains(identifier)) {
            return Outcome.DUPLICATE;
        }

        long days = Math.abs(ChronoUnit.DAYS.between(parsed.getDate(), processingDate));
        if (!parsed.getDate().equals(processingDate) && days > 1 && parsed.getTimeValue() < endOfNightSeconds) {
            return Outcome.OUT_OF_WINDOW;
        }

        seenSet.add(identifier);
        return Outcome.VALID;
    }

    /**
     * Checks an identifier, logging the reason for any failure.
     *
     * @return true if the identifier is valid (and has been added to the set).
     */
    public boolean validate(String identifier, Set<String> seenSet) {
        Outcome outcome = check(identifier, seenSet);
        switch (outcome) {
            case VALID:
                return true;
            case MISSING:
                logger.error("Bad identifier '{}'", identifier);
                return false;
            case MALFORMED:
                logger.error("Malformed identifier '{}'", identifier);
                return false;
            case DUPLICATE:
                logger.error("Duplicate identifier '{}'", identifier);
                return false;
            default:
                logger.error("Identifier '{}' is dated outside the night of {}", identifier, processingDate);
                return false;
        }
    }

    /**
     * Checks one identifier against a set of identifiers already used.
     */
    public static boolean validate(String identifier, Set<String> seenSet, LocalDate processingDate,
            String endOfNightTime) {
        return new IdentifierValidator(processingDate, endOfNightTime).validate(identifier, seenSet);
    }
}
