/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The metadata of one exposure: an ordered mapping of FITS keyword to a value
 * and its comment. Keywords are stored trimmed and in upper case, so lookups
 * are case-insensitive.
 * <p>
 * Values are held as String, Long, Double or Boolean. The typed accessors
 * convert between these where the conversion is lossless (a string holding
 * "12" reads as the integer 12), and treat anything they cannot convert as
 * missing.
 * <p>
 * Some keywords hold the archive identifier of the exposure. Once one of
 * these has been given a value it may be set again with the same value, but
 * an attempt to change it throws an IllegalStateException.
 */
public class HeaderStore implements Iterable<HeaderStore.Entry> {

    /**
     * The keyword holding the archive identifier of the exposure.
     */
    public static final String IDENTIFIER_KEYWORD = "KOAID";

    /**
     * The keyword holding the archive identifier of the associated
     * flexure compensation (FCS) image.
     */
    public static final String FCS_IDENTIFIER_KEYWORD = "FCSKOAID";

    /**
     * One keyword's value and comment.
     */
    public static class Entry {

        private final String keyword;
        private final Object value;
        private final String comment;

        Entry(String keyword, Object value, String comment) {
            this.keyword = keyword;
            this.value = value;
            this.comment = comment;
        }

        public String getKeyword() {
            return keyword;
        }

        public Object getValue() {
            return value;
        }

        public String getComment() {
            return comment;
        }

        @Override
        public String toString() {
            return keyword + " = " + value + (comment == null ? "" : " / " + comment);
        }
    }

    /**
     * The keyword entries in insertion order.
     */
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<String, Entry>();

    /**
     * Keywords whose values have been set (rather than loaded) since the
     * store was created.
     */
    private final Set<String> modified = new HashSet<String>();

    /**
     * Keywords that must never silently change value once set.
     */
    private final Set<String> protectedKeywords = new HashSet<String>();

    public HeaderStore() {
        protectedKeywords.add(IDENTIFIER_KEYWORD);
        protectedKeywords.add(FCS_IDENTIFIER_KEYWORD);
    }

    /**
     * Normalises a keyword to the form used for storage.
     *
     * @throws IllegalArgumentException if the keyword is null or blank.
     */
    static String normalise(String keyword) {
        if (keyword == null) {
            throw new IllegalArgumentException("Cannot use a null header keyword.");
        }
        String normalised = keyword.trim().toUpperCase();
        if (normalised.length() < 1) {
            throw new IllegalArgumentException("Cannot use a blank header keyword.");
        }
        return normalised;
    }

    /**
     * Adds a keyword as it was read from a file. Loaded values do not count
     * as modifications.
     */
    public void load(String keyword, Object value, String comment) {
        String key = normalise(keyword);
        entries.put(key, new Entry(key, value, comment));
    }

    /**
     * Sets the value of a keyword, adding it at the end of the store if it is
     * not already present. An existing keyword keeps its position.
     *
     * @param keyword the keyword to set.
     * @param value the value, which should be a String, Number or Boolean.
     * @param comment the comment to store with the value (may be null).
     *
     * @throws IllegalStateException if the keyword holds an identifier that
     *         has already been set to a different value.
     */
    public void set(String keyword, Object value, String comment) {
        String key = normalise(keyword);
        Object stored = normaliseValue(value);

        Entry existing = entries.get(key);
        if (existing != null && protectedKeywords.contains(key) && !isBlank(existing.getValue())) {
            if (existing.getValue().equals(stored)) {
                return;
            }
            throw new IllegalStateException("Cannot change " + key + " from '" + existing.getValue()
                    + "' to '" + stored + "'");
        }

        entries.put(key, new Entry(key, stored, comment));
        modified.add(key);
    }

    private static Object normaliseValue(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Long.valueOf(((Number) value).longValue());
        }
        if (value instanceof Float) {
            return Double.valueOf(((Float) value).doubleValue());
        }
        return value;
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().trim().length() == 0;
    }

    /**
     * Returns true if the keyword is present (even with a null value).
     */
    public boolean contains(String keyword) {
        return entries.containsKey(normalise(keyword));
    }

    /**
     * Returns the raw value of a keyword, or null if it is not present.
     */
    public Object get(String keyword) {
        Entry entry = entries.get(normalise(keyword));
        return entry == null ? null : entry.getValue();
    }

    public String getComment(String keyword) {
        Entry entry = entries.get(normalise(keyword));
        return entry == null ? null : entry.getComment();
    }

    /**
     * Returns the value of a keyword as a string, or the default value if it
     * is missing or null.
     */
    public String getString(String keyword, String defaultValue) {
        Object value = get(keyword);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value).booleanValue() ? "T" : "F";
        }
        return value.toString();
    }

    public String getString(String keyword) {
        return getString(keyword, null);
    }

    /**
     * Returns the value of a keyword as an integer, or null if it is missing
     * or is not a whole number.
     */
    public Long getInteger(String keyword) {
        Object value = get(keyword);
        if (value instanceof Long) {
            return (Long) value;
        }
        if (value instanceof Double) {
            double number = ((Double) value).doubleValue();
            if (number == Math.rint(number) && !Double.isInfinite(number)) {
                return Long.valueOf((long) number);
            }
            return null;
        }
        if (value instanceof String) {
            try {
                return Long.valueOf(((String) value).trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    public long getInteger(String keyword, long defaultValue) {
        Long value = getInteger(keyword);
        return value == null ? defaultValue : value.longValue();
    }

    /**
     * Returns the value of a keyword as a floating point number, or null if
     * it is missing or is not numeric.
     */
    public Double getDouble(String keyword) {
        Object value = get(keyword);
        if (value instanceof Number) {
            return Double.valueOf(((Number) value).doubleValue());
        }
        if (value instanceof String) {
            try {
                return Double.valueOf(((String) value).trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    public double getDouble(String keyword, double defaultValue) {
        Double value = getDouble(keyword);
        return value == null ? defaultValue : value.doubleValue();
    }

    /**
     * Removes a keyword. Identifier keywords cannot be removed once set.
     */
    public void remove(String keyword) {
        String key = normalise(keyword);
        Entry existing = entries.get(key);
        if (existing != null && protectedKeywords.contains(key) && !isBlank(existing.getValue())) {
            throw new IllegalStateException("Cannot remove " + key + " once it has been set.");
        }
        entries.remove(key);
        modified.remove(key);
    }

    /**
     * Returns true if the keyword was set since the store was loaded.
     */
    public boolean isModified(String keyword) {
        return modified.contains(normalise(keyword));
    }

    /**
     * Returns the entries that were set since the store was loaded, in
     * header order.
     */
    public List<Entry> getModifiedEntries() {
        List<Entry> result = new ArrayList<Entry>();
        for (Entry entry : entries.values()) {
            if (modified.contains(entry.getKeyword())) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Returns the keywords in header order.
     */
    public List<String> getKeywords() {
        return Collections.unmodifiableList(new ArrayList<String>(entries.keySet()));
    }

    /**
     * Copies the values of the given keywords into a new map (in the order
     * given). Missing keywords map to null.
     */
    public Map<String, Object> select(List<String> keywords) {
        Map<String, Object> result = new LinkedHashMap<String, Object>();
        for (String keyword : keywords) {
            result.put(normalise(keyword), get(keyword));
        }
        return result;
    }

    public int size() {
        return entries.size();
    }

    public Iterator<Entry> iterator() {
        return Collections.unmodifiableCollection(entries.values()).iterator();
    }
}
