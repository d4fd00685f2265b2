/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.instrument;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import arotake.BatchContext;
import arotake.Exposure;
import arotake.FitsFiles;
import arotake.HeaderStore;
import arotake.ValidationStep;
import arotake.step.SetImageType;

/**
 * Holds the parts of a profile that every instrument fills in the same way.
 * Subclasses register their steps, aliases and metadata keywords from their
 * constructors.
 */
public abstract class AbstractInstrumentProfile implements InstrumentProfile {

    /**
     * The end of the observing night for instruments that do not say
     * otherwise.
     */
    public static final String DEFAULT_END_OF_NIGHT = "20:00:00";

    /**
     * The image type of science exposures.
     */
    public static final String SCIENCE_IMAGE_TYPE = "object";

    private final String name;
    private final String endOfNightTime;
    private final List<ValidationStep> steps = new ArrayList<ValidationStep>();
    private final Map<String, String> keywordAliases = new LinkedHashMap<String, String>();
    private final List<String> metadataKeywords = new ArrayList<String>();

    protected AbstractInstrumentProfile(String name, String endOfNightTime) {
        if (name == null || name.trim().length() == 0) {
            throw new IllegalArgumentException("An instrument profile needs a name.");
        }
        this.name = name.trim().toUpperCase();
        this.endOfNightTime = (endOfNightTime == null) ? DEFAULT_END_OF_NIGHT : endOfNightTime;
    }

    protected void addStep(ValidationStep step) {
        steps.add(step);
    }

    protected void addAlias(String keyword, String alias) {
        keywordAliases.put(keyword, alias);
    }

    protected void addMetadataKeywords(String... keywords) {
        for (String keyword : keywords) {
            metadataKeywords.add(keyword);
        }
    }

    public String getName() {
        return name;
    }

    public String getEndOfNightTime() {
        return endOfNightTime;
    }

    public List<ValidationStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public Map<String, String> getKeywordAliases() {
        return Collections.unmodifiableMap(keywordAliases);
    }

    public List<String> getMetadataKeywords() {
        return Collections.unmodifiableList(metadataKeywords);
    }

    public boolean isScience(HeaderStore header) {
        return SCIENCE_IMAGE_TYPE.equals(header.getString(SetImageType.KEYWORD));
    }

    /**
     * Single image instruments are previewed from their first image.
     */
    public boolean usesMosaicPreview(Exposure exposure) {
        return false;
    }

    /**
     * Nothing is needed by default.
     */
    public void prepareBatch(List<Path> files, FitsFiles loader, BatchContext batch) {
    }

    /**
     * Returns the lower case string value of a keyword, or an empty string.
     */
    protected static String lower(HeaderStore header, String keyword) {
        return header.getString(keyword, "").trim().toLowerCase();
    }

    @Override
    public String toString() {
        return name;
    }
}
