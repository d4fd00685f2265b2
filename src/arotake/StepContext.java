/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.util.LinkedHashMap;
import java.util.Map;

import arotake.archive.ProgramInfo;
import arotake.instrument.InstrumentProfile;

/**
 * Everything a validation step may look at or change while one exposure is
 * assessed: the exposure itself, its instrument's profile, the batch it is
 * part of, and the auxiliary metadata gathered for the archive.
 */
public class StepContext {

    private final Exposure exposure;
    private final InstrumentProfile profile;
    private final BatchContext batch;

    /**
     * Values destined for the archive's metadata table that are not written
     * into the FITS header.
     */
    private final Map<String, Object> auxiliaryMetadata = new LinkedHashMap<String, Object>();

    /**
     * The name of the step that failed, if any.
     */
    private String failedStep;

    public StepContext(Exposure exposure, InstrumentProfile profile, BatchContext batch) {
        if (exposure == null || profile == null || batch == null) {
            throw new IllegalArgumentException("A step context needs an exposure, a profile and a batch context.");
        }
        this.exposure = exposure;
        this.profile = profile;
        this.batch = batch;
    }

    public Exposure getExposure() {
        return exposure;
    }

    public HeaderStore getHeader() {
        return exposure.getHeader();
    }

    public InstrumentProfile getProfile() {
        return profile;
    }

    public BatchContext getBatch() {
        return batch;
    }

    /**
     * Returns the name under which this instrument stores a keyword. If the
     * instrument uses a different name and that keyword is present, the
     * instrument's name is returned; otherwise the name itself.
     */
    public String resolveKeyword(String keyword) {
        String alias = profile.getKeywordAliases().get(keyword);
        if (alias != null && alias.length() > 0 && getHeader().contains(alias)) {
            return alias;
        }
        return keyword;
    }

    /**
     * Returns a keyword's string value, following the instrument's aliases.
     */
    public String getKeyword(String keyword, String defaultValue) {
        return getHeader().getString(resolveKeyword(keyword), defaultValue);
    }

    public String getKeyword(String keyword) {
        return getKeyword(keyword, null);
    }

    /**
     * Returns the program lookup entry for this exposure's file, or null if
     * the lookup has no entry for it.
     */
    public ProgramInfo getProgramInfo() {
        return batch.getProgramInfo(exposure.getPath().toString());
    }

    public Map<String, Object> getAuxiliaryMetadata() {
        return auxiliaryMetadata;
    }

    public String getFailedStep() {
        return failedStep;
    }

    void setFailedStep(String failedStep) {
        this.failedStep = failedStep;
    }
}
