/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.instrument;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import arotake.BatchContext;
import arotake.Exposure;
import arotake.FitsFiles;
import arotake.HeaderStore;
import arotake.ValidationStep;

/**
 * Everything that differs between instruments: the ordered validation steps,
 * the keyword names the instrument uses, how identifiers are prefixed, what
 * counts as science and how previews are made.
 * <p>
 * Profiles hold no per-batch state and may be shared between batches.
 */
public interface InstrumentProfile {

    /**
     * The instrument name as it appears in INSTRUME and in directory names,
     * for example "DEIMOS".
     */
    String getName();

    /**
     * Maps a standard keyword name to the name this instrument writes it
     * under. Keywords the instrument writes under the standard name are not
     * listed.
     */
    Map<String, String> getKeywordAliases();

    /**
     * The validation steps in the order they are applied.
     */
    List<ValidationStep> getSteps();

    /**
     * The UT time (HH:mm:ss) that ends an observing night.
     */
    String getEndOfNightTime();

    /**
     * Returns the identifier prefix for the exposure with the given header,
     * or an empty string if the exposure cannot be identified.
     */
    String getIdentifierPrefix(HeaderStore header);

    /**
     * Returns true if a validated exposure counts as science data.
     */
    boolean isScience(HeaderStore header);

    /**
     * The keywords written to the archive metadata table, in column order.
     */
    List<String> getMetadataKeywords();

    /**
     * Returns true if the preview of the exposure is built by reconstructing
     * the detector mosaic rather than from its first image.
     */
    boolean usesMosaicPreview(Exposure exposure);

    /**
     * Called once before the files of a batch are validated, so that the
     * profile can record batch-wide information in the batch context.
     *
     * @param files the files listed for the batch.
     * @param loader used to read the files.
     * @param batch the context shared by every exposure of the batch.
     */
    void prepareBatch(List<Path> files, FitsFiles loader, BatchContext batch);
}
