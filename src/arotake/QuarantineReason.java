/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

/**
 * Why a file was quarantined rather than archived.
 */
public enum QuarantineReason {

    /**
     * The file could not be read as FITS.
     */
    UNREADABLE,

    /**
     * A validation step rejected the file.
     */
    STEP_FAILURE,

    /**
     * No identifier was assigned.
     */
    MISSING_IDENTIFIER,

    /**
     * Another file of the batch already has the same identifier.
     */
    DUPLICATE_IDENTIFIER,

    /**
     * The identifier's date lies outside the night being processed.
     */
    TEMPORAL_INCONSISTENCY,

    /**
     * The archived copy or the preview could not be written.
     */
    OUTPUT_FAILURE
}
