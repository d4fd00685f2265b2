/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

/**
 * Thrown when a batch cannot be started, for example because its list of
 * input files does not exist.
 */
public class BatchSetupException extends Exception {

    private static final long serialVersionUID = 1L;

    public BatchSetupException(String message) {
        super(message);
    }

    public BatchSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
