/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

/**
 * Thrown when the placement of a detector segment within the mosaic cannot
 * be determined, so no mosaic preview can be assembled.
 */
public class GeometryParseException extends Exception {

    private static final long serialVersionUID = 1L;

    public GeometryParseException(String message) {
        super(message);
    }

    public GeometryParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
