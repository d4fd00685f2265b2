/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

/**
 * One named check or repair applied to an exposure's header. A step that
 * derives a keyword should leave an existing value alone, so the header ends
 * up the same whether the keyword was written by the instrument or derived
 * here.
 */
public abstract class ValidationStep {

    private final String name;

    protected ValidationStep(String name) {
        if (name == null || name.trim().length() < 1) {
            throw new IllegalArgumentException("A validation step must have a name.");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Applies the step.
     *
     * @param context the exposure being assessed and the batch it belongs to.
     * @return true if the exposure may continue to the next step, false if it
     *         must be quarantined.
     */
    public abstract boolean apply(StepContext context);

    @Override
    public String toString() {
        return name;
    }
}
