/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered list of (condition, result) rules over a header. The result of
 * the first rule whose condition matches is returned; if none match the
 * default result is returned.
 */
public class DecisionList<T> {

    /**
     * A test of header values.
     */
    public interface Condition {
        boolean matches(HeaderStore header);
    }

    private final List<Condition> conditions = new ArrayList<Condition>();
    private final List<T> results = new ArrayList<T>();
    private final T defaultResult;

    public DecisionList(T defaultResult) {
        this.defaultResult = defaultResult;
    }

    /**
     * Appends a rule. Rules are evaluated in the order they were added.
     *
     * @return this list, so rules can be chained.
     */
    public DecisionList<T> add(Condition condition, T result) {
        if (condition == null) {
            throw new IllegalArgumentException("Cannot add a rule with a null condition.");
        }
        conditions.add(condition);
        results.add(result);
        return this;
    }

    public T evaluate(HeaderStore header) {
        for (int index = 0; index < conditions.size(); ++index) {
            if (conditions.get(index).matches(header)) {
                return results.get(index);
            }
        }
        return defaultResult;
    }

    public T getDefaultResult() {
        return defaultResult;
    }

    public int size() {
        return conditions.size();
    }
}
