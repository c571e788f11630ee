package com.sem.lcs.api;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A named free parameter (or named constant) shared by every member path.
 * Assigning one label to several paths constrains them to a single estimate.
 */
public record ParameterLabel(LabelId id, PathKind kind, boolean free, Set<PathId> members) {

    public ParameterLabel {
        members = Collections.unmodifiableSortedSet(new TreeSet<>(members));
    }

    public String name() {
        return id.name();
    }
}
