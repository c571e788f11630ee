package com.sem.lcs.api;

/** Position of a path in its specification's emission order. */
public record PathId(int index) implements Comparable<PathId> {

    @Override
    public int compareTo(PathId o) {
        return Integer.compare(index, o.index);
    }
}
