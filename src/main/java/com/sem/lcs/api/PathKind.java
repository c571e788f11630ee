package com.sem.lcs.api;

/** Directed (single-headed) or symmetric (double-headed) relationship. */
public enum PathKind {
    REGRESSION(1),
    COVARIANCE(2);

    private final int arrows;

    PathKind(int arrows) {
        this.arrows = arrows;
    }

    /** Arrow count in the RAM path-list form. */
    public int arrows() {
        return arrows;
    }

    public static PathKind fromArrows(int arrows) {
        for (PathKind k : values())
            if (k.arrows == arrows)
                return k;
        throw new IllegalArgumentException("arrows must be 1 or 2, got " + arrows);
    }
}
