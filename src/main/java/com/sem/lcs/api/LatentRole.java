package com.sem.lcs.api;

/** Role of a latent variable within one process. */
public enum LatentRole {
    /** Intercept factor feeding the first state. */
    INITIAL_LEVEL,
    /** Constant additive component feeding every change score. */
    INITIAL_SLOPE,
    /** True score at occasion t, t in [1, T]. */
    STATE,
    /** Latent change between t-1 and t, t in [2, T]. */
    CHANGE;

    /** Whether variables of this role carry an occasion index. */
    public boolean isTimed() {
        return this == STATE || this == CHANGE;
    }
}
