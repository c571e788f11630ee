package com.sem.lcs.util;

import com.sem.lcs.api.MeasurementPolicy;

import java.util.Locale;

/**
 * Standard measurement-invariance regimes.
 *
 * <p>
 * Each successive regime adds constraints to the previous one:
 * <ul>
 * <li>{@link #CONFIGURAL}: non-marker loadings are estimated separately at
 * every occasion; intercepts stay at zero.</li>
 * <li>{@link #WEAK}: loadings are equal across occasions.</li>
 * <li>{@link #STRONG}: intercepts are also estimated and equal across
 * occasions; the initial level mean is then fixed to zero.</li>
 * </ul>
 * The marker indicator's loading is fixed to 1 under every regime. A regime
 * that also fixes the non-marker loadings is a custom {@link MeasurementPolicy}
 * whose {@code isLoadingFree} returns {@code false}.
 */
public enum InvariancePolicy implements MeasurementPolicy {
    CONFIGURAL(false, false),
    WEAK(true, false),
    STRONG(true, true);

    private final boolean tiesLoadings;
    private final boolean estimatesIntercepts;

    InvariancePolicy(boolean tiesLoadings, boolean estimatesIntercepts) {
        this.tiesLoadings = tiesLoadings;
        this.estimatesIntercepts = estimatesIntercepts;
    }

    public static final InvariancePolicy DEFAULT = STRONG;

    @Override
    public boolean isLoadingFree(int indicator) {
        return indicator > 1;
    }

    @Override
    public boolean tiesLoadings() {
        return tiesLoadings;
    }

    @Override
    public boolean estimatesIntercepts() {
        return estimatesIntercepts;
    }

    @Override
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive lookup by name. */
    public static InvariancePolicy fromString(String s) {
        if (s == null)
            return DEFAULT;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown invariance policy: " + s, e);
        }
    }
}
