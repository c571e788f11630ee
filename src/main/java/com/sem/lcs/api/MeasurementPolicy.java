package com.sem.lcs.api;

/**
 * Rule set deciding how the measurement part of a multiple-indicator model is
 * constrained.
 *
 * <p>
 * The path builder consults the policy for every loading and intercept it
 * emits, so a new invariance regime is added by implementing this interface
 * rather than by editing the builder. The standard regimes live in
 * {@link com.sem.lcs.util.InvariancePolicy}.
 */
public interface MeasurementPolicy {

    /**
     * Whether the loading of the given indicator is estimated.
     * Indicator 1 is the marker and is fixed to 1 regardless.
     *
     * @param indicator 1-based indicator index, always {@code >= 2}.
     */
    boolean isLoadingFree(int indicator);

    /** Whether a free loading is constrained equal across occasions. */
    boolean tiesLoadings();

    /**
     * Whether indicator intercepts are estimated (and tied across occasions).
     * When {@code false} they stay at zero and no intercept path is emitted.
     */
    boolean estimatesIntercepts();

    /**
     * Whether the mean of the initial level is fixed to zero for a process
     * measured by {@code indicatorCount} indicators.
     */
    default boolean fixesLevelMean(int indicatorCount) {
        return indicatorCount > 1 && estimatesIntercepts();
    }

    /** Short name used in logs and diagnostics. */
    String id();
}
