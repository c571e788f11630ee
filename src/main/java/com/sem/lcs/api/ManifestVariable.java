package com.sem.lcs.api;

/**
 * Observed measurement of one indicator of a process at one occasion.
 *
 * <p>
 * A process measured by a single indicator names its manifests after the
 * process itself ({@code Y_T3}); otherwise the indicator index is part of the
 * name ({@code Y2_T3}).
 */
public record ManifestVariable(String process, int indicator, int time, boolean namedAfterProcess)
        implements Variable {

    public ManifestVariable {
        if (process == null)
            throw new IllegalArgumentException("process is required");
        if (indicator < 1 || time < 1)
            throw new IllegalArgumentException("indicator and time are 1-based");
        if (namedAfterProcess && indicator != 1)
            throw new IllegalArgumentException("Only indicator 1 can be named after its process");
    }

    @Override
    public String name() {
        return (namedAfterProcess ? process : process + indicator) + "_T" + time;
    }

    @Override
    public boolean isManifest() {
        return true;
    }

    @Override
    public String toString() {
        return name();
    }
}
