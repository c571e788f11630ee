package com.sem.lcs.api;

/**
 * One relationship of the model graph.
 *
 * <p>
 * A {@link PathKind#REGRESSION} path points from predictor to outcome; one
 * starting at {@link MeanSource} is a mean or intercept. A
 * {@link PathKind#COVARIANCE} path whose endpoints coincide is a variance.
 * For free paths {@code value} is the start value; for fixed paths it is the
 * constant. {@code label} is {@code null} when the parameter is not tied.
 */
public record Path(Variable from, Variable to, PathKind kind, boolean free, double value, String label) {

    public Path {
        if (from == null || to == null || kind == null)
            throw new IllegalArgumentException("from, to and kind are required");
        if (label != null && label.isBlank())
            label = null;
    }

    public static Path fixed(Variable from, Variable to, PathKind kind, double value) {
        return new Path(from, to, kind, false, value, null);
    }

    public static Path free(Variable from, Variable to, PathKind kind, double start, String label) {
        return new Path(from, to, kind, true, start, label);
    }

    public boolean hasLabel() {
        return label != null;
    }

    public boolean isMean() {
        return kind == PathKind.REGRESSION && from instanceof MeanSource;
    }

    public boolean isVariance() {
        return kind == PathKind.COVARIANCE && from.equals(to);
    }

    @Override
    public String toString() {
        return from.name() + (kind == PathKind.REGRESSION ? " -> " : " <-> ") + to.name()
                + (free ? " free" : " fixed") + "=" + value + (label != null ? " [" + label + "]" : "");
    }
}
