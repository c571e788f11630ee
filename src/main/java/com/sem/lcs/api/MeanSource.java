package com.sem.lcs.api;

/**
 * The constant unit source a mean or intercept is regressed on. RAM path lists
 * print it as {@code one}; equation text prints it as {@code 1}.
 */
public final class MeanSource implements Variable {
    public static final MeanSource INSTANCE = new MeanSource();
    public static final String NAME = "one";

    private MeanSource() {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String process() {
        return null;
    }

    @Override
    public String toString() {
        return NAME;
    }
}
