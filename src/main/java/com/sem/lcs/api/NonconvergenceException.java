package com.sem.lcs.api;

/** The optimizer stopped without reaching a solution. */
public class NonconvergenceException extends EstimationException {
    private final int iterations;

    public NonconvergenceException(String message, int iterations) {
        super(message);
        this.iterations = iterations;
    }

    public int iterations() {
        return iterations;
    }
}
