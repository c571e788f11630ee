package com.sem.lcs.api;

/**
 * Failure reported by an {@link EstimationEngine}. Passed to callers as is.
 */
public class EstimationException extends LcsException {

    public EstimationException(String message) {
        super(message);
    }

    public EstimationException(String message, Throwable cause) {
        super(message, cause);
    }
}
