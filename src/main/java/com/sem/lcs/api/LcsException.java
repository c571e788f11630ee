package com.sem.lcs.api;

/**
 * Base class of every failure raised while building, exporting or parsing a
 * latent change score specification.
 */
public class LcsException extends RuntimeException {

    public LcsException(String message) {
        super(message);
    }

    public LcsException(String message, Throwable cause) {
        super(message, cause);
    }
}
