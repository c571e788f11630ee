package com.sem.lcs.api;

/** The engine found that the model's parameters are not identified. */
public class UnidentifiedModelException extends EstimationException {

    public UnidentifiedModelException(String message) {
        super(message);
    }
}
