package com.sem.lcs.api;

/**
 * Two paths were given the same parameter label but disagree in kind or in
 * whether they are free.
 */
public class LabelConflictException extends LcsException {
    private final String label;

    public LabelConflictException(String label, String message) {
        super("Label '" + label + "': " + message);
        this.label = label;
    }

    public String label() {
        return label;
    }
}
