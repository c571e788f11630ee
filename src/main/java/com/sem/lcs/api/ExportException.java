package com.sem.lcs.api;

/**
 * A specification could not be rendered to, or read back from, one of the
 * external forms.
 */
public class ExportException extends LcsException {

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Parser failure pointing at a 1-based input line. */
    public static ExportException atLine(int line, String message) {
        return new ExportException(message + " (line " + line + ")");
    }
}
