package com.sem.lcs.io;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of the RAM path-list form.
 *
 * @param from   Source variable name ({@code one} for means).
 * @param to     Target variable name.
 * @param arrows 1 for a regression, 2 for a (co)variance.
 * @param free   1 if estimated, 0 if fixed.
 * @param value  Start value of a free path, constant of a fixed one.
 * @param label  Parameter label, empty when untied.
 */
@JsonPropertyOrder({ "from", "to", "arrows", "free", "value", "label" })
public record PathRow(String from, String to, int arrows, int free, double value, String label) {
    static final String SEPARATOR = "\t";
    static final String HEADER = String.join(SEPARATOR, "from", "to", "arrows", "free", "value", "label");

    public PathRow {
        if (label == null)
            label = "";
    }

    /** Tab-separated rendering, no trailing newline. */
    public String toLine() {
        return from + SEPARATOR + to + SEPARATOR + arrows + SEPARATOR + free + SEPARATOR + value + SEPARATOR
                + label;
    }
}
