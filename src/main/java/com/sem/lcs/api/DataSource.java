package com.sem.lcs.api;

import java.util.List;

/**
 * Rectangular data handed to an {@link EstimationEngine}, keyed by manifest
 * variable names.
 */
public interface DataSource {

    /** Column names, each matching a {@link ManifestVariable#name()}. */
    List<String> columns();

    int rowCount();

    /** Value at a row; {@link Double#NaN} marks a missing observation. */
    double value(int row, String column);
}
