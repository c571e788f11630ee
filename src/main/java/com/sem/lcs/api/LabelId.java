package com.sem.lcs.api;

/** Handle returned when a label is interned; {@code index} is intern order. */
public record LabelId(int index, String name) {
}
