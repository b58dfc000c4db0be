package com.example.styleverify.model;

/**
 * One field-level difference produced by a comparator. Absent values are {@code null}.
 *
 * @param field    name of the differing field (e.g. "color", "TabStopCountMismatch")
 * @param expected template-side value
 * @param actual   document-side value
 */
public record FieldDifference(String field, String expected, String actual) {}
