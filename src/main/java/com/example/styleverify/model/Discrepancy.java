package com.example.styleverify.model;

import java.util.List;

/**
 * Raw discrepancy before severity assignment, deduplication and ordering.
 *
 * @param contextKey     context the discrepancy is reported at
 * @param location       human-readable location
 * @param structuralRole structural role of the affected style
 * @param styleName      name of the affected template (or document) style
 * @param category       discrepancy kind
 * @param differences    field-level differences, never empty
 * @param sampleText     sample text of the affected element
 */
public record Discrepancy(
        String contextKey,
        String location,
        String structuralRole,
        String styleName,
        MismatchCategory category,
        List<FieldDifference> differences,
        String sampleText
) {
    public Discrepancy {
        contextKey = contextKey == null ? "" : contextKey;
        differences = List.copyOf(differences);
    }
}
