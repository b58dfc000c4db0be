package com.example.styleverify.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * One reported discrepancy of a verification run. Immutable; embedded in its
 * {@link VerificationResult}.
 *
 * @param contextKey        context the mismatch is reported at
 * @param location          human-readable location
 * @param structuralRole    structural role of the affected style
 * @param category          discrepancy kind (highest-priority one when several were merged)
 * @param mismatchFields    sorted, comma-joined field names
 * @param expected          expected value per field
 * @param actual            actual value per field
 * @param sampleText        sample text of the affected element
 * @param severity          assigned severity
 * @param recommendedAction suggested correction
 * @param createdOn         timestamp of the verification run
 */
public record Mismatch(
        String contextKey,
        String location,
        String structuralRole,
        MismatchCategory category,
        String mismatchFields,
        Map<String, String> expected,
        Map<String, String> actual,
        String sampleText,
        Severity severity,
        String recommendedAction,
        Instant createdOn
) {
    public List<String> fieldList() {
        if (mismatchFields == null || mismatchFields.isEmpty()) return List.of();
        return Arrays.asList(mismatchFields.split(","));
    }
}
