package com.example.styleverify.model;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Aggregate statistics over stored verification runs.
 */
public record VerificationSummary(
        int totalVerifications,
        int completedVerifications,
        int failedVerifications,
        int totalMismatches,
        Map<Severity, Long> mismatchesBySeverity,
        Map<String, Long> mismatchesByStructuralRole,
        List<VerificationResult> recentVerifications
) {

    static final int RECENT_LIMIT = 5;

    /**
     * Factory method computing the distributions from the given results.
     */
    public static VerificationSummary from(List<VerificationResult> results) {
        List<Mismatch> all = results.stream()
                .flatMap(r -> r.mismatches().stream())
                .toList();
        Map<Severity, Long> bySeverity = all.stream()
                .collect(Collectors.groupingBy(Mismatch::severity,
                        () -> new EnumMap<>(Severity.class), Collectors.counting()));
        Map<String, Long> byRole = all.stream()
                .collect(Collectors.groupingBy(
                        m -> m.structuralRole() != null && !m.structuralRole().isBlank() ? m.structuralRole() : "Unknown",
                        TreeMap::new, Collectors.counting()));
        List<VerificationResult> recent = results.stream()
                .sorted(Comparator.comparing(VerificationResult::verificationDate,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(RECENT_LIMIT)
                .toList();
        int completed = (int) results.stream().filter(r -> r.status() == VerificationStatus.COMPLETED).count();
        int failed = (int) results.stream().filter(r -> r.status() == VerificationStatus.FAILED).count();
        return new VerificationSummary(results.size(), completed, failed, all.size(), bySeverity, byRole, recent);
    }
}
