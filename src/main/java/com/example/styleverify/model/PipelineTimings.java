package com.example.styleverify.model;

/**
 * Per-stage timing of a verification run (in seconds).
 *
 * @param matchingSeconds    context matching
 * @param comparisonSeconds  parallel pair comparison, up to the join barrier
 * @param aggregationSeconds severity, deduplication and ordering
 */
public record PipelineTimings(
        double matchingSeconds,
        double comparisonSeconds,
        double aggregationSeconds
) {
    public double totalSeconds() {
        return matchingSeconds + comparisonSeconds + aggregationSeconds;
    }
}
