package com.example.styleverify.model;

import java.util.List;

/**
 * Outcome of context matching. Every template style is in exactly one of {@code matched} or
 * {@code missing}; every document context in exactly one of {@code matched} or {@code unexpected}.
 */
public record MatchResult(
        List<MatchedPair> matched,
        List<TextStyle> missing,
        List<ExtractedContext> unexpected
) {
    public MatchResult {
        matched = List.copyOf(matched);
        missing = List.copyOf(missing);
        unexpected = List.copyOf(unexpected);
    }
}
