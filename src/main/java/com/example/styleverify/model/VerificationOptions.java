package com.example.styleverify.model;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-run options.
 *
 * @param ignoreStyleTypes style types (case-insensitive) excluded from matching on both sides
 */
public record VerificationOptions(Set<String> ignoreStyleTypes) {

    public VerificationOptions {
        ignoreStyleTypes = ignoreStyleTypes == null ? Set.of() : ignoreStyleTypes.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static VerificationOptions defaults() {
        return new VerificationOptions(Set.of());
    }

    public boolean isIgnored(String styleType) {
        return styleType != null && ignoreStyleTypes.contains(styleType.trim().toLowerCase(Locale.ROOT));
    }
}
