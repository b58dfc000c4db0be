package com.example.styleverify.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inline formatting override observed on (or allowed for) a style in a given structural context.
 *
 * @param patternName     name of the pattern (e.g. "BoldLeadIn")
 * @param context         structural context string the pattern applies in
 * @param properties      override properties (same vocabulary as style properties)
 * @param sampleText      sample of the overridden text
 * @param occurrenceCount number of occurrences seen by the extractor
 */
public record DirectFormatPattern(
        String patternName,
        String context,
        Map<String, String> properties,
        String sampleText,
        int occurrenceCount
) {
    public DirectFormatPattern {
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public DirectFormatPattern(String patternName, String context, Map<String, String> properties) {
        this(patternName, context, properties, null, 0);
    }

    public StyleProperties overrides() {
        return StyleProperties.of(properties);
    }

    /** Context string trimmed, used as the pattern join key. */
    public String contextKey() {
        return context == null ? "" : context.trim();
    }
}
