package com.example.styleverify.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structural metadata describing where a template style applies.
 * Embedded in its {@link TextStyle}; the context key is the join key with document contexts.
 *
 * @param elementType           paragraph, run, table-cell, ...
 * @param contextKey            stable identifier of the slot in the document tree
 * @param structuralRole        heading, body, caption, ...
 * @param parentContext         context key of the enclosing element, if any
 * @param sampleText            text observed in this context
 * @param contentControlProperties open property bag (content-control tag, type, title, ...)
 */
public record FormattingContext(
        String elementType,
        String contextKey,
        String structuralRole,
        String parentContext,
        String sampleText,
        Map<String, String> contentControlProperties
) {
    public FormattingContext {
        contentControlProperties = contentControlProperties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(contentControlProperties));
    }

    public FormattingContext(String elementType, String contextKey, String structuralRole) {
        this(elementType, contextKey, structuralRole, null, null, Map.of());
    }
}
