package com.example.styleverify.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A formatting context extracted from the candidate document: where an element sits and which
 * formatting it carries.
 *
 * @param elementType          paragraph, run, table-cell, ...
 * @param contextKey           join key with the template contexts; derived from the indices when blank
 * @param structuralRole       heading, body, caption, ...
 * @param styleName            name of the applied named style
 * @param styleType            paragraph, character, table, ...
 * @param properties           raw style properties as reported by the extractor
 * @param directFormatPatterns direct formatting observed in the context
 * @param tabStops             tab stops in position order
 * @param sampleText           text of the element
 * @param location             human-readable location, if the extractor provides one
 */
public record ExtractedContext(
        String elementType,
        String contextKey,
        String structuralRole,
        String styleName,
        String styleType,
        Map<String, String> properties,
        List<DirectFormatPattern> directFormatPatterns,
        List<TabStop> tabStops,
        String sampleText,
        String location,
        Integer sectionIndex,
        Integer tableIndex,
        Integer rowIndex,
        Integer cellIndex,
        Integer paragraphIndex,
        Integer runIndex
) {
    public ExtractedContext {
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        directFormatPatterns = directFormatPatterns == null ? List.of() : List.copyOf(directFormatPatterns);
        tabStops = tabStops == null ? List.of() : List.copyOf(tabStops);
    }

    public ExtractedContext(String elementType, String contextKey, String structuralRole, String styleName,
                            Map<String, String> properties) {
        this(elementType, contextKey, structuralRole, styleName, null, properties, List.of(), List.of(),
                null, null, null, null, null, null, null, null);
    }

    /**
     * The context key, or {@code Section:s:Table:t:Row:r:Cell:c:Paragraph:p:Run:n} built from the
     * positional indices that are present.
     */
    public String effectiveContextKey() {
        if (contextKey != null && !contextKey.isBlank()) return contextKey.trim();
        List<String> parts = new ArrayList<>();
        if (sectionIndex != null && sectionIndex >= 0) parts.add("Section:" + sectionIndex);
        if (tableIndex != null && tableIndex >= 0) {
            parts.add("Table:" + tableIndex);
            if (rowIndex != null && rowIndex >= 0) {
                parts.add("Row:" + rowIndex);
                if (cellIndex != null && cellIndex >= 0) parts.add("Cell:" + cellIndex);
            }
        }
        if (paragraphIndex != null && paragraphIndex >= 0) parts.add("Paragraph:" + paragraphIndex);
        if (runIndex != null && runIndex >= 0) parts.add("Run:" + runIndex);
        return String.join(":", parts);
    }

    /** Canonical named-style properties; {@code styleType} is folded into the bag. */
    public StyleProperties baseProperties() {
        StyleProperties base = StyleProperties.of(properties);
        return styleType != null ? base.with(StyleProperties.STYLE_TYPE, styleType) : base;
    }

    public String describeLocation() {
        if (location != null && !location.isBlank()) return location;
        String type = elementType != null && !elementType.isBlank() ? elementType : "element";
        String style = styleName != null && !styleName.isBlank() ? " (style '" + styleName + "')" : "";
        String key = effectiveContextKey();
        return key.isEmpty() ? type + style : type + " at " + key + style;
    }
}
