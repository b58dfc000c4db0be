package com.example.styleverify.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named style of a {@link Template}, with the structural context it applies to,
 * its allowed direct formatting patterns and its ordered tab stops.
 *
 * @param id                   identifier unique within the template; defines matching order
 * @param name                 style name (e.g. "Heading1")
 * @param fontFamily           font family
 * @param fontSize             font size in points
 * @param bold                 bold flag
 * @param italic               italic flag
 * @param underline            underline flag
 * @param color                RGB hex color
 * @param alignment            paragraph alignment
 * @param styleType            paragraph, character, table, ...
 * @param basedOnStyle         parent style name
 * @param properties           further style properties (spacing, indentation, caps, ...)
 * @param styleSignature       canonical signature, derived when the template is registered
 * @param version              style version
 * @param formattingContext    where the style structurally applies
 * @param directFormatPatterns inline overrides allowed per context
 * @param tabStops             tab stops in position order
 */
public record TextStyle(
        Long id,
        String name,
        String fontFamily,
        Double fontSize,
        Boolean bold,
        Boolean italic,
        Boolean underline,
        String color,
        String alignment,
        String styleType,
        String basedOnStyle,
        Map<String, String> properties,
        String styleSignature,
        int version,
        FormattingContext formattingContext,
        List<DirectFormatPattern> directFormatPatterns,
        List<TabStop> tabStops
) {
    public TextStyle {
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        directFormatPatterns = directFormatPatterns == null ? List.of() : List.copyOf(directFormatPatterns);
        tabStops = tabStops == null ? List.of() : List.copyOf(tabStops);
        if (version <= 0) version = 1;
    }

    /**
     * Canonical named-style properties: the open property bag overlaid with the typed fields.
     */
    public StyleProperties baseProperties() {
        StyleProperties base = StyleProperties.of(properties);
        base = overlay(base, StyleProperties.FONT_FAMILY, fontFamily);
        base = overlay(base, StyleProperties.FONT_SIZE, fontSize);
        base = overlay(base, StyleProperties.BOLD, bold);
        base = overlay(base, StyleProperties.ITALIC, italic);
        base = overlay(base, StyleProperties.UNDERLINE, underline);
        base = overlay(base, StyleProperties.COLOR, color);
        base = overlay(base, StyleProperties.ALIGNMENT, alignment);
        return overlay(base, StyleProperties.STYLE_TYPE, styleType);
    }

    private static StyleProperties overlay(StyleProperties base, String key, Object value) {
        return value == null ? base : base.with(key, value);
    }

    public FormattingContext contextOrEmpty() {
        return formattingContext != null ? formattingContext : new FormattingContext(null, null, null);
    }

    /** Creates a copy carrying the given signature. */
    public TextStyle withStyleSignature(String signature) {
        return new TextStyle(id, name, fontFamily, fontSize, bold, italic, underline, color, alignment,
                styleType, basedOnStyle, properties, signature, version, formattingContext,
                directFormatPatterns, tabStops);
    }
}
