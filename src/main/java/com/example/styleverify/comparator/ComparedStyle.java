package com.example.styleverify.comparator;

import com.example.styleverify.model.DirectFormatPattern;
import com.example.styleverify.model.ExtractedContext;
import com.example.styleverify.model.StyleProperties;
import com.example.styleverify.model.StyleSignature;
import com.example.styleverify.model.TabStop;
import com.example.styleverify.model.TextStyle;
import com.example.styleverify.service.StyleSignatureBuilder;

import java.util.List;

/**
 * Side-neutral view of a style under comparison, built from a template {@link TextStyle}
 * or a document {@link ExtractedContext}.
 */
public record ComparedStyle(
        String styleName,
        String contextKey,
        String structuralRole,
        StyleProperties properties,
        StyleSignature signature,
        List<DirectFormatPattern> directFormatPatterns,
        List<TabStop> tabStops
) {

    public static ComparedStyle of(TextStyle style, StyleSignatureBuilder signatures) {
        StyleProperties properties = style.baseProperties();
        return new ComparedStyle(style.name(), style.contextOrEmpty().contextKey(),
                style.contextOrEmpty().structuralRole(), properties, signatures.build(properties),
                style.directFormatPatterns(), style.tabStops());
    }

    public static ComparedStyle of(ExtractedContext context, StyleSignatureBuilder signatures) {
        StyleProperties properties = context.baseProperties();
        return new ComparedStyle(context.styleName(), context.effectiveContextKey(), context.structuralRole(),
                properties, signatures.build(properties), context.directFormatPatterns(), context.tabStops());
    }
}
