package com.example.styleverify.service;

import com.example.styleverify.model.ExtractedContext;
import com.example.styleverify.model.FormattingContext;
import com.example.styleverify.model.MatchResult;
import com.example.styleverify.model.MatchedPair;
import com.example.styleverify.model.MatchedPair.MatchKind;
import com.example.styleverify.model.TextStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Pairs template styles with document contexts.
 * <p>
 * Greedy and deterministic: template styles are processed by id ascending. A first pass pairs
 * exact context keys; a second pass pairs the remaining template styles on element type plus
 * structural role. Each side is claimed at most once and ties go to the document context that
 * appears first. Must run on a single thread, the outcome depends on processing order.
 */
@Component
public class ContextMatcher {

    private static final Logger log = LoggerFactory.getLogger(ContextMatcher.class);

    private static final Comparator<TextStyle> TEMPLATE_ORDER = Comparator
            .comparing(TextStyle::id, Comparator.nullsLast(Comparator.naturalOrder()));

    public MatchResult match(List<TextStyle> templateStyles, List<ExtractedContext> documentContexts) {
        List<TextStyle> ordered = templateStyles.stream().sorted(TEMPLATE_ORDER).toList();
        int templateCount = ordered.size();
        int documentCount = documentContexts.size();

        ExtractedContext[] assignedDocument = new ExtractedContext[templateCount];
        MatchKind[] assignedKind = new MatchKind[templateCount];
        boolean[] claimed = new boolean[documentCount];

        // Pass 1: exact context key
        for (int t = 0; t < templateCount; t++) {
            String key = normalizeKey(ordered.get(t).contextOrEmpty().contextKey());
            if (key.isEmpty()) continue;
            for (int d = 0; d < documentCount; d++) {
                if (!claimed[d] && key.equals(normalizeKey(documentContexts.get(d).effectiveContextKey()))) {
                    claimed[d] = true;
                    assignedDocument[t] = documentContexts.get(d);
                    assignedKind[t] = MatchKind.CONTEXT_KEY;
                    break;
                }
            }
        }

        // Pass 2: element type + structural role
        for (int t = 0; t < templateCount; t++) {
            if (assignedDocument[t] != null) continue;
            FormattingContext context = ordered.get(t).contextOrEmpty();
            String elementType = normalizeTerm(context.elementType());
            String role = normalizeTerm(context.structuralRole());
            if (elementType.isEmpty() || role.isEmpty()) continue;
            for (int d = 0; d < documentCount; d++) {
                ExtractedContext candidate = documentContexts.get(d);
                if (!claimed[d]
                        && elementType.equals(normalizeTerm(candidate.elementType()))
                        && role.equals(normalizeTerm(candidate.structuralRole()))) {
                    claimed[d] = true;
                    assignedDocument[t] = candidate;
                    assignedKind[t] = MatchKind.ELEMENT_AND_ROLE;
                    break;
                }
            }
        }

        List<MatchedPair> matched = new ArrayList<>();
        List<TextStyle> missing = new ArrayList<>();
        for (int t = 0; t < templateCount; t++) {
            if (assignedDocument[t] != null) {
                matched.add(new MatchedPair(matched.size(), ordered.get(t), assignedDocument[t], assignedKind[t]));
            } else {
                missing.add(ordered.get(t));
            }
        }
        List<ExtractedContext> unexpected = new ArrayList<>();
        for (int d = 0; d < documentCount; d++) {
            if (!claimed[d]) unexpected.add(documentContexts.get(d));
        }

        log.debug("ContextMatcher: {} matched, {} missing in document, {} unexpected in document",
                matched.size(), missing.size(), unexpected.size());
        return new MatchResult(matched, missing, unexpected);
    }

    private static String normalizeKey(String key) {
        return key == null ? "" : key.trim();
    }

    private static String normalizeTerm(String term) {
        return term == null ? "" : term.trim().toLowerCase(Locale.ROOT);
    }
}
