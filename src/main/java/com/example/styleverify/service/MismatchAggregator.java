package com.example.styleverify.service;

import com.example.styleverify.model.Discrepancy;
import com.example.styleverify.model.ExtractedContext;
import com.example.styleverify.model.FieldDifference;
import com.example.styleverify.model.MatchResult;
import com.example.styleverify.model.Mismatch;
import com.example.styleverify.model.MismatchCategory;
import com.example.styleverify.model.Severity;
import com.example.styleverify.model.TextStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Turns the raw discrepancies of one run into the final mismatch list.
 * <ul>
 *   <li>assigns severities through the {@link SeverityPolicy}</li>
 *   <li>collapses discrepancies sharing (context key, field set) into one mismatch carrying the
 *       highest severity of the group</li>
 *   <li>orders by severity descending, then context key, then mismatch fields</li>
 * </ul>
 * The output depends only on the input list, so identical inputs give identical reports.
 */
@Component
public class MismatchAggregator {

    private static final Logger log = LoggerFactory.getLogger(MismatchAggregator.class);

    public static final String MISSING_FIELD = "MissingInDocument";
    public static final String UNEXPECTED_FIELD = "UnexpectedInDocument";

    /** Deterministic report order: severity (HIGH first) → context key → fields. */
    public static final Comparator<Mismatch> REPORT_ORDER = Comparator
            .comparingInt((Mismatch m) -> m.severity().rank()).reversed()
            .thenComparing(Mismatch::contextKey)
            .thenComparing(Mismatch::mismatchFields);

    private final SeverityPolicy severityPolicy;

    public MismatchAggregator(SeverityPolicy severityPolicy) {
        this.severityPolicy = severityPolicy;
    }

    /**
     * Structural discrepancies for the unmatched sides of a match result:
     * template styles first (matching order), then document contexts (document order).
     * Sides without a context key are reported at a key naming the style, so they never
     * collapse into each other.
     */
    public List<Discrepancy> structuralDiscrepancies(MatchResult matchResult) {
        List<Discrepancy> discrepancies = new ArrayList<>();
        for (TextStyle style : matchResult.missing()) {
            var context = style.contextOrEmpty();
            String key = reportKey(style);
            String location = (context.elementType() != null ? context.elementType() : "element")
                    + " at " + key + " (style '" + style.name() + "')";
            discrepancies.add(new Discrepancy(key, location, context.structuralRole(), style.name(),
                    MismatchCategory.MISSING_IN_DOCUMENT,
                    List.of(new FieldDifference(MISSING_FIELD, style.name(), null)),
                    context.sampleText()));
        }
        List<ExtractedContext> unexpected = matchResult.unexpected();
        for (int i = 0; i < unexpected.size(); i++) {
            ExtractedContext context = unexpected.get(i);
            String key = context.effectiveContextKey();
            if (key.isBlank()) {
                key = "unmatched#" + i + (context.styleName() != null ? ":" + context.styleName() : "");
            }
            discrepancies.add(new Discrepancy(key, context.describeLocation(),
                    context.structuralRole(), context.styleName(), MismatchCategory.UNEXPECTED_IN_DOCUMENT,
                    List.of(new FieldDifference(UNEXPECTED_FIELD, null, context.styleName())),
                    context.sampleText()));
        }
        return discrepancies;
    }

    /**
     * Context key of a template style, or {@code style:<name>#<id>} when it has none.
     */
    public static String reportKey(TextStyle style) {
        String key = style.contextOrEmpty().contextKey();
        if (key != null && !key.isBlank()) return key.trim();
        return "style:" + style.name() + (style.id() != null ? "#" + style.id() : "");
    }

    public List<Mismatch> aggregate(List<Discrepancy> discrepancies, Instant createdOn) {
        Map<String, Group> groups = new LinkedHashMap<>();
        for (Discrepancy discrepancy : discrepancies) {
            if (discrepancy.differences().isEmpty()) continue;
            TreeSet<String> fields = new TreeSet<>();
            discrepancy.differences().forEach(d -> fields.add(d.field()));
            String fieldList = String.join(",", fields);
            Severity severity = severityPolicy.severityOf(discrepancy.category(), discrepancy.structuralRole());
            groups.computeIfAbsent(discrepancy.contextKey() + '\u0000' + fieldList,
                            k -> new Group(discrepancy, fieldList))
                    .add(discrepancy, severity);
        }

        List<Mismatch> mismatches = new ArrayList<>(groups.size());
        for (Group group : groups.values()) {
            mismatches.add(group.toMismatch(createdOn));
        }
        mismatches.sort(REPORT_ORDER);

        if (discrepancies.size() != mismatches.size()) {
            log.debug("MismatchAggregator: {} discrepancies collapsed into {} mismatches",
                    discrepancies.size(), mismatches.size());
        }
        return List.copyOf(mismatches);
    }

    static String recommendedAction(Discrepancy discrepancy, String fieldList) {
        String style = discrepancy.styleName() != null ? "'" + discrepancy.styleName() + "'" : "the template style";
        return switch (discrepancy.category()) {
            case MISSING_IN_DOCUMENT -> "Add content styled " + style + " at " + discrepancy.contextKey()
                    + " as defined by the template.";
            case UNEXPECTED_IN_DOCUMENT -> "Remove or restyle the element at " + discrepancy.contextKey()
                    + "; the template defines no style for it.";
            case STYLE_PROPERTY -> {
                if (discrepancy.differences().size() == 1) {
                    FieldDifference only = discrepancy.differences().get(0);
                    yield "Change " + only.field() + " from '" + valueOrDefault(only.actual()) + "' to '"
                            + valueOrDefault(only.expected()) + "' to match template style " + style + ".";
                }
                yield "Reapply template style " + style + " to fix: " + fieldList + ".";
            }
            case DIRECT_FORMAT -> "Align direct formatting with the template patterns of " + style + ": "
                    + fieldList + ".";
            case TAB_STOP -> "Reset the tab stops of " + style + " to the template layout.";
        };
    }

    private static String valueOrDefault(String value) {
        return value != null ? value : "default";
    }

    private static final class Group {
        private final Discrepancy first;
        private final String fieldList;
        private final Map<String, String> expected = new LinkedHashMap<>();
        private final Map<String, String> actual = new LinkedHashMap<>();
        private Severity severity = Severity.LOW;

        Group(Discrepancy first, String fieldList) {
            this.first = first;
            this.fieldList = fieldList;
        }

        void add(Discrepancy discrepancy, Severity discrepancySeverity) {
            severity = Severity.max(severity, discrepancySeverity);
            for (FieldDifference difference : discrepancy.differences()) {
                if (!expected.containsKey(difference.field())) {
                    expected.put(difference.field(), difference.expected());
                    actual.put(difference.field(), difference.actual());
                }
            }
        }

        Mismatch toMismatch(Instant createdOn) {
            return new Mismatch(first.contextKey(), first.location(), first.structuralRole(), first.category(),
                    fieldList, Collections.unmodifiableMap(expected),
                    Collections.unmodifiableMap(actual), first.sampleText(), severity,
                    recommendedAction(first, fieldList), createdOn);
        }
    }
}
