package com.example.styleverify.service;

import com.example.styleverify.config.StyleVerifyProperties;
import com.example.styleverify.model.Discrepancy;
import com.example.styleverify.model.FieldDifference;
import com.example.styleverify.model.MatchResult;
import com.example.styleverify.model.Mismatch;
import com.example.styleverify.model.MismatchCategory;
import com.example.styleverify.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.example.styleverify.TestStyles.NOW;
import static com.example.styleverify.TestStyles.context;
import static com.example.styleverify.TestStyles.style;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

@DisplayName("MismatchAggregator")
class MismatchAggregatorTest {

    private final MismatchAggregator aggregator =
            new MismatchAggregator(new SeverityPolicy(StyleVerifyProperties.defaults()));

    private static Discrepancy discrepancy(String contextKey, String role, MismatchCategory category,
                                           FieldDifference... differences) {
        return new Discrepancy(contextKey, "paragraph at " + contextKey, role, "Normal", category,
                List.of(differences), null);
    }

    private static FieldDifference diff(String field) {
        return new FieldDifference(field, "expected", "actual");
    }

    @Nested
    @DisplayName("severity")
    class SeverityAssignment {

        @Test
        @DisplayName("style property differences are HIGH")
        void signatureIsHigh() {
            List<Mismatch> result = aggregator.aggregate(
                    List.of(discrepancy("p1", "Body", MismatchCategory.STYLE_PROPERTY, diff("color"))), NOW);

            assertThat(result).singleElement()
                    .satisfies(m -> {
                        assertThat(m.severity()).isEqualTo(Severity.HIGH);
                        assertThat(m.mismatchFields()).isEqualTo("color");
                        assertThat(m.createdOn()).isEqualTo(NOW);
                    });
        }

        @Test
        @DisplayName("tab stop differences under a heading are escalated")
        void headingEscalation() {
            List<Mismatch> result = aggregator.aggregate(List.of(
                    discrepancy("p1", "Heading1", MismatchCategory.TAB_STOP, diff("TabStopCountMismatch")),
                    discrepancy("p2", "Body", MismatchCategory.TAB_STOP, diff("TabStopCountMismatch"))), NOW);

            assertThat(result).extracting(Mismatch::contextKey, Mismatch::severity)
                    .containsExactly(
                            tuple("p1", Severity.HIGH),
                            tuple("p2", Severity.MEDIUM));
        }

        @Test
        @DisplayName("structural discrepancies are MEDIUM")
        void structuralIsMedium() {
            List<Mismatch> result = aggregator.aggregate(List.of(
                    discrepancy("p9", "Heading2", MismatchCategory.MISSING_IN_DOCUMENT,
                            new FieldDifference(MismatchAggregator.MISSING_FIELD, "Heading2", null))), NOW);

            assertThat(result).singleElement()
                    .extracting(Mismatch::severity).isEqualTo(Severity.MEDIUM);
        }
    }

    @Nested
    @DisplayName("deduplication")
    class Deduplication {

        @Test
        @DisplayName("same context and field set collapse into one mismatch with the highest severity")
        void collapsesDuplicates() {
            List<Mismatch> result = aggregator.aggregate(List.of(
                    discrepancy("p1", "Body", MismatchCategory.DIRECT_FORMAT, diff("bold")),
                    discrepancy("p1", "Body", MismatchCategory.STYLE_PROPERTY, diff("bold"))), NOW);

            assertThat(result).singleElement()
                    .extracting(Mismatch::severity).isEqualTo(Severity.HIGH);
        }

        @Test
        @DisplayName("field order does not affect the grouping key")
        void fieldSetIsUnordered() {
            List<Mismatch> result = aggregator.aggregate(List.of(
                    discrepancy("p1", "Body", MismatchCategory.STYLE_PROPERTY, diff("fontSize"), diff("color")),
                    discrepancy("p1", "Body", MismatchCategory.STYLE_PROPERTY, diff("color"), diff("fontSize"))),
                    NOW);

            assertThat(result).singleElement()
                    .satisfies(m -> assertThat(m.fieldList()).containsExactly("color", "fontSize"));
        }

        @Test
        @DisplayName("different field sets at the same context stay separate")
        void differentFieldSetsKept() {
            List<Mismatch> result = aggregator.aggregate(List.of(
                    discrepancy("p1", "Body", MismatchCategory.STYLE_PROPERTY, diff("color")),
                    discrepancy("p1", "Body", MismatchCategory.STYLE_PROPERTY, diff("bold"))), NOW);

            assertThat(result).hasSize(2);
        }
    }

    @Test
    @DisplayName("report order is severity, then context key, then fields, whatever the input order")
    void deterministicOrdering() {
        List<Discrepancy> input = new ArrayList<>(List.of(
                discrepancy("p3", "Body", MismatchCategory.TAB_STOP, diff("TabStopCountMismatch")),
                discrepancy("p1", "Body", MismatchCategory.STYLE_PROPERTY, diff("fontSize")),
                discrepancy("p2", "Body", MismatchCategory.STYLE_PROPERTY, diff("color")),
                discrepancy("p1", "Body", MismatchCategory.STYLE_PROPERTY, diff("color")),
                discrepancy("p0", "Body", MismatchCategory.UNEXPECTED_IN_DOCUMENT,
                        new FieldDifference(MismatchAggregator.UNEXPECTED_FIELD, null, "Quote"))));

        List<Mismatch> reference = aggregator.aggregate(input, NOW);
        assertThat(reference).extracting(m -> m.contextKey() + ":" + m.mismatchFields())
                .containsExactly("p1:color", "p1:fontSize", "p2:color", "p0:UnexpectedInDocument",
                        "p3:TabStopCountMismatch");

        Random random = new Random(7);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(input, random);
            assertThat(aggregator.aggregate(input, NOW)).isEqualTo(reference);
        }
    }

    @Test
    @DisplayName("unmatched sides become missing and unexpected discrepancies")
    void structuralDiscrepancies() {
        var missingStyle = style(9, "Heading2").contextKey("p9").role("Heading2").build();
        var extra = context("p42").styleName("Quote").role("Body").build();

        List<Discrepancy> result = aggregator.structuralDiscrepancies(
                new MatchResult(List.of(), List.of(missingStyle), List.of(extra)));

        assertThat(result).extracting(Discrepancy::contextKey, Discrepancy::category)
                .containsExactly(
                        tuple("p9", MismatchCategory.MISSING_IN_DOCUMENT),
                        tuple("p42", MismatchCategory.UNEXPECTED_IN_DOCUMENT));
        assertThat(result.get(0).differences())
                .containsExactly(new FieldDifference(MismatchAggregator.MISSING_FIELD, "Heading2", null));
    }

    @Test
    @DisplayName("unmatched sides without context keys stay separate mismatches")
    void keylessStructuralDiscrepanciesStaySeparate() {
        var caption = style(5, "Caption").contextKey(null).role("Caption").build();
        var quote = style(6, "Quote").contextKey(null).role("Quote").build();
        var first = context(null).styleName("Note").build();
        var second = context(null).styleName("Note").build();

        List<Mismatch> result = aggregator.aggregate(aggregator.structuralDiscrepancies(
                new MatchResult(List.of(), List.of(caption, quote), List.of(first, second))), NOW);

        assertThat(result).extracting(Mismatch::contextKey)
                .containsExactly("style:Caption#5", "style:Quote#6", "unmatched#0:Note", "unmatched#1:Note");
        assertThat(result).extracting(Mismatch::location)
                .contains("paragraph at style:Caption#5 (style 'Caption')", "paragraph (style 'Note')");
    }

    @Test
    @DisplayName("single style property difference gets a concrete recommendation")
    void recommendedAction() {
        Discrepancy colour = new Discrepancy("p1", "paragraph at p1", "Heading1", "Heading1",
                MismatchCategory.STYLE_PROPERTY, List.of(new FieldDifference("color", "#000000", "#FF0000")), null);

        assertThat(MismatchAggregator.recommendedAction(colour, "color"))
                .isEqualTo("Change color from '#FF0000' to '#000000' to match template style 'Heading1'.");
    }
}
