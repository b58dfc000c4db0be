package com.example.styleverify.orchestrator;

import com.example.styleverify.comparator.ComparedStyle;
import com.example.styleverify.comparator.DirectFormatComparator;
import com.example.styleverify.comparator.SignatureComparator;
import com.example.styleverify.comparator.StyleComparator;
import com.example.styleverify.comparator.TabStopComparator;
import com.example.styleverify.config.StyleVerifyProperties;
import com.example.styleverify.exception.ComparatorFailureException;
import com.example.styleverify.model.*;
import com.example.styleverify.service.ContextMatcher;
import com.example.styleverify.service.MismatchAggregator;
import com.example.styleverify.service.SeverityPolicy;
import com.example.styleverify.service.StyleSignatureBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.example.styleverify.TestStyles.NOW;
import static com.example.styleverify.TestStyles.context;
import static com.example.styleverify.TestStyles.matching;
import static com.example.styleverify.TestStyles.style;
import static com.example.styleverify.TestStyles.tab;
import static com.example.styleverify.TestStyles.template;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VerificationOrchestrator")
class VerificationOrchestratorTest {

    private final StyleSignatureBuilder signatures = new StyleSignatureBuilder();
    private ExecutorService executor;
    private VerificationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        orchestrator = orchestratorWith(List.of(
                new SignatureComparator(), new DirectFormatComparator(signatures), new TabStopComparator()));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private VerificationOrchestrator orchestratorWith(List<StyleComparator> comparators) {
        return new VerificationOrchestrator(new ContextMatcher(), comparators,
                new MismatchAggregator(new SeverityPolicy(StyleVerifyProperties.defaults())), signatures,
                executor, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private VerificationResult verify(Template template, List<ExtractedContext> contexts) {
        return orchestrator.verify(template, "candidate.docx", contexts, VerificationOptions.defaults(), "bob");
    }

    @Nested
    @DisplayName("completed runs")
    class CompletedRuns {

        @Test
        @DisplayName("heading color difference is one HIGH mismatch at the heading context")
        void headingColor() {
            TextStyle heading = style(1, "Heading1").role("Heading1").fontSize(16.0).bold(true).build();
            TextStyle body = style(2, "Normal").build();

            VerificationResult result = verify(template(heading, body), List.of(
                    matching(heading).property("color", "#FF0000").build(),
                    matching(body).build()));

            assertThat(result.status()).isEqualTo(VerificationStatus.COMPLETED);
            assertThat(result.totalMismatches()).isEqualTo(1);
            Mismatch mismatch = result.mismatches().get(0);
            assertThat(mismatch.contextKey()).isEqualTo("p1");
            assertThat(mismatch.mismatchFields()).isEqualTo("color");
            assertThat(mismatch.severity()).isEqualTo(Severity.HIGH);
            assertThat(mismatch.category()).isEqualTo(MismatchCategory.STYLE_PROPERTY);
            assertThat(mismatch.expected()).containsEntry("color", "#000000");
            assertThat(mismatch.actual()).containsEntry("color", "#FF0000");
            assertThat(mismatch.createdOn()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("dropped tab stop is reported as a count mismatch")
        void tabStopCount() {
            TextStyle toc = style(1, "TOC1").tabStop(tab("left", "none")).tabStop(tab("right", "dot")).build();

            VerificationResult result = verify(template(toc), List.of(
                    matching(toc).clearTabStops().tabStop(tab("left", "none")).build()));

            assertThat(result.mismatches()).singleElement().satisfies(m -> {
                assertThat(m.mismatchFields()).isEqualTo(TabStopComparator.COUNT_MISMATCH);
                assertThat(m.category()).isEqualTo(MismatchCategory.TAB_STOP);
                assertThat(m.severity()).isEqualTo(Severity.MEDIUM);
            });
        }

        @Test
        @DisplayName("template style without a document counterpart is missing in document")
        void missingContext() {
            TextStyle body = style(1, "Normal").build();
            TextStyle subtitle = style(9, "Subtitle").elementType("table-cell").role("Subtitle").build();

            VerificationResult result = verify(template(body, subtitle), List.of(matching(body).build()));

            assertThat(result.mismatches()).singleElement().satisfies(m -> {
                assertThat(m.contextKey()).isEqualTo("p9");
                assertThat(m.category()).isEqualTo(MismatchCategory.MISSING_IN_DOCUMENT);
                assertThat(m.mismatchFields()).isEqualTo(MismatchAggregator.MISSING_FIELD);
                assertThat(m.severity()).isEqualTo(Severity.MEDIUM);
            });
        }

        @Test
        @DisplayName("every key-less template style missing from the document is reported")
        void keylessMissingStyles() {
            TextStyle caption = style(1, "Caption").contextKey(null).role("Caption").build();
            TextStyle quote = style(2, "Quote").contextKey(null).role("Quote").build();

            VerificationResult result = verify(template(caption, quote), List.of(
                    context("t1").elementType("table").role("Table").styleName("TableGrid").build()));

            assertThat(result.mismatches())
                    .filteredOn(m -> m.category() == MismatchCategory.MISSING_IN_DOCUMENT)
                    .extracting(Mismatch::contextKey)
                    .containsExactly("style:Caption#1", "style:Quote#2");
            assertThat(result.mismatches())
                    .filteredOn(m -> m.category() == MismatchCategory.UNEXPECTED_IN_DOCUMENT)
                    .extracting(Mismatch::contextKey)
                    .containsExactly("t1");
        }

        @Test
        @DisplayName("document identical to the template has no mismatches")
        void identicalDocument() {
            TextStyle heading = style(1, "Heading1").role("Heading1").bold(true).build();
            TextStyle body = style(2, "Normal").tabStop(tab("left", null)).build();

            VerificationResult result = verify(template(heading, body),
                    List.of(matching(heading).build(), matching(body).build()));

            assertThat(result.status()).isEqualTo(VerificationStatus.COMPLETED);
            assertThat(result.mismatches()).isEmpty();
            assertThat(result.warnings()).isEmpty();
            assertThat(result.timings()).isNotNull();
        }

        @Test
        @DisplayName("repeated runs over the same input produce the same report")
        void idempotent() {
            List<TextStyle> styles = new ArrayList<>();
            List<ExtractedContext> contexts = new ArrayList<>();
            for (int i = 1; i <= 40; i++) {
                TextStyle s = style(i, "Style" + i).role(i % 5 == 0 ? "Heading1" : "Body").build();
                styles.add(s);
                if (i % 7 != 0) {
                    contexts.add(matching(s).property("color", i % 3 == 0 ? "#FF0000" : "#000000")
                            .tabStop(tab("left", null)).build());
                }
            }
            contexts.add(context("extra").styleName("Quote").build());
            Template tpl = template(styles.toArray(TextStyle[]::new));

            VerificationResult first = verify(tpl, contexts);
            VerificationResult second = verify(tpl, contexts);

            assertThat(first.mismatches()).isNotEmpty().isEqualTo(second.mismatches());
            assertThat(first.verificationDate()).isEqualTo(second.verificationDate());
        }

        @Test
        @DisplayName("ignored style types are left out on both sides")
        void ignoredStyleTypes() {
            TextStyle body = style(1, "Normal").build();
            TextStyle emphasis = style(2, "Emphasis").styleType("character").elementType("run").build();

            VerificationResult result = orchestrator.verify(template(body, emphasis), "candidate.docx",
                    List.of(matching(body).build(), context("r7").elementType("run").styleType("Character").build()),
                    new VerificationOptions(Set.of("CHARACTER")), "bob");

            assertThat(result.status()).isEqualTo(VerificationStatus.COMPLETED);
            assertThat(result.mismatches()).isEmpty();
        }

        @Test
        @DisplayName("over-long signatures produce warnings but the run completes")
        void truncatedSignatureWarning() {
            TextStyle tagged = style(1, "Tagged").property("contentControlTag", "x".repeat(600)).build();

            VerificationResult result = verify(template(tagged), List.of(matching(tagged).build()));

            assertThat(result.status()).isEqualTo(VerificationStatus.COMPLETED);
            assertThat(result.mismatches()).isEmpty();
            assertThat(result.warnings()).hasSize(2).allMatch(w -> w.startsWith("SignatureTruncated"));
        }
    }

    @Nested
    @DisplayName("failed runs")
    class FailedRuns {

        @Test
        @DisplayName("document without contexts fails with no mismatches")
        void emptyDocument() {
            VerificationResult result = verify(template(style(1, "Normal").build()), List.of());

            assertThat(result.status()).isEqualTo(VerificationStatus.FAILED);
            assertThat(result.errorMessage()).isEqualTo(VerificationOrchestrator.EMPTY_DOCUMENT_MESSAGE);
            assertThat(result.mismatches()).isEmpty();
        }

        @Test
        @DisplayName("cancelled run fails without partial mismatches")
        void cancelled() {
            TextStyle body = style(1, "Normal").build();
            CancellationSignal cancellation = CancellationSignal.create();
            cancellation.cancel();

            VerificationResult result = orchestrator.verify(template(body), "candidate.docx",
                    List.of(matching(body).property("color", "#FF0000").build()),
                    VerificationOptions.defaults(), "bob", cancellation);

            assertThat(result.status()).isEqualTo(VerificationStatus.FAILED);
            assertThat(result.errorMessage()).isEqualTo(VerificationOrchestrator.CANCELLED_MESSAGE);
            assertThat(result.mismatches()).isEmpty();
        }

        @Test
        @DisplayName("comparator defect aborts the run")
        void comparatorDefect() {
            StyleComparator broken = new StyleComparator() {
                @Override
                public String name() {
                    return "broken";
                }

                @Override
                public MismatchCategory category() {
                    return MismatchCategory.STYLE_PROPERTY;
                }

                @Override
                public List<FieldDifference> compare(ComparedStyle expected, ComparedStyle actual) {
                    throw new IllegalStateException("boom");
                }
            };
            VerificationOrchestrator failing = orchestratorWith(List.of(new SignatureComparator(), broken));
            TextStyle body = style(1, "Normal").build();

            assertThatThrownBy(() -> failing.verify(template(body), "candidate.docx",
                    List.of(matching(body).build()), VerificationOptions.defaults(), "bob"))
                    .isInstanceOf(ComparatorFailureException.class)
                    .hasMessageContaining("broken")
                    .hasRootCauseMessage("boom");
        }
    }
}
