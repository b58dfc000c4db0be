package com.example.styleverify.orchestrator;

import com.example.styleverify.comparator.ComparedStyle;
import com.example.styleverify.comparator.StyleComparator;
import com.example.styleverify.exception.ComparatorFailureException;
import com.example.styleverify.exception.VerificationCancelledException;
import com.example.styleverify.model.*;
import com.example.styleverify.service.ContextMatcher;
import com.example.styleverify.service.MismatchAggregator;
import com.example.styleverify.service.StyleSignatureBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Verification pipeline for one document against one template version.
 * Pipeline:
 * 1. Context matching (sequential, order-sensitive)
 * 2. Parallel comparison of matched pairs with every comparator, joined at a barrier
 * 3. Aggregation: severity, deduplication, ordering
 * <p>
 * A run is a pure function of the template snapshot and the document contexts. It fails without
 * mismatches when the document has no contexts or is cancelled; a comparator defect aborts it
 * with {@link ComparatorFailureException}.
 */
@Service
public class VerificationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(VerificationOrchestrator.class);

    static final String EMPTY_DOCUMENT_MESSAGE = "Document contains no formatting contexts";
    static final String CANCELLED_MESSAGE = "Verification cancelled";

    private final ContextMatcher contextMatcher;
    private final List<StyleComparator> comparators;
    private final MismatchAggregator aggregator;
    private final StyleSignatureBuilder signatureBuilder;
    private final ExecutorService comparisonExecutor;
    private final Clock clock;

    public VerificationOrchestrator(ContextMatcher contextMatcher,
                                    List<StyleComparator> comparators,
                                    MismatchAggregator aggregator,
                                    StyleSignatureBuilder signatureBuilder,
                                    @Qualifier("comparisonExecutor") ExecutorService comparisonExecutor,
                                    Clock clock) {
        this.contextMatcher = contextMatcher;
        this.comparators = List.copyOf(comparators);
        this.aggregator = aggregator;
        this.signatureBuilder = signatureBuilder;
        this.comparisonExecutor = comparisonExecutor;
        this.clock = clock;
    }

    public VerificationResult verify(Template template, String documentName, List<ExtractedContext> documentContexts,
                                     VerificationOptions options, String createdBy) {
        return verify(template, documentName, documentContexts, options, createdBy, CancellationSignal.create());
    }

    public VerificationResult verify(Template template, String documentName, List<ExtractedContext> documentContexts,
                                     VerificationOptions options, String createdBy, CancellationSignal cancellation) {
        VerificationResult run = VerificationResult.pending(template, documentName, createdBy, clock.instant())
                .transitionTo(VerificationStatus.RUNNING);
        log.info("Verifying '{}' against template '{}' v{}", documentName, template.name(), template.version());

        if (documentContexts == null || documentContexts.isEmpty()) {
            log.warn("Verification of '{}' failed: {}", documentName, EMPTY_DOCUMENT_MESSAGE);
            return run.failed(EMPTY_DOCUMENT_MESSAGE);
        }
        VerificationOptions effectiveOptions = options != null ? options : VerificationOptions.defaults();

        // ── Step 1: Context matching ──
        long start = System.nanoTime();
        List<TextStyle> templateStyles = template.textStyles().stream()
                .filter(s -> !effectiveOptions.isIgnored(s.styleType()))
                .toList();
        List<ExtractedContext> contexts = documentContexts.stream()
                .filter(c -> !effectiveOptions.isIgnored(c.styleType()))
                .toList();
        MatchResult matchResult = contextMatcher.match(templateStyles, contexts);
        double matchingSeconds = secondsSince(start);
        log.info("[1/3] Matching completed: {} pairs, {} missing, {} unexpected",
                matchResult.matched().size(), matchResult.missing().size(), matchResult.unexpected().size());

        // ── Step 2: Parallel pair comparison ──
        start = System.nanoTime();
        List<CompletableFuture<PairOutcome>> futures = matchResult.matched().stream()
                .map(pair -> CompletableFuture.supplyAsync(() -> comparePair(pair, cancellation), comparisonExecutor))
                .toList();
        List<PairOutcome> outcomes = new ArrayList<>(futures.size());
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
            futures.forEach(f -> outcomes.add(f.join()));
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof VerificationCancelledException) {
                log.info("Verification of '{}' cancelled during comparison", documentName);
                return run.failed(CANCELLED_MESSAGE);
            }
            log.error("Verification of '{}' aborted by comparator failure", documentName, cause);
            if (cause instanceof ComparatorFailureException failure) throw failure;
            throw new ComparatorFailureException("Pair comparison failed: " + cause.getMessage(), cause);
        }
        if (cancellation.isCancelled()) {
            log.info("Verification of '{}' cancelled before aggregation", documentName);
            return run.failed(CANCELLED_MESSAGE);
        }
        double comparisonSeconds = secondsSince(start);
        log.info("[2/3] Comparison completed: {} pairs with {} comparators", outcomes.size(), comparators.size());

        // ── Step 3: Aggregation ──
        start = System.nanoTime();
        List<Discrepancy> discrepancies = new ArrayList<>(aggregator.structuralDiscrepancies(matchResult));
        List<String> warnings = new ArrayList<>();
        for (PairOutcome outcome : outcomes) {
            discrepancies.addAll(outcome.discrepancies());
            warnings.addAll(outcome.warnings());
        }
        List<Mismatch> mismatches = aggregator.aggregate(discrepancies, run.verificationDate());
        double aggregationSeconds = secondsSince(start);
        log.info("[3/3] Aggregation completed: {} mismatches from {} discrepancies",
                mismatches.size(), discrepancies.size());

        return run.completed(mismatches, warnings,
                new PipelineTimings(matchingSeconds, comparisonSeconds, aggregationSeconds));
    }

    private PairOutcome comparePair(MatchedPair pair, CancellationSignal cancellation) {
        if (cancellation.isCancelled()) {
            throw new VerificationCancelledException(CANCELLED_MESSAGE);
        }
        TextStyle templateStyle = pair.templateStyle();
        ExtractedContext documentContext = pair.documentContext();
        ComparedStyle expected = ComparedStyle.of(templateStyle, signatureBuilder);
        ComparedStyle actual = ComparedStyle.of(documentContext, signatureBuilder);

        String contextKey = documentContext.effectiveContextKey();
        if (contextKey.isBlank()) {
            contextKey = MismatchAggregator.reportKey(templateStyle);
        }
        String role = templateStyle.contextOrEmpty().structuralRole() != null
                ? templateStyle.contextOrEmpty().structuralRole()
                : documentContext.structuralRole();

        List<String> warnings = new ArrayList<>(2);
        if (expected.signature().truncated()) {
            warnings.add("SignatureTruncated: template style '" + templateStyle.name() + "' at " + contextKey);
        }
        if (actual.signature().truncated()) {
            warnings.add("SignatureTruncated: document context " + contextKey);
        }
        if (!warnings.isEmpty()) {
            log.warn("Signature truncated for context {}; comparison continues on truncated signature", contextKey);
        }

        List<Discrepancy> discrepancies = new ArrayList<>();
        for (StyleComparator comparator : comparators) {
            List<FieldDifference> differences;
            try {
                differences = comparator.compare(expected, actual);
            } catch (RuntimeException e) {
                throw new ComparatorFailureException(
                        "Comparator '" + comparator.name() + "' failed on context " + contextKey, e);
            }
            if (!differences.isEmpty()) {
                discrepancies.add(new Discrepancy(contextKey, documentContext.describeLocation(), role,
                        templateStyle.name(), comparator.category(), differences, documentContext.sampleText()));
            }
        }
        return new PairOutcome(discrepancies, warnings);
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private record PairOutcome(List<Discrepancy> discrepancies, List<String> warnings) {}
}
