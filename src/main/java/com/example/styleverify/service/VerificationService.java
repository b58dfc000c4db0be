package com.example.styleverify.service;

import com.example.styleverify.exception.ExtractionFailedException;
import com.example.styleverify.exception.VerificationResultNotFoundException;
import com.example.styleverify.model.*;
import com.example.styleverify.orchestrator.CancellationSignal;
import com.example.styleverify.orchestrator.VerificationOrchestrator;
import com.example.styleverify.repository.VerificationResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Entry point for verifying documents against stored templates.
 * <p>
 * Template errors surface before a run starts; extraction failures produce a stored
 * {@code FAILED} run; completed and failed runs are persisted, aborted runs are not.
 */
@Service
public class VerificationService {

    private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

    private final TemplateCatalog templateCatalog;
    private final ContextExtractor contextExtractor;
    private final VerificationOrchestrator orchestrator;
    private final VerificationResultRepository resultRepository;
    private final Clock clock;

    public VerificationService(TemplateCatalog templateCatalog,
                               ContextExtractor contextExtractor,
                               VerificationOrchestrator orchestrator,
                               VerificationResultRepository resultRepository,
                               Clock clock) {
        this.templateCatalog = templateCatalog;
        this.contextExtractor = contextExtractor;
        this.orchestrator = orchestrator;
        this.resultRepository = resultRepository;
        this.clock = clock;
    }

    /**
     * Extracts the document's contexts and verifies them against the active version of the template.
     *
     * @param templateName  template to verify against
     * @param documentName  document name, stored with the result
     * @param documentBytes raw document content handed to the extractor
     * @param createdBy     user requesting the verification
     * @param options       run options
     * @return the stored result ({@code COMPLETED} or {@code FAILED})
     */
    public VerificationResult verifyDocument(String templateName, String documentName, byte[] documentBytes,
                                             String createdBy, VerificationOptions options) {
        Template template = templateCatalog.loadActiveTemplate(templateName);

        List<ExtractedContext> contexts;
        try {
            contexts = contextExtractor.extractContexts(documentName, documentBytes);
        } catch (ExtractionFailedException e) {
            log.warn("Extraction failed for '{}': {}", documentName, e.getMessage());
            VerificationResult failed = VerificationResult.pending(template, documentName, createdBy, clock.instant())
                    .transitionTo(VerificationStatus.RUNNING)
                    .failed(e.getMessage());
            return resultRepository.save(failed);
        }
        return runAndStore(template, documentName, contexts, createdBy, options, CancellationSignal.create());
    }

    /**
     * Verifies already extracted contexts against the active version of the template.
     */
    public VerificationResult verifyContexts(String templateName, String documentName,
                                             List<ExtractedContext> contexts, String createdBy,
                                             VerificationOptions options) {
        return verifyContexts(templateName, documentName, contexts, createdBy, options, CancellationSignal.create());
    }

    public VerificationResult verifyContexts(String templateName, String documentName,
                                             List<ExtractedContext> contexts, String createdBy,
                                             VerificationOptions options, CancellationSignal cancellation) {
        Template template = templateCatalog.loadActiveTemplate(templateName);
        return runAndStore(template, documentName, contexts, createdBy, options, cancellation);
    }

    public VerificationResult getResult(String id) {
        return resultRepository.findById(id)
                .orElseThrow(() -> new VerificationResultNotFoundException("Verification result " + id + " not found"));
    }

    public List<VerificationResult> findResultsForTemplate(String templateId) {
        return resultRepository.findByTemplateIdOrderByVerificationDateDesc(templateId);
    }

    public VerificationSummary summarize() {
        return VerificationSummary.from(resultRepository.findAll());
    }

    private VerificationResult runAndStore(Template template, String documentName, List<ExtractedContext> contexts,
                                           String createdBy, VerificationOptions options,
                                           CancellationSignal cancellation) {
        VerificationResult result = orchestrator.verify(template, documentName, contexts, options, createdBy,
                cancellation);
        VerificationResult saved = resultRepository.save(result);
        log.info("Verification {} of '{}' stored: {} ({} mismatches)",
                saved.id(), documentName, saved.status(), saved.totalMismatches());
        return saved;
    }
}
