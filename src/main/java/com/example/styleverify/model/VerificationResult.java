package com.example.styleverify.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * One verification run of a document against a template version.
 * Mismatches are embedded and ordered (severity descending, context key ascending).
 * Status changes go through {@link #transitionTo}, which rejects moves out of a terminal state.
 */
@Document(collection = "verification_results")
public record VerificationResult(
        @Id String id,
        String templateId,
        String templateName,
        int templateVersion,
        String documentName,
        VerificationStatus status,
        String errorMessage,
        Instant verificationDate,
        int totalMismatches,
        List<Mismatch> mismatches,
        List<String> warnings,
        PipelineTimings timings,
        String createdBy,
        Instant createdOn
) {
    public VerificationResult {
        mismatches = mismatches == null ? List.of() : List.copyOf(mismatches);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (status == null) status = VerificationStatus.PENDING;
    }

    /** New run in {@code PENDING} state. */
    public static VerificationResult pending(Template template, String documentName, String createdBy, Instant now) {
        return new VerificationResult(null, template.id(), template.name(), template.version(), documentName,
                VerificationStatus.PENDING, null, now, 0, List.of(), List.of(), null, createdBy, now);
    }

    public VerificationResult transitionTo(VerificationStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Verification cannot move from " + status + " to " + next);
        }
        return new VerificationResult(id, templateId, templateName, templateVersion, documentName,
                next, errorMessage, verificationDate, totalMismatches, mismatches, warnings, timings, createdBy,
                createdOn);
    }

    public VerificationResult completed(List<Mismatch> found, List<String> runWarnings, PipelineTimings stageTimings) {
        VerificationResult done = transitionTo(VerificationStatus.COMPLETED);
        return new VerificationResult(id, templateId, templateName, templateVersion, documentName,
                done.status(), null, verificationDate, found.size(), found, runWarnings, stageTimings, createdBy,
                createdOn);
    }

    /** Terminal failure: no partial mismatches are kept. */
    public VerificationResult failed(String message) {
        VerificationResult done = transitionTo(VerificationStatus.FAILED);
        return new VerificationResult(id, templateId, templateName, templateVersion, documentName,
                done.status(), message, verificationDate, 0, List.of(), warnings, null, createdBy, createdOn);
    }

    public VerificationResult withId(String newId) {
        return new VerificationResult(newId, templateId, templateName, templateVersion, documentName,
                status, errorMessage, verificationDate, totalMismatches, mismatches, warnings, timings, createdBy,
                createdOn);
    }
}
