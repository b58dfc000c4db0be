package com.example.styleverify.service;

import com.example.styleverify.exception.TemplateInUseException;
import com.example.styleverify.exception.TemplateInactiveException;
import com.example.styleverify.exception.TemplateNotFoundException;
import com.example.styleverify.model.Template;
import com.example.styleverify.model.TemplateStatus;
import com.example.styleverify.model.TextStyle;
import com.example.styleverify.repository.TemplateRepository;
import com.example.styleverify.repository.VerificationResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Template versions: active-version lookup, registration of new versions when the template file
 * changes, archiving, and deletion guarded by existing verification results.
 */
@Service
public class TemplateCatalog {

    private static final Logger log = LoggerFactory.getLogger(TemplateCatalog.class);

    private final TemplateRepository templateRepository;
    private final VerificationResultRepository resultRepository;
    private final StyleSignatureBuilder signatureBuilder;
    private final Clock clock;

    public TemplateCatalog(TemplateRepository templateRepository,
                           VerificationResultRepository resultRepository,
                           StyleSignatureBuilder signatureBuilder,
                           Clock clock) {
        this.templateRepository = templateRepository;
        this.resultRepository = resultRepository;
        this.signatureBuilder = signatureBuilder;
        this.clock = clock;
    }

    /**
     * Newest active version of the named template.
     *
     * @throws TemplateNotFoundException if no version of the name exists
     * @throws TemplateInactiveException if versions exist but none is active
     */
    public Template loadActiveTemplate(String name) {
        List<Template> versions = templateRepository.findByNameOrderByVersionDesc(name);
        if (versions.isEmpty()) {
            throw new TemplateNotFoundException("Template '" + name + "' not found");
        }
        return versions.stream()
                .filter(Template::isActive)
                .findFirst()
                .orElseThrow(() -> new TemplateInactiveException("Template '" + name + "' has no active version"));
    }

    /**
     * Registers a template. When the active version has the same file hash it is returned as is;
     * otherwise the active version is archived and the candidate is stored as the next version
     * with the signature of every style derived.
     */
    public Template register(Template candidate, String modifiedBy) {
        List<Template> versions = templateRepository.findByNameOrderByVersionDesc(candidate.name());
        Optional<Template> active = versions.stream().filter(Template::isActive).findFirst();
        if (active.isPresent() && Objects.equals(active.get().fileHash(), candidate.fileHash())) {
            log.info("Template '{}' unchanged (hash {}), keeping v{}",
                    candidate.name(), candidate.fileHash(), active.get().version());
            return active.get();
        }

        Instant now = clock.instant();
        active.ifPresent(previous -> templateRepository.save(
                previous.withStatus(TemplateStatus.ARCHIVED, modifiedBy, now)));

        int nextVersion = versions.isEmpty() ? 1 : versions.get(0).version() + 1;
        List<TextStyle> signed = candidate.textStyles().stream()
                .map(style -> style.withStyleSignature(signatureBuilder.build(style.baseProperties()).value()))
                .toList();
        Template saved = templateRepository.save(candidate.asNewVersion(nextVersion, signed, now));
        log.info("Template '{}' registered as v{} with {} styles", saved.name(), saved.version(), signed.size());
        return saved;
    }

    public Template archive(String templateId, String modifiedBy) {
        Template template = templateRepository.findById(templateId)
                .orElseThrow(() -> new TemplateNotFoundException("Template " + templateId + " not found"));
        return templateRepository.save(template.withStatus(TemplateStatus.ARCHIVED, modifiedBy, clock.instant()));
    }

    /**
     * @throws TemplateInUseException if verification results reference the template
     */
    public void delete(String templateId) {
        if (!templateRepository.existsById(templateId)) {
            throw new TemplateNotFoundException("Template " + templateId + " not found");
        }
        if (resultRepository.existsByTemplateId(templateId)) {
            throw new TemplateInUseException(
                    "Template " + templateId + " is referenced by verification results and cannot be deleted");
        }
        templateRepository.deleteById(templateId);
        log.info("Template {} deleted", templateId);
    }
}
