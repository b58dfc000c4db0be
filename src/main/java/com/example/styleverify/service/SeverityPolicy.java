package com.example.styleverify.service;

import com.example.styleverify.config.StyleVerifyProperties;
import com.example.styleverify.model.MismatchCategory;
import com.example.styleverify.model.Severity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Maps a discrepancy category and the affected structural role to a severity, following
 * {@code styleverify.severity.*}. Direct-format and tab-stop discrepancies are escalated for
 * roles starting with one of the escalation prefixes (headings by default).
 */
@Component
public class SeverityPolicy {

    private final StyleVerifyProperties.SeverityPolicy config;
    private final List<String> escalationPrefixes;

    public SeverityPolicy(StyleVerifyProperties properties) {
        this.config = properties.severity();
        this.escalationPrefixes = config.escalationRolePrefixes().stream()
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .filter(p -> !p.isEmpty())
                .toList();
    }

    public Severity severityOf(MismatchCategory category, String structuralRole) {
        return switch (category) {
            case MISSING_IN_DOCUMENT, UNEXPECTED_IN_DOCUMENT -> config.structural();
            case STYLE_PROPERTY -> config.signature();
            case DIRECT_FORMAT -> isEscalated(structuralRole)
                    ? Severity.max(config.directFormat(), config.escalated())
                    : config.directFormat();
            case TAB_STOP -> isEscalated(structuralRole)
                    ? Severity.max(config.tabStop(), config.escalated())
                    : config.tabStop();
        };
    }

    boolean isEscalated(String structuralRole) {
        if (structuralRole == null || structuralRole.isBlank()) return false;
        String role = structuralRole.trim().toLowerCase(Locale.ROOT);
        return escalationPrefixes.stream().anyMatch(role::startsWith);
    }
}
