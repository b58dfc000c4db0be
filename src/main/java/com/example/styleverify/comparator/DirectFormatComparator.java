package com.example.styleverify.comparator;

import com.example.styleverify.model.DirectFormatPattern;
import com.example.styleverify.model.FieldDifference;
import com.example.styleverify.model.MismatchCategory;
import com.example.styleverify.model.StyleSignature;
import com.example.styleverify.service.StyleSignatureBuilder;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that every direct formatting pattern of the template style is declared, with equivalent
 * overrides, by the document for the same context string. Document patterns in contexts the
 * template does not declare are reported as unexpected.
 */
@Component
@Order(2)
public class DirectFormatComparator implements StyleComparator {

    static final String ABSENT = "absent";
    static final String FIELD_PREFIX = "directFormat:";
    static final String UNEXPECTED_FIELD_PREFIX = "unexpectedDirectFormat:";

    private final StyleSignatureBuilder signatures;

    public DirectFormatComparator(StyleSignatureBuilder signatures) {
        this.signatures = signatures;
    }

    @Override
    public String name() {
        return "direct-format";
    }

    @Override
    public MismatchCategory category() {
        return MismatchCategory.DIRECT_FORMAT;
    }

    @Override
    public List<FieldDifference> compare(ComparedStyle expected, ComparedStyle actual) {
        List<FieldDifference> differences = new ArrayList<>();
        Set<String> templateContexts = new HashSet<>();

        for (DirectFormatPattern templatePattern : expected.directFormatPatterns()) {
            templateContexts.add(templatePattern.contextKey());
            StyleSignature expectedSignature = signatures.build(templatePattern.overrides());
            List<DirectFormatPattern> candidates = actual.directFormatPatterns().stream()
                    .filter(p -> p.contextKey().equals(templatePattern.contextKey()))
                    .toList();
            String field = FIELD_PREFIX + templatePattern.patternName();
            if (candidates.isEmpty()) {
                differences.add(new FieldDifference(field, expectedSignature.value(), ABSENT));
                continue;
            }
            boolean equivalent = candidates.stream()
                    .anyMatch(p -> signatures.build(p.overrides()).sameAs(expectedSignature));
            if (!equivalent) {
                String actualSignature = signatures.build(candidates.get(0).overrides()).value();
                differences.add(new FieldDifference(field, expectedSignature.value(), actualSignature));
            }
        }

        for (DirectFormatPattern documentPattern : actual.directFormatPatterns()) {
            if (!templateContexts.contains(documentPattern.contextKey())) {
                differences.add(new FieldDifference(UNEXPECTED_FIELD_PREFIX + documentPattern.patternName(),
                        ABSENT, signatures.build(documentPattern.overrides()).value()));
            }
        }
        return differences;
    }
}
