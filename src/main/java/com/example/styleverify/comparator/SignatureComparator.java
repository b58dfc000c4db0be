package com.example.styleverify.comparator;

import com.example.styleverify.model.FieldDifference;
import com.example.styleverify.model.MismatchCategory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Compares named-style properties. Equal signatures short-circuit; otherwise both canonical
 * property maps are diffed so the report names the fields that differ.
 */
@Component
@Order(1)
public class SignatureComparator implements StyleComparator {

    @Override
    public String name() {
        return "signature";
    }

    @Override
    public MismatchCategory category() {
        return MismatchCategory.STYLE_PROPERTY;
    }

    @Override
    public List<FieldDifference> compare(ComparedStyle expected, ComparedStyle actual) {
        if (expected.signature().sameAs(actual.signature())) {
            return List.of();
        }
        return expected.properties().differingKeys(actual.properties()).stream()
                .map(key -> new FieldDifference(key,
                        expected.properties().asMap().get(key),
                        actual.properties().asMap().get(key)))
                .toList();
    }
}
