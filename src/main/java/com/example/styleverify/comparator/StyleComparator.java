package com.example.styleverify.comparator;

import com.example.styleverify.model.FieldDifference;
import com.example.styleverify.model.MismatchCategory;

import java.util.List;

/**
 * One formatting dimension compared between a template style and a document context.
 * Implementations are stateless, thread-safe and never throw for a well-formed pair:
 * differing values are reported, not raised.
 */
public interface StyleComparator {

    /** Short name used in logs. */
    String name();

    /** Category of the discrepancies this comparator reports. */
    MismatchCategory category();

    /**
     * @param expected template side
     * @param actual   document side
     * @return field-level differences, empty when the dimension matches
     */
    List<FieldDifference> compare(ComparedStyle expected, ComparedStyle actual);
}
