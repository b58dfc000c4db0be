package com.example.styleverify.model;

/**
 * Kind of discrepancy a mismatch reports.
 */
public enum MismatchCategory {
    /** Template context with no counterpart in the document. */
    MISSING_IN_DOCUMENT,
    /** Document context the template does not declare. */
    UNEXPECTED_IN_DOCUMENT,
    /** Named-style property difference (font, color, alignment, ...). */
    STYLE_PROPERTY,
    DIRECT_FORMAT,
    TAB_STOP
}
