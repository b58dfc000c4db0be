package com.example.styleverify.model;

/**
 * A template style paired with the document context it was matched to.
 *
 * @param index           position of the pair in matching order
 * @param templateStyle   template side
 * @param documentContext document side
 * @param kind            which matching rule produced the pair
 */
public record MatchedPair(int index, TextStyle templateStyle, ExtractedContext documentContext, MatchKind kind) {

    public enum MatchKind {
        CONTEXT_KEY,
        ELEMENT_AND_ROLE
    }
}
