package com.example.styleverify.service;

import com.example.styleverify.exception.ExtractionFailedException;
import com.example.styleverify.model.ExtractedContext;

import java.util.List;

/**
 * Turns document bytes into formatting contexts.
 */
public interface ContextExtractor {

    /**
     * @param documentName  name of the document, for logging and error messages
     * @param documentBytes raw document content
     * @return extracted contexts in document order
     * @throws ExtractionFailedException if the document cannot be parsed
     */
    List<ExtractedContext> extractContexts(String documentName, byte[] documentBytes);
}
