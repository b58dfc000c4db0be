package com.example.styleverify.model;

import java.util.List;

/**
 * Payload returned by the remote extraction service.
 *
 * @param success  whether extraction succeeded
 * @param error    error description when it did not
 * @param contexts extracted contexts in document order
 */
public record ExtractionResponse(boolean success, String error, List<ExtractedContext> contexts) {}
