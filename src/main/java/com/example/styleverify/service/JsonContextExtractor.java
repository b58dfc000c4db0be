package com.example.styleverify.service;

import com.example.styleverify.exception.ExtractionFailedException;
import com.example.styleverify.model.ExtractedContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Reads contexts from a JSON export produced by an upstream extractor: either a top-level array
 * of contexts or an object with a {@code contexts} array.
 * <p>
 * Parsing is lenient (trailing commas, comments, unknown fields) since exports come from
 * different extractor versions.
 */
@Service
@ConditionalOnProperty(prefix = "styleverify.extractor", name = "mode", havingValue = "json", matchIfMissing = true)
public class JsonContextExtractor implements ContextExtractor {

    private static final Logger log = LoggerFactory.getLogger(JsonContextExtractor.class);

    private static final TypeReference<List<ExtractedContext>> CONTEXT_LIST = new TypeReference<>() {};

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public List<ExtractedContext> extractContexts(String documentName, byte[] documentBytes) {
        if (documentBytes == null || documentBytes.length == 0) {
            throw new ExtractionFailedException("Document '" + documentName + "' is empty");
        }
        try {
            JsonNode root = LENIENT_MAPPER.readTree(documentBytes);
            JsonNode contexts = root != null && root.isObject() ? root.get("contexts") : root;
            if (contexts == null || !contexts.isArray()) {
                throw new ExtractionFailedException(
                        "Document '" + documentName + "' is not a context export (expected an array of contexts)");
            }
            List<ExtractedContext> extracted = LENIENT_MAPPER.convertValue(contexts, CONTEXT_LIST);
            log.info("Extracted {} contexts from '{}'", extracted.size(), documentName);
            return extracted;
        } catch (JsonProcessingException e) {
            throw new ExtractionFailedException(
                    "Document '" + documentName + "' is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ExtractionFailedException(
                    "Document '" + documentName + "' has malformed contexts: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ExtractionFailedException("Unable to read document '" + documentName + "'", e);
        }
    }
}
