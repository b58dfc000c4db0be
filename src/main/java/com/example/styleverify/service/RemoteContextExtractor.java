package com.example.styleverify.service;

import com.example.styleverify.config.StyleVerifyProperties;
import com.example.styleverify.exception.ExtractionFailedException;
import com.example.styleverify.model.ExtractedContext;
import com.example.styleverify.model.ExtractionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * HTTP client for the document extraction service.
 * Delegates all document parsing to the remote service, which answers with the formatting
 * contexts of the uploaded document.
 */
@Service
@ConditionalOnProperty(prefix = "styleverify.extractor", name = "mode", havingValue = "remote")
public class RemoteContextExtractor implements ContextExtractor {

    private static final Logger log = LoggerFactory.getLogger(RemoteContextExtractor.class);

    private final RestClient restClient;

    public RemoteContextExtractor(StyleVerifyProperties properties) {
        StyleVerifyProperties.Extractor config = properties.extractor();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(config.connectTimeout());
        factory.setReadTimeout(config.readTimeout());

        this.restClient = RestClient.builder()
                .baseUrl(config.baseUrl())
                .requestFactory(factory)
                .build();
    }

    @Override
    public List<ExtractedContext> extractContexts(String documentName, byte[] documentBytes) {
        if (documentBytes == null || documentBytes.length == 0) {
            throw new ExtractionFailedException("Document '" + documentName + "' is empty");
        }
        log.info("Sending '{}' ({} bytes) to extraction service", documentName, documentBytes.length);

        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new ByteArrayResource(documentBytes) {
            @Override
            public String getFilename() {
                return documentName;
            }
        });

        ExtractionResponse response;
        try {
            response = restClient.post()
                    .uri("/extract-contexts")
                    .body(body)
                    .retrieve()
                    .body(ExtractionResponse.class);
        } catch (RestClientException e) {
            throw new ExtractionFailedException(
                    "Extraction service unreachable or rejected '" + documentName + "': " + e.getMessage(), e);
        }

        if (response == null || !response.success() || response.contexts() == null) {
            String error = response != null && response.error() != null ? response.error() : "no contexts returned";
            throw new ExtractionFailedException("Extraction of '" + documentName + "' failed: " + error);
        }
        log.info("Extraction completed: {} contexts from '{}'", response.contexts().size(), documentName);
        return response.contexts();
    }
}
