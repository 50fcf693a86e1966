package com.architecture.memory.codegraph.service.builder;

import com.architecture.memory.codegraph.dto.extraction.ExtractionPayload;
import com.architecture.memory.codegraph.exception.MalformedExtractionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Reads extractor output. A document is either a single payload object or an array of payloads.
 */
@Component
@Slf4j
public class ExtractionPayloadReader {

    private final ObjectMapper objectMapper;

    public ExtractionPayloadReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<ExtractionPayload> read(String json) {
        try {
            return fromTree(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new MalformedExtractionException(null, List.of("Unreadable extractor payload: " + e.getOriginalMessage()));
        }
    }

    public List<ExtractionPayload> read(InputStream in) {
        try {
            return fromTree(objectMapper.readTree(in));
        } catch (JsonProcessingException e) {
            throw new MalformedExtractionException(null, List.of("Unreadable extractor payload: " + e.getOriginalMessage()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read extractor payload", e);
        }
    }

    private List<ExtractionPayload> fromTree(JsonNode tree) throws JsonProcessingException {
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            return List.of();
        }
        List<ExtractionPayload> payloads = tree.isArray()
                ? objectMapper.treeToValue(tree, objectMapper.getTypeFactory()
                        .constructCollectionType(List.class, ExtractionPayload.class))
                : List.of(objectMapper.treeToValue(tree, ExtractionPayload.class));
        log.debug("[extraction-reader] read payloads={}", payloads.size());
        return payloads;
    }
}
