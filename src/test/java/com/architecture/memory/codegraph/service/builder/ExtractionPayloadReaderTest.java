package com.architecture.memory.codegraph.service.builder;

import com.architecture.memory.codegraph.dto.extraction.ExtractionPayload;
import com.architecture.memory.codegraph.dto.extraction.RawEntityKind;
import com.architecture.memory.codegraph.dto.extraction.RawRelationship;
import com.architecture.memory.codegraph.dto.extraction.RawRelationshipKind;
import com.architecture.memory.codegraph.exception.MalformedExtractionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractionPayloadReaderTest {

    private final ExtractionPayloadReader reader = new ExtractionPayloadReader(new ObjectMapper());

    @Test
    void readsArrayOfPayloads_ignoringUnknownFields() throws IOException {
        List<ExtractionPayload> payloads;
        try (InputStream in = getClass().getResourceAsStream("/extraction/calc.json")) {
            payloads = reader.read(in);
        }

        assertThat(payloads).extracting(ExtractionPayload::getModuleId).containsExactly("calc", "app");

        ExtractionPayload calc = payloads.get(0);
        assertThat(calc.getEntities()).extracting(e -> e.getKind()).containsExactly(
                RawEntityKind.MODULE, RawEntityKind.FUNCTION, RawEntityKind.PARAMETER, RawEntityKind.PARAMETER);
        assertThat(calc.getEntities().get(3).getHasDefault()).isTrue();
        assertThat(calc.getEntities().get(0).getLocation().format()).isEqualTo("calc.py:1:0");

        RawRelationship call = payloads.get(1).getRelationships().get(1);
        assertThat(call.getKind()).isEqualTo(RawRelationshipKind.CALLS);
        assertThat(call.getArgCount()).isEqualTo(2);
        assertThat(call.getArgTypes()).containsExactly("int", "str");
    }

    @Test
    void readsSingleObject() {
        List<ExtractionPayload> payloads = reader.read(
                "{\"moduleId\": \"solo\", \"entities\": [{\"kind\": \"MODULE\", \"name\": \"solo\", \"qualifiedName\": \"solo\"}]}");

        assertThat(payloads).singleElement()
                .satisfies(p -> assertThat(p.getRelationships()).isEmpty());
    }

    @Test
    void reportsUnreadableJsonAsMalformedExtraction() {
        assertThatThrownBy(() -> reader.read("{\"moduleId\": \"calc\", \"entities\": [}"))
                .isInstanceOf(MalformedExtractionException.class)
                .hasMessageContaining("Unreadable extractor payload");
    }

    @Test
    void reportsUnknownEntityKind() {
        assertThatThrownBy(() -> reader.read(
                "{\"moduleId\": \"calc\", \"entities\": [{\"kind\": \"MACRO\", \"name\": \"m\", \"qualifiedName\": \"calc.m\"}]}"))
                .isInstanceOf(MalformedExtractionException.class);
    }
}
