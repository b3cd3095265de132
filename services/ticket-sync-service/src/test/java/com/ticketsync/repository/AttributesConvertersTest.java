package com.ticketsync.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ticketsync.domain.Attributes;

@DisplayName("Attributes converters")
class AttributesConvertersTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AttributesConverters.AttributesWriter writer = new AttributesConverters.AttributesWriter(objectMapper);
    private final AttributesConverters.AttributesReader reader = new AttributesConverters.AttributesReader(objectMapper);

    @Test
    @DisplayName("stores nested attributes as JSON and reads them back")
    void storesNestedAttributesAsJson() {
        Attributes attributes = Attributes.of(Map.of("employee", "jdoe", "equipment", List.of("laptop", "badge")));

        String json = writer.convert(attributes);

        assertThat(json).contains("\"employee\":\"jdoe\"");
        assertThat(reader.convert(json)).isEqualTo(attributes);
    }

    @Test
    @DisplayName("reads a blank column as empty attributes")
    void readsBlankAsEmpty() {
        assertThat(reader.convert("  ").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("refuses corrupt JSON")
    void refusesCorruptJson() {
        assertThatThrownBy(() -> reader.convert("{not json"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("registers one writer and one reader")
    void registersBothDirections() {
        assertThat(AttributesConverters.all(objectMapper)).hasSize(2);
    }
}
