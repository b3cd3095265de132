package com.ticketsync.repository;

import java.util.List;
import java.util.Map;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ticketsync.domain.Attributes;

/**
 * R2DBC converters storing {@link Attributes} as JSON text columns.
 */
public final class AttributesConverters {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private AttributesConverters() {
    }

    public static List<Converter<?, ?>> all(ObjectMapper objectMapper) {
        return List.of(new AttributesWriter(objectMapper), new AttributesReader(objectMapper));
    }

    @WritingConverter
    static final class AttributesWriter implements Converter<Attributes, String> {

        private final ObjectMapper objectMapper;

        AttributesWriter(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
        }

        @Override
        public String convert(Attributes source) {
            try {
                return objectMapper.writeValueAsString(source.asMap());
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Attributes are not serializable to JSON", e);
            }
        }
    }

    @ReadingConverter
    static final class AttributesReader implements Converter<String, Attributes> {

        private final ObjectMapper objectMapper;

        AttributesReader(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
        }

        @Override
        public Attributes convert(String source) {
            if (source.isBlank()) {
                return Attributes.empty();
            }
            try {
                return Attributes.of(objectMapper.readValue(source, MAP_TYPE));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Stored attributes are not valid JSON", e);
            }
        }
    }
}
