package com.smartroom.booking.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores a booking's recurrence pattern as a JSON document in a single column.
 */
@Converter
public class RecurrencePatternConverter implements AttributeConverter<RecurrencePattern, String> {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    @Override
    public String convertToDatabaseColumn(RecurrencePattern pattern) {
        if (pattern == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(pattern);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Recurrence pattern could not be serialized", e);
        }
    }

    @Override
    public RecurrencePattern convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, RecurrencePattern.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored recurrence pattern is unreadable: " + json, e);
        }
    }
}
