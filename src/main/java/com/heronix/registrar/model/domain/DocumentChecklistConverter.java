package com.heronix.registrar.model.domain;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores a document checklist (document name -> verified) as JSON text.
 *
 * Unreadable column values load as an empty checklist.
 */
@Slf4j
@Converter
public class DocumentChecklistConverter implements AttributeConverter<Map<String, Boolean>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Boolean>> TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Map<String, Boolean> checklist) {
        if (checklist == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(checklist);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize document checklist", e);
        }
    }

    @Override
    public Map<String, Boolean> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, Boolean> checklist = MAPPER.readValue(json, TYPE);
            return checklist != null ? checklist : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed document checklist: {}", e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }
}
