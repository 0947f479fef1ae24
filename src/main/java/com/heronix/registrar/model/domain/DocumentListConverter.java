package com.heronix.registrar.model.domain;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores the list of required document names as a JSON array.
 */
@Slf4j
@Converter
public class DocumentListConverter implements AttributeConverter<List<String>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<ArrayList<String>> TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<String> documents) {
        if (documents == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(documents);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize document list", e);
        }
    }

    @Override
    public List<String> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            ArrayList<String> documents = MAPPER.readValue(json, TYPE);
            return documents != null ? documents : new ArrayList<>();
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed document list: {}", e.getOriginalMessage());
            return new ArrayList<>();
        }
    }
}
