package com.boundplan.planning.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private final ObjectMapper objectMapper;

    /**
     * Pretty-printed JSON for embedding into prompts. Never throws.
     */
    public String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            log.warn("Failed to serialize {} for prompt: {}", value == null ? "null" : value.getClass().getSimpleName(),
                    ex.getMessage());
            return "\"serialization-failed-" + UUID.randomUUID() + "\"";
        }
    }

    /**
     * Compact JSON for storage.
     */
    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), ex);
        }
    }

    public <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), ex);
        }
    }

    public static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }
}
