package com.metricsentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.metricsentinel.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Converts {@link Alert} → JSON with ISO-8601 timestamps and lowercase enum
 * ids.
 */
public class AlertJsonSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(AlertJsonSerializer.class);

    private final ObjectMapper mapper;

    public AlertJsonSerializer() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @param alert the alert to serialize
     * @return the JSON document, or empty if the alert cannot be serialized
     */
    public Optional<String> serialize(Alert alert) {
        try {
            return Optional.of(mapper.writeValueAsString(alert));
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize alert {}: {}", alert.getId(), e.getMessage(), e);
            return Optional.empty();
        }
    }
}
