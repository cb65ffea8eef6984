package com.metricsentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Converts raw request bytes → {@link IngestRequest}.
 * <p>
 * Unknown properties are ignored so pollers can send extra fields.
 * </p>
 */
public class IngestRequestParser {

    private final ObjectMapper mapper;

    public IngestRequestParser() {
        mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param body raw JSON body
     * @return a validated request
     * @throws IllegalArgumentException if the body is empty, malformed, or
     *                                  lacks a required field
     */
    public IngestRequest parse(byte[] body) {
        if (body == null || body.length == 0) {
            throw new IllegalArgumentException("Request body is empty");
        }
        IngestRequest request;
        try {
            request = mapper.readValue(body, IngestRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed ingest request: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unreadable ingest request: " + e.getMessage(), e);
        }
        if (request == null) {
            throw new IllegalArgumentException("Request body is empty");
        }
        request.validate();
        return request;
    }
}
