package com.ivamare.callsession.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.callsession.exception.CallSessionException;

/**
 * Converts open metadata documents to and from JSONB column text.
 */
class JsonbCodec {

    private final ObjectMapper objectMapper;

    JsonbCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Serialize a document. A missing or JSON-null document is stored as SQL NULL.
     */
    String write(JsonNode document) {
        if (document == null || document.isNull() || document.isMissingNode()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new CallSessionException("Failed to serialize metadata", e);
        }
    }

    /**
     * Deserialize a column value. SQL NULL reads back as an empty object.
     */
    JsonNode read(String json) {
        if (json == null) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CallSessionException("Failed to deserialize metadata", e);
        }
    }
}
