package org.quarry.history.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.quarry.history.exception.StorageException;
import org.springframework.stereotype.Component;

/**
 * Converts opaque snapshots between {@link JsonNode} and the JSON text stored in the database.
 */
@RequiredArgsConstructor
@Component
public class JsonUtils {

    private final ObjectMapper objectMapper;

    public String toJson(JsonNode snapshot) {
        if (snapshot == null || snapshot.isMissingNode()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Snapshot cannot be serialized", e);
        }
    }

    public JsonNode toJsonNode(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StorageException("Stored snapshot is not valid JSON", e);
        }
    }
}
