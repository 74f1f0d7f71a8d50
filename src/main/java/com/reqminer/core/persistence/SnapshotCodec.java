package com.reqminer.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * JSON encoding of {@link MiningSnapshot}s shared by all checkpoint stores.
 */
public class SnapshotCodec {

    private final ObjectMapper objectMapper;

    public SnapshotCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new ParameterNamesModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(MiningSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot for session " + snapshot.sessionId(), e);
        }
    }

    public MiningSnapshot decode(String sessionId, String json) {
        if (json == null || json.isBlank()) {
            throw new CheckpointCorruptedException(sessionId, "Empty snapshot for session " + sessionId, null);
        }
        try {
            return objectMapper.readValue(json, MiningSnapshot.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CheckpointCorruptedException(sessionId,
                    "Failed to deserialize snapshot for session " + sessionId + ": " + e.getMessage(), e);
        }
    }
}
