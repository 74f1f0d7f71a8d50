package com.reqminer.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event of a mining session.
 *
 * @param eventType one of the {@code session.*} types declared here
 * @param sessionId the session this event belongs to
 * @param taskId    caller task identifier (nullable)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record MiningEvent(
    String eventType,
    String sessionId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String STARTED = "session.started";
    public static final String PAUSED = "session.paused";
    public static final String RESUMED = "session.resumed";
    public static final String COMPLETED = "session.completed";
    public static final String FAILED = "session.failed";

    public static MiningEvent of(String eventType, String sessionId, String taskId, Map<String, Object> payload) {
        return new MiningEvent(eventType, sessionId, taskId, payload == null ? Map.of() : payload, Instant.now());
    }
}
