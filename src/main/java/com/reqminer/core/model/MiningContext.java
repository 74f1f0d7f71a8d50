package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Per-call metadata threaded through every node of a mining session.
 *
 * @param sessionId    checkpoint key; generated when blank
 * @param taskId       caller task identifier
 * @param domain       business domain hint, {@code general} by default
 * @param userId       requesting user, {@code anonymous} by default
 * @param timestamp    when the session was opened
 * @param currentRound number of clarification rounds already asked
 */
public record MiningContext(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("task_id") String taskId,
    String domain,
    @JsonProperty("user_id") String userId,
    Instant timestamp,
    @JsonProperty("current_round") int currentRound
) implements Serializable {

    public static final String DEFAULT_DOMAIN = "general";
    public static final String ANONYMOUS_USER = "anonymous";

    public MiningContext {
        domain = (domain == null || domain.isBlank()) ? DEFAULT_DOMAIN : domain;
        userId = (userId == null || userId.isBlank()) ? ANONYMOUS_USER : userId;
        if (currentRound < 0) {
            throw new IllegalArgumentException("currentRound must not be negative: " + currentRound);
        }
    }

    public static MiningContext of(String sessionId) {
        return new MiningContext(sessionId, null, null, null, Instant.now(), 0);
    }

    public MiningContext withSessionId(String newSessionId) {
        return new MiningContext(newSessionId, taskId, domain, userId, timestamp, currentRound);
    }

    public MiningContext withTaskId(String newTaskId) {
        return new MiningContext(sessionId, newTaskId, domain, userId, timestamp, currentRound);
    }

    public MiningContext withTimestamp(Instant newTimestamp) {
        return new MiningContext(sessionId, taskId, domain, userId, newTimestamp, currentRound);
    }

    public MiningContext withCurrentRound(int round) {
        return new MiningContext(sessionId, taskId, domain, userId, timestamp, round);
    }

    @JsonIgnore
    public boolean isGeneralDomain() {
        return DEFAULT_DOMAIN.equalsIgnoreCase(domain);
    }
}
