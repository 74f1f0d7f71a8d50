package com.reqminer.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/mining.
 *
 * @param input     natural-language request to mine
 * @param sessionId optional session id; generated when absent
 * @param taskId    optional caller task id; derived from the session id when absent
 * @param domain    business domain hint; nullable, defaults to general
 * @param userId    requesting user; nullable, defaults to anonymous
 */
public record MineRequest(
    String input,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("task_id") String taskId,
    String domain,
    @JsonProperty("user_id") String userId
) {}
