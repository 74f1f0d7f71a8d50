package com.reqminer.dispatch.api;

import com.reqminer.core.model.FeedbackPayload;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/mining/{sessionId}/feedback.
 * An unknown {@code type} is passed through as such and ends the session at packaging.
 */
public record FeedbackRequest(
    String type,
    Boolean confirmation,
    List<String> responses,
    String adjustments
) {

    public FeedbackPayload toPayload() {
        return FeedbackPayload.fromRequest(type, Boolean.TRUE.equals(confirmation), responses, adjustments);
    }
}
