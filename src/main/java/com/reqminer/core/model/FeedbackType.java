package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The pending decision a paused session is waiting on.
 */
public enum FeedbackType {
    CLARIFICATION("clarification"),
    SIMPLE_STRATEGY_CONFIRMATION("simple_strategy_confirmation"),
    META_ARCHITECT_CONFIRMATION("meta_architect_confirmation");

    private final String value;

    FeedbackType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Lenient lookup by wire value or constant name. Unknown values map to {@code null};
     * {@link FeedbackPayload#fromRequest} keeps the raw name so the dispatcher can tell them from absent ones.
     */
    @JsonCreator
    public static FeedbackType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (FeedbackType type : values()) {
            if (type.value.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        return null;
    }
}
