package com.reqminer.core.engine;

/**
 * Thrown when no usable checkpoint exists for a session.
 */
public class SessionNotFoundException extends MiningException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("No checkpoint found for session " + sessionId);
        this.sessionId = sessionId;
    }

    public SessionNotFoundException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
