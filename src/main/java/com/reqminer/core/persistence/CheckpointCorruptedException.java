package com.reqminer.core.persistence;

/**
 * Thrown when a stored snapshot exists but cannot be decoded.
 */
public class CheckpointCorruptedException extends RuntimeException {

    private final String sessionId;

    public CheckpointCorruptedException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
