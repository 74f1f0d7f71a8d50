package com.reqminer.core.engine;

import java.time.Duration;

/**
 * Thrown when another call holds the session lock past the configured timeout.
 */
public class SessionBusyException extends MiningException {

    private final String sessionId;

    public SessionBusyException(String sessionId, Duration waited) {
        super("Session " + sessionId + " is busy; lock not acquired within " + waited.toMillis() + "ms");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
