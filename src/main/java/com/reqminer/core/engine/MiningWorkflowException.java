package com.reqminer.core.engine;

import com.reqminer.core.model.MiningResult;

/**
 * Thrown when a graph node fails. Carries the failing node and, when available,
 * the partial result assembled from the failed state.
 */
public class MiningWorkflowException extends MiningException {

    private final String sessionId;
    private final String failedNode;
    private final transient MiningResult partialResult;

    public MiningWorkflowException(String sessionId, String failedNode, String message, MiningResult partialResult) {
        super("Mining session " + sessionId + " failed at " + failedNode + ": " + message);
        this.sessionId = sessionId;
        this.failedNode = failedNode;
        this.partialResult = partialResult;
    }

    public MiningWorkflowException(String sessionId, String failedNode, String message, Throwable cause) {
        super("Mining session " + sessionId + " failed at " + failedNode + ": " + message, cause);
        this.sessionId = sessionId;
        this.failedNode = failedNode;
        this.partialResult = null;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getFailedNode() {
        return failedNode;
    }

    public MiningResult getPartialResult() {
        return partialResult;
    }
}
