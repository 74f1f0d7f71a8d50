package com.reqminer.core.model;

/**
 * Lifecycle status of a mining session.
 */
public enum ServiceStatus {
    PROCESSING,                  // Graph traversal in progress
    WAITING_FOR_USER_FEEDBACK,
    PROCESSING_FEEDBACK,         // Resumed with a feedback payload
    COMPLETED,
    ERROR
}
