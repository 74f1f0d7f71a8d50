package com.reqminer.core.planner;

/**
 * Thrown when the strategic planner fails or returns nothing usable.
 */
public class StrategicPlanningException extends RuntimeException {

    public StrategicPlanningException(String message) {
        super(message);
    }

    public StrategicPlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
