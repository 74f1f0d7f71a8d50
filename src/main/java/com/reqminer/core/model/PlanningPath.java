package com.reqminer.core.model;

/**
 * Planning branch taken after intent analysis.
 */
public enum PlanningPath {
    SIMPLE_STRATEGY,
    META_ARCHITECT
}
