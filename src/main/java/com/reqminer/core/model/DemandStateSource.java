package com.reqminer.core.model;

/**
 * Which tier of the classification chain produced the demand state.
 */
public enum DemandStateSource {
    CLASSIFIER,
    ANALYSIS_INFERENCE,
    LEXICAL_HEURISTIC,
    DEFAULT,
    ROUND_LIMIT           // Forced by the clarification round limiter
}
