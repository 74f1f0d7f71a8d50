package com.reqminer.core.model;

/**
 * How well-specified a request is, measured against SMART criteria.
 */
public enum DemandState {
    VAGUE_UNCLEAR,
    SMART_COMPLIANT,
    SMART_LARGE_SCOPE
}
