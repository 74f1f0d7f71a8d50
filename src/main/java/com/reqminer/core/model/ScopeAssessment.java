package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Classifier estimate of how broad a request is.
 */
public record ScopeAssessment(
    String complexity,
    @JsonProperty("time_span") String timeSpan,
    @JsonProperty("domain_breadth") String domainBreadth
) implements Serializable {

    @JsonIgnore
    public boolean isBroad() {
        return "high".equalsIgnoreCase(complexity) || "broad".equalsIgnoreCase(domainBreadth);
    }
}
