package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.stream.Stream;

/**
 * Per-criterion verdicts of a SMART analysis. A {@code null} verdict means the
 * classifier did not assess that criterion.
 */
public record SmartCriteria(
    Boolean specific,
    Boolean measurable,
    Boolean achievable,
    Boolean relevant,
    @JsonProperty("time_bound") Boolean timeBound
) implements Serializable {

    public static SmartCriteria none() {
        return new SmartCriteria(null, null, null, null, null);
    }

    public int metCount() {
        return (int) Stream.of(specific, measurable, achievable, relevant, timeBound)
                .filter(Boolean.TRUE::equals)
                .count();
    }

    @JsonIgnore
    public boolean isAssessed() {
        return Stream.of(specific, measurable, achievable, relevant, timeBound).anyMatch(v -> v != null);
    }
}
