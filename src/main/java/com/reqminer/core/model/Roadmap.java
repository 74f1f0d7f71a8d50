package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Step-by-step execution plan derived from a confirmed blueprint.
 */
public record Roadmap(
    List<Step> steps,
    @JsonProperty("estimated_duration") String estimatedDuration
) implements Serializable {

    public Roadmap {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public record Step(
        int order,
        String title,
        String description,
        @JsonProperty("depends_on") List<Integer> dependsOn
    ) implements Serializable {}
}
