package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Heuristic complexity score of a request.
 *
 * @param level           low, medium or high
 * @param score           accumulated score in [0, 1]
 * @param factors         raw counts that fed the score
 * @param estimatedEffort low, medium or high
 * @param recommendations execution advice for the level
 */
public record ComplexityAssessment(
    @JsonProperty("complexity_level") String level,
    @JsonProperty("complexity_score") double score,
    Map<String, Integer> factors,
    @JsonProperty("estimated_effort") String estimatedEffort,
    List<String> recommendations
) implements Serializable {

    @JsonIgnore
    public boolean isMediumOrHigh() {
        return "medium".equals(level) || "high".equals(level);
    }
}
