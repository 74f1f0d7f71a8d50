package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Strategic planner's solution design for a complex request.
 */
public record Blueprint(
    @JsonProperty("problem_analysis") String problemAnalysis,
    String approach,
    @JsonProperty("recommended_frameworks") List<String> recommendedFrameworks,
    @JsonProperty("key_questions") List<String> keyQuestions,
    List<String> risks
) implements Serializable {}
