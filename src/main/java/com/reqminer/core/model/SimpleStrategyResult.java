package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Proposal produced by the simple planning path, presented for confirmation.
 */
public record SimpleStrategyResult(
    @JsonProperty("question_type") QuestionType questionType,
    @JsonProperty("execution_strategy") ExecutionStrategy executionStrategy,
    @JsonProperty("intent_categories") List<String> categories,
    @JsonProperty("complexity_assessment") ComplexityAssessment complexity,
    @JsonProperty("original_intent_input") String sourceInput
) implements Serializable {}
