package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Map;

/**
 * Lexical classification of what kind of question a request asks.
 */
public record QuestionType(
    @JsonProperty("primary_type") String primaryType,
    double confidence,
    @JsonProperty("all_scores") Map<String, Double> scores,
    @JsonProperty("is_question") boolean isQuestion
) implements Serializable {}
