package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Keywords and coarse entities extracted from a request.
 */
public record EntitiesKeywords(
    List<String> keywords,
    List<String> numbers,
    List<String> capitalized,
    @JsonProperty("technical_terms") List<String> technicalTerms,
    @JsonProperty("action_words") List<String> actionWords,
    @JsonProperty("word_count") int wordCount,
    @JsonProperty("unique_words") int uniqueWords,
    @JsonProperty("complexity_score") double complexityScore
) implements Serializable {}
