package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Result of the intent analysis node.
 */
public record IntentAnalysis(
    @JsonProperty("intent_categories") List<String> categories,
    @JsonProperty("complexity_assessment") ComplexityAssessment complexity,
    @JsonProperty("intent_parsing_reasoning") String reasoning,
    @JsonProperty("intent_parsing_output") String parserOutput,
    @JsonProperty("categories_from_fallback") boolean categoriesFromFallback
) implements Serializable {}
