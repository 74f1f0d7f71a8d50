package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Requirements handed to the strategic planner for a complex request.
 */
public record PlanningContext(
    @JsonProperty("demand_state") DemandState demandState,
    @JsonProperty("smart_analysis") SmartCriteria criteria,
    @JsonProperty("intent_categories") List<String> categories,
    @JsonProperty("complexity_assessment") ComplexityAssessment complexity,
    @JsonProperty("intent_reasoning") String intentReasoning,
    @JsonProperty("entities_keywords") EntitiesKeywords entities,
    @JsonProperty("analysis_focus") List<String> analysisFocus,
    @JsonProperty("framework_hints") List<String> frameworkHints,
    @JsonProperty("clarification_history") List<ClarificationExchange> clarificationHistory,
    String domain
) implements Serializable {}
