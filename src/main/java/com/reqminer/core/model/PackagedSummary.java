package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Hand-off summary assembled once a plan is confirmed.
 */
public record PackagedSummary(
    @JsonProperty("flow_type") PlanningPath flowType,
    @JsonProperty("original_input") String originalInput,
    @JsonProperty("demand_state") DemandState demandState,
    String headline,
    List<String> highlights,
    @JsonProperty("ready_for_workflow_planning") boolean readyForWorkflowPlanning
) implements Serializable {}
