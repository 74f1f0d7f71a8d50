package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Suggested way of executing a simple request.
 */
public record ExecutionStrategy(
    @JsonProperty("execution_mode") String mode,
    @JsonProperty("agent_requirements") List<String> agentRequirements,
    @JsonProperty("estimated_steps") int estimatedSteps,
    @JsonProperty("parallel_execution") boolean parallelExecution,
    @JsonProperty("workflow_needed") boolean workflowNeeded,
    List<String> notes
) implements Serializable {}
