package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Output of the complex planning path. The roadmap stays null until the blueprint is confirmed.
 *
 * @param blueprint       planner's solution design
 * @param roadmap         execution roadmap, generated after confirmation
 * @param entities        entities and keywords extracted from the request
 * @param planningContext requirements that were handed to the planner
 * @param sourceInput     the input the blueprint was produced for
 */
public record MetaArchitectResult(
    @JsonProperty("architect_output") Blueprint blueprint,
    @JsonProperty("execution_roadmap") Roadmap roadmap,
    @JsonProperty("entities_keywords") EntitiesKeywords entities,
    @JsonProperty("planning_context") PlanningContext planningContext,
    @JsonProperty("source_input") String sourceInput
) implements Serializable {

    public MetaArchitectResult withRoadmap(Roadmap newRoadmap) {
        return new MetaArchitectResult(blueprint, newRoadmap, entities, planningContext, sourceInput);
    }

    public boolean hasRoadmap() {
        return roadmap != null;
    }
}
