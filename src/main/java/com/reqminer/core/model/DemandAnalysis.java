package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Output of the demand classifier.
 *
 * @param demandState         classifier verdict; may be absent
 * @param criteria            SMART criteria verdicts
 * @param confidence          classifier confidence in [0, 1]
 * @param reasoning           free-text rationale
 * @param clarificationNeeded follow-up questions proposed by the classifier
 * @param scope               scope assessment used to separate compliant from large-scope requests
 */
public record DemandAnalysis(
    @JsonProperty("demand_state") DemandState demandState,
    @JsonProperty("smart_analysis") SmartCriteria criteria,
    double confidence,
    String reasoning,
    @JsonProperty("clarification_needed") List<String> clarificationNeeded,
    @JsonProperty("scope_assessment") ScopeAssessment scope
) implements Serializable {

    public DemandAnalysis {
        criteria = criteria == null ? SmartCriteria.none() : criteria;
        reasoning = reasoning == null ? "" : reasoning;
        clarificationNeeded = clarificationNeeded == null ? List.of() : List.copyOf(clarificationNeeded);
    }

    /**
     * Placeholder recorded when the classifier could not be reached.
     */
    public static DemandAnalysis unavailable(String reason) {
        return new DemandAnalysis(null, SmartCriteria.none(), 0.0,
                "Classifier unavailable: " + reason, List.of(), null);
    }

    public DemandAnalysis withDemandState(DemandState state) {
        return new DemandAnalysis(state, criteria, confidence, reasoning, clarificationNeeded, scope);
    }
}
