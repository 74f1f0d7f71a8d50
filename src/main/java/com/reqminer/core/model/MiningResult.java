package com.reqminer.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of one engine invocation, whether paused, completed or failed.
 */
public record MiningResult(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("task_id") String taskId,
    ServiceStatus status,
    @JsonProperty("original_input") String originalInput,
    @JsonProperty("user_input") String userInput,
    @JsonProperty("final_requirements") List<String> finalRequirements,
    @JsonProperty("demand_state") DemandState demandState,
    @JsonProperty("demand_state_source") DemandStateSource demandStateSource,
    @JsonProperty("smart_analysis") DemandAnalysis smartAnalysis,
    @JsonProperty("clarification_history") List<ClarificationExchange> clarificationHistory,
    @JsonProperty("clarification_questions") List<String> clarificationQuestions,
    @JsonProperty("feedback_type") FeedbackType feedbackType,
    @JsonProperty("forced_progression") boolean forcedProgression,
    @JsonProperty("intent_analysis") IntentAnalysis intentAnalysis,
    @JsonProperty("simple_strategy_result") SimpleStrategyResult simpleStrategyResult,
    @JsonProperty("meta_architect_result") MetaArchitectResult metaArchitectResult,
    @JsonProperty("packaged_summary") PackagedSummary packagedSummary,
    List<TranscriptMessage> messages,
    String error,
    @JsonProperty("failed_node") String failedNode,
    @JsonProperty("processing_time_ms") long processingTimeMs
) implements Serializable {

    @JsonIgnore
    public boolean isWaitingForFeedback() {
        return status == ServiceStatus.WAITING_FOR_USER_FEEDBACK;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == ServiceStatus.COMPLETED;
    }

    public int clarificationRounds() {
        return (int) clarificationHistory.stream().mapToInt(ClarificationExchange::round).distinct().count();
    }
}
