package com.reqminer.core.persistence;

import com.reqminer.core.model.*;
import com.reqminer.core.state.MiningState;

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Durable copy of a paused {@link MiningState}.
 * <p>
 * Taken by the pause node and restored at resume entry. Unlike the graph state,
 * every field is typed so the snapshot survives a round trip through JSON.
 */
public record MiningSnapshot(
    String sessionId,
    Instant savedAt,
    MiningContext context,
    String originalInput,
    String userInput,
    ServiceStatus status,
    DemandState demandState,
    DemandStateSource demandStateSource,
    DemandAnalysis demandAnalysis,
    List<String> clarificationQuestions,
    List<ClarificationExchange> clarificationHistory,
    List<TranscriptMessage> messages,
    FeedbackType feedbackType,
    FeedbackPayload userFeedback,
    List<String> userResponses,
    List<String> adjustments,
    boolean forcedProgression,
    IntentAnalysis intentAnalysis,
    PlanningPath planningPath,
    SimpleStrategyResult simpleStrategyResult,
    MetaArchitectResult metaArchitectResult,
    PackagedSummary packagedSummary
) implements Serializable {

    public MiningSnapshot {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        if (sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(status, "status must not be null");
        savedAt = savedAt == null ? Instant.now() : savedAt;
        originalInput = originalInput == null ? "" : originalInput;
        userInput = userInput == null ? "" : userInput;
        clarificationQuestions = clarificationQuestions == null ? List.of() : List.copyOf(clarificationQuestions);
        clarificationHistory = clarificationHistory == null ? List.of() : List.copyOf(clarificationHistory);
        messages = messages == null ? List.of() : List.copyOf(messages);
        userResponses = userResponses == null ? List.of() : List.copyOf(userResponses);
        adjustments = adjustments == null ? List.of() : List.copyOf(adjustments);
    }

    /**
     * Captures the given graph state.
     */
    public static MiningSnapshot from(MiningState state) {
        return new MiningSnapshot(
                state.sessionId(),
                Instant.now(),
                state.context(),
                state.originalInput(),
                state.userInput(),
                state.status(),
                state.demandState().orElse(null),
                state.demandStateSource().orElse(null),
                state.demandAnalysis().orElse(null),
                state.clarificationQuestions(),
                state.clarificationHistory(),
                state.messages(),
                state.feedbackType().orElse(null),
                state.userFeedback().orElse(null),
                state.userResponses(),
                state.adjustments(),
                state.forcedProgression(),
                state.intentAnalysis().orElse(null),
                state.planningPath().orElse(null),
                state.simpleStrategyResult().orElse(null),
                state.metaArchitectResult().orElse(null),
                state.packagedSummary().orElse(null));
    }

    /**
     * Rebuilds the graph input map. Absent optional fields are left out so the
     * schema defaults apply.
     */
    public Map<String, Object> toStateData() {
        var data = new HashMap<String, Object>();
        data.put(MiningState.CONTEXT, context);
        data.put(MiningState.ORIGINAL_INPUT, originalInput);
        data.put(MiningState.USER_INPUT, userInput);
        data.put(MiningState.STATUS, status.name());
        data.put(MiningState.CLARIFICATION_QUESTIONS, clarificationQuestions);
        data.put(MiningState.CLARIFICATION_HISTORY, clarificationHistory);
        data.put(MiningState.MESSAGES, messages);
        data.put(MiningState.USER_RESPONSES, userResponses);
        data.put(MiningState.ADJUSTMENTS, adjustments);
        data.put(MiningState.FORCED_PROGRESSION, forcedProgression);
        putName(data, MiningState.DEMAND_STATE, demandState);
        putName(data, MiningState.DEMAND_STATE_SOURCE, demandStateSource);
        putName(data, MiningState.FEEDBACK_TYPE, feedbackType);
        putName(data, MiningState.PLANNING_PATH, planningPath);
        putIfPresent(data, MiningState.DEMAND_ANALYSIS, demandAnalysis);
        putIfPresent(data, MiningState.USER_FEEDBACK, userFeedback);
        putIfPresent(data, MiningState.INTENT_ANALYSIS, intentAnalysis);
        putIfPresent(data, MiningState.SIMPLE_STRATEGY_RESULT, simpleStrategyResult);
        putIfPresent(data, MiningState.META_ARCHITECT_RESULT, metaArchitectResult);
        putIfPresent(data, MiningState.PACKAGED_SUMMARY, packagedSummary);
        return data;
    }

    private static void putName(Map<String, Object> data, String key, Enum<?> value) {
        if (value != null) {
            data.put(key, value.name());
        }
    }

    private static void putIfPresent(Map<String, Object> data, String key, Object value) {
        if (value != null) {
            data.put(key, value);
        }
    }
}
