package com.reqminer.core.state;

import com.reqminer.core.model.*;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for a requirement mining session.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors for every field
 * of the session record. Enum-valued fields are stored by name, and an empty
 * string stands for "unset" so that nodes can clear them with a plain update.
 * List fields use base channels: a node that adds to a list returns the whole
 * new list, which keeps whole-state replay free of duplicated entries.
 */
public class MiningState extends AgentState {

    public static final String ORIGINAL_INPUT = "originalInput";
    public static final String USER_INPUT = "userInput";
    public static final String CONTEXT = "context";
    public static final String STATUS = "status";
    public static final String DEMAND_STATE = "demandState";
    public static final String DEMAND_STATE_SOURCE = "demandStateSource";
    public static final String DEMAND_ANALYSIS = "demandAnalysis";
    public static final String CLARIFICATION_QUESTIONS = "clarificationQuestions";
    public static final String CLARIFICATION_HISTORY = "clarificationHistory";
    public static final String MESSAGES = "messages";
    public static final String FEEDBACK_TYPE = "feedbackType";
    public static final String USER_FEEDBACK = "userFeedback";
    public static final String USER_RESPONSES = "userResponses";
    public static final String ADJUSTMENTS = "adjustments";
    public static final String FORCED_PROGRESSION = "forcedProgression";
    public static final String INTENT_ANALYSIS = "intentAnalysis";
    public static final String PLANNING_PATH = "planningPath";
    public static final String SIMPLE_STRATEGY_RESULT = "simpleStrategyResult";
    public static final String META_ARCHITECT_RESULT = "metaArchitectResult";
    public static final String PACKAGED_SUMMARY = "packagedSummary";
    public static final String ERROR = "error";
    public static final String FAILED_NODE = "failedNode";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Scalar channels ──────────────────────────────────────────
        Map.entry(ORIGINAL_INPUT,         Channels.base(() -> "")),
        Map.entry(USER_INPUT,             Channels.base(() -> "")),
        Map.entry(CONTEXT,                Channels.base((Reducer<MiningContext>) null)),
        Map.entry(STATUS,                 Channels.base(() -> ServiceStatus.PROCESSING.name())),
        Map.entry(DEMAND_STATE,           Channels.base(() -> "")),
        Map.entry(DEMAND_STATE_SOURCE,    Channels.base(() -> "")),
        Map.entry(DEMAND_ANALYSIS,        Channels.base((Reducer<DemandAnalysis>) null)),
        Map.entry(FEEDBACK_TYPE,          Channels.base(() -> "")),
        Map.entry(USER_FEEDBACK,          Channels.base((Reducer<FeedbackPayload>) null)),
        Map.entry(FORCED_PROGRESSION,     Channels.base(() -> false)),
        Map.entry(ERROR,                  Channels.base(() -> "")),
        Map.entry(FAILED_NODE,            Channels.base(() -> "")),

        // ── Result fragments ─────────────────────────────────────────
        Map.entry(INTENT_ANALYSIS,        Channels.base((Reducer<IntentAnalysis>) null)),
        Map.entry(PLANNING_PATH,          Channels.base(() -> "")),
        Map.entry(SIMPLE_STRATEGY_RESULT, Channels.base((Reducer<SimpleStrategyResult>) null)),
        Map.entry(META_ARCHITECT_RESULT,  Channels.base((Reducer<MetaArchitectResult>) null)),
        Map.entry(PACKAGED_SUMMARY,       Channels.base((Reducer<PackagedSummary>) null)),

        // ── List channels (whole-list replacement) ───────────────────
        Map.entry(CLARIFICATION_QUESTIONS, Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(CLARIFICATION_HISTORY,   Channels.base((Supplier<List<ClarificationExchange>>) List::of)),
        Map.entry(MESSAGES,                Channels.base((Supplier<List<TranscriptMessage>>) List::of)),
        Map.entry(USER_RESPONSES,          Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(ADJUSTMENTS,             Channels.base((Supplier<List<String>>) List::of))
    );

    public MiningState(Map<String, Object> initData) {
        super(initData);
    }

    // ── Scalar accessors ─────────────────────────────────────────────

    public String originalInput() {
        return this.<String>value(ORIGINAL_INPUT).orElse("");
    }

    public String userInput() {
        return this.<String>value(USER_INPUT).orElse("");
    }

    public MiningContext context() {
        return this.<MiningContext>value(CONTEXT)
                .orElseThrow(() -> new IllegalStateException("Mining context missing from state"));
    }

    public String sessionId() {
        return this.<MiningContext>value(CONTEXT).map(MiningContext::sessionId).orElse("");
    }

    public int currentRound() {
        return this.<MiningContext>value(CONTEXT).map(MiningContext::currentRound).orElse(0);
    }

    public ServiceStatus status() {
        String raw = this.<String>value(STATUS).orElse(ServiceStatus.PROCESSING.name());
        return ServiceStatus.valueOf(raw);
    }

    public Optional<DemandState> demandState() {
        return enumValue(DEMAND_STATE, DemandState.class);
    }

    public Optional<DemandStateSource> demandStateSource() {
        return enumValue(DEMAND_STATE_SOURCE, DemandStateSource.class);
    }

    public Optional<DemandAnalysis> demandAnalysis() {
        return value(DEMAND_ANALYSIS);
    }

    public Optional<FeedbackType> feedbackType() {
        return enumValue(FEEDBACK_TYPE, FeedbackType.class);
    }

    public Optional<FeedbackPayload> userFeedback() {
        return value(USER_FEEDBACK);
    }

    public boolean forcedProgression() {
        return this.<Boolean>value(FORCED_PROGRESSION).orElse(false);
    }

    public String error() {
        return this.<String>value(ERROR).orElse("");
    }

    public String failedNode() {
        return this.<String>value(FAILED_NODE).orElse("");
    }

    public boolean hasError() {
        return !error().isEmpty();
    }

    // ── Result fragment accessors ────────────────────────────────────

    public Optional<IntentAnalysis> intentAnalysis() {
        return value(INTENT_ANALYSIS);
    }

    public Optional<PlanningPath> planningPath() {
        return enumValue(PLANNING_PATH, PlanningPath.class);
    }

    public Optional<SimpleStrategyResult> simpleStrategyResult() {
        return value(SIMPLE_STRATEGY_RESULT);
    }

    public Optional<MetaArchitectResult> metaArchitectResult() {
        return value(META_ARCHITECT_RESULT);
    }

    public Optional<PackagedSummary> packagedSummary() {
        return value(PACKAGED_SUMMARY);
    }

    // ── List accessors ───────────────────────────────────────────────

    public List<String> clarificationQuestions() {
        return this.<List<String>>value(CLARIFICATION_QUESTIONS).orElse(List.of());
    }

    public List<ClarificationExchange> clarificationHistory() {
        return this.<List<ClarificationExchange>>value(CLARIFICATION_HISTORY).orElse(List.of());
    }

    public List<TranscriptMessage> messages() {
        return this.<List<TranscriptMessage>>value(MESSAGES).orElse(List.of());
    }

    public List<String> userResponses() {
        return this.<List<String>>value(USER_RESPONSES).orElse(List.of());
    }

    public List<String> adjustments() {
        return this.<List<String>>value(ADJUSTMENTS).orElse(List.of());
    }

    /**
     * Returns the transcript with the given messages appended, for use as a node update.
     */
    public List<TranscriptMessage> messagesWith(TranscriptMessage... added) {
        var merged = new ArrayList<>(messages());
        merged.addAll(Arrays.asList(added));
        return List.copyOf(merged);
    }

    private <E extends Enum<E>> Optional<E> enumValue(String key, Class<E> type) {
        return this.<String>value(key)
                .filter(raw -> !raw.isEmpty())
                .map(raw -> Enum.valueOf(type, raw));
    }
}
