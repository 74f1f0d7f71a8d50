package com.reqminer.core.graph;

import com.reqminer.core.classify.DemandClassifier;
import com.reqminer.core.config.MiningProperties;
import com.reqminer.core.intent.IntentParser;
import com.reqminer.core.model.*;
import com.reqminer.core.persistence.SaverCheckpointStore;
import com.reqminer.core.planner.StrategicPlanner;
import com.reqminer.core.state.MiningState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MiningGraphTest {

    private DemandClassifier classifier;
    private IntentParser parser;
    private StrategicPlanner planner;
    private MiningGraph graph;

    @BeforeEach
    void setUp() throws Exception {
        classifier = mock(DemandClassifier.class);
        parser = mock(IntentParser.class);
        planner = mock(StrategicPlanner.class);
        graph = MiningGraphFixture.build(classifier, parser, planner, new SaverCheckpointStore(), new MiningProperties());
    }

    private static MiningState state(Object... keyValues) {
        Map<String, Object> data = new HashMap<>();
        data.put(MiningState.CONTEXT, new MiningContext("s-1", "t-1", null, null, Instant.now(), 0));
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new MiningState(data);
    }

    private static IntentAnalysis intent(String level, String... categories) {
        var complexity = new ComplexityAssessment(level, 0.5, Map.of(), level, List.of());
        return new IntentAnalysis(List.of(categories), complexity, "", "", false);
    }

    // ===================================================================
    //  Routing
    // ===================================================================

    @Nested
    @DisplayName("routing")
    class Routing {

        @Test
        @DisplayName("only SMART_COMPLIANT skips clarification")
        void afterAnalysis() {
            assertEquals("intent_analysis",
                    graph.routeAfterAnalysis(state(MiningState.DEMAND_STATE, "SMART_COMPLIANT")));
            assertEquals("clarify_requirements",
                    graph.routeAfterAnalysis(state(MiningState.DEMAND_STATE, "SMART_LARGE_SCOPE")));
            assertEquals("clarify_requirements",
                    graph.routeAfterAnalysis(state(MiningState.DEMAND_STATE, "VAGUE_UNCLEAR")));
        }

        @Test
        @DisplayName("forced progression without pending feedback proceeds to intent analysis")
        void afterClarify() {
            assertEquals("intent_analysis", graph.routeAfterClarify(state(MiningState.FORCED_PROGRESSION, true)));
            assertEquals("wait_for_user_feedback", graph.routeAfterClarify(state(
                    MiningState.FEEDBACK_TYPE, FeedbackType.CLARIFICATION.name())));
            assertEquals("wait_for_user_feedback", graph.routeAfterClarify(state(
                    MiningState.FORCED_PROGRESSION, true,
                    MiningState.FEEDBACK_TYPE, FeedbackType.CLARIFICATION.name())));
        }

        @Test
        @DisplayName("two planning categories at medium or high complexity take the blueprint path")
        void afterIntent() {
            assertEquals("meta_architect_flow", graph.routeAfterIntent(state(
                    MiningState.INTENT_ANALYSIS, intent("medium", "collect", "analyze"))));
            assertEquals("simple_strategy_flow", graph.routeAfterIntent(state(
                    MiningState.INTENT_ANALYSIS, intent("low", "collect", "analyze"))));
            assertEquals("simple_strategy_flow", graph.routeAfterIntent(state(
                    MiningState.INTENT_ANALYSIS, intent("high", "answer", "analyze"))));
            assertEquals("simple_strategy_flow", graph.routeAfterIntent(state()));
        }

        @Test
        @DisplayName("adjustments return to the path that was rejected")
        void afterAdjustment() {
            assertEquals("meta_architect_flow", graph.routeAfterAdjustment(state(
                    MiningState.PLANNING_PATH, PlanningPath.META_ARCHITECT.name())));
            assertEquals("intent_analysis", graph.routeAfterAdjustment(state(
                    MiningState.PLANNING_PATH, PlanningPath.SIMPLE_STRATEGY.name())));
        }

        @Test
        @DisplayName("a recorded error always routes to the error node")
        void errorWins() {
            var failed = state(MiningState.ERROR, "boom",
                    MiningState.DEMAND_STATE, "SMART_COMPLIANT",
                    MiningState.PLANNING_PATH, PlanningPath.META_ARCHITECT.name());

            assertEquals("error", graph.routeAfterAnalysis(failed));
            assertEquals("error", graph.routeAfterClarify(failed));
            assertEquals("error", graph.routeAfterIntent(failed));
            assertEquals("error", graph.routeAfterAdjustment(failed));
        }

        @Test
        @DisplayName("entry defers to the feedback dispatcher")
        void entry() {
            assertEquals("analyze_demand", graph.routeEntry(state()));
            assertEquals("process_clarification", graph.routeEntry(state(
                    MiningState.STATUS, ServiceStatus.PROCESSING_FEEDBACK.name(),
                    MiningState.USER_FEEDBACK, FeedbackPayload.clarification(List.of("Europe")))));
        }
    }

    // ===================================================================
    //  Node guard
    // ===================================================================

    @Nested
    @DisplayName("node guard")
    class Guard {

        @Test
        @DisplayName("records the failing node instead of throwing")
        void recordsFailure() throws Exception {
            var action = MiningGraph.guarded(MiningNode.INTENT_ANALYSIS, s -> {
                throw new IllegalStateException("parser exploded");
            });

            var updates = action.apply(state());

            assertEquals("parser exploded", updates.get(MiningState.ERROR));
            assertEquals("intent_analysis", updates.get(MiningState.FAILED_NODE));
            assertEquals("ERROR", updates.get(MiningState.STATUS));
        }

        @Test
        @DisplayName("falls back to the exception class name for a message-less failure")
        void messageLessFailure() throws Exception {
            var action = MiningGraph.guarded(MiningNode.PACKAGE_RESULTS, s -> {
                throw new NullPointerException();
            });

            assertEquals("NullPointerException", action.apply(state()).get(MiningState.ERROR));
        }

        @Test
        @DisplayName("passes successful updates through")
        void passesThrough() throws Exception {
            var action = MiningGraph.guarded(MiningNode.FINALIZE_RESULT,
                    s -> Map.of(MiningState.STATUS, "COMPLETED"));

            assertEquals(Map.of(MiningState.STATUS, "COMPLETED"), action.apply(state()));
        }
    }

    // ===================================================================
    //  Traversal
    // ===================================================================

    @Test
    @DisplayName("a planner failure ends the run at the error node")
    void plannerFailureEndsAtErrorNode() {
        when(classifier.classify(anyString(), any())).thenReturn(new DemandAnalysis(DemandState.SMART_COMPLIANT,
                new SmartCriteria(true, true, true, true, true), 0.9, "", List.of(), null));
        when(parser.parse(anyString(), any()))
                .thenReturn(new IntentParseResult(List.of("collect", "analyze", "generate"), "", ""));
        when(planner.plan(anyString(), any(), any())).thenThrow(new RuntimeException("planner offline"));

        String input = "Collect competitor pricing data and analyze market trends then generate a strategy report";
        var result = graph.getCompiledGraph().invoke(Map.of(
                MiningState.CONTEXT, MiningContext.of("s-9"),
                MiningState.ORIGINAL_INPUT, input,
                MiningState.USER_INPUT, input)).orElseThrow();

        assertEquals(ServiceStatus.ERROR, result.status());
        assertEquals("meta_architect_flow", result.failedNode());
        assertTrue(result.error().contains("planner offline"));
        var messages = result.messages();
        assertTrue(messages.get(messages.size() - 1).content().startsWith("Mining failed at meta_architect_flow"));
    }
}
