package com.reqminer.core.graph;

import com.reqminer.core.dispatch.FeedbackDispatcher;
import com.reqminer.core.intent.IntentCategories;
import com.reqminer.core.logging.MdcContext;
import com.reqminer.core.model.DemandState;
import com.reqminer.core.model.PlanningPath;
import com.reqminer.core.model.ServiceStatus;
import com.reqminer.core.model.TranscriptMessage;
import com.reqminer.core.nodes.*;
import com.reqminer.core.state.MiningState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.NodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives a
 * requirement mining session.
 * <p>
 * Topology:
 * <pre>
 *   START -> [routeEntry]
 *      -> analyze_demand -> [routeAfterAnalysis]
 *         -> intent_analysis          (SMART_COMPLIANT)
 *         -> clarify_requirements -> [routeAfterClarify]
 *            -> intent_analysis       (round limit reached)
 *            -> wait_for_user_feedback -> END
 *      intent_analysis -> [routeAfterIntent]
 *         -> meta_architect_flow   -> wait_for_user_feedback -> END
 *         -> simple_strategy_flow  -> wait_for_user_feedback -> END
 *      -> process_clarification -> analyze_demand
 *      -> process_adjustment -> [routeAfterAdjustment]
 *         -> meta_architect_flow | intent_analysis
 *      -> generate_roadmap -> package_results -> finalize_result -> END
 *      -> package_results -> finalize_result -> END
 * </pre>
 * Every node may also route to {@code error -> END} once a failure is recorded.
 * <p>
 * The graph is compiled without a checkpoint saver: the pause node persists a
 * snapshot itself and a resume replays it from START.
 */
@Component
public class MiningGraph {

    private static final Logger log = LoggerFactory.getLogger(MiningGraph.class);

    private final CompiledGraph<MiningState> compiledGraph;
    private final FeedbackDispatcher dispatcher;

    public MiningGraph(
            FeedbackDispatcher dispatcher,
            AnalyzeDemandNode analyzeNode,
            ClarifyRequirementsNode clarifyNode,
            IntentAnalysisNode intentNode,
            SimpleStrategyFlowNode simpleNode,
            MetaArchitectFlowNode metaNode,
            GenerateRoadmapNode roadmapNode,
            WaitForUserFeedbackNode waitNode,
            ProcessClarificationNode clarificationNode,
            ProcessAdjustmentNode adjustmentNode,
            PackageResultsNode packageNode,
            FinalizeResultNode finalizeNode) throws Exception {
        this.dispatcher = dispatcher;

        var handlers = new EnumMap<MiningNode, Function<MiningState, Map<String, Object>>>(MiningNode.class);
        handlers.put(MiningNode.ANALYZE_DEMAND, analyzeNode::apply);
        handlers.put(MiningNode.CLARIFY_REQUIREMENTS, clarifyNode::apply);
        handlers.put(MiningNode.INTENT_ANALYSIS, intentNode::apply);
        handlers.put(MiningNode.SIMPLE_STRATEGY_FLOW, simpleNode::apply);
        handlers.put(MiningNode.META_ARCHITECT_FLOW, metaNode::apply);
        handlers.put(MiningNode.GENERATE_ROADMAP, roadmapNode::apply);
        handlers.put(MiningNode.WAIT_FOR_USER_FEEDBACK, waitNode::apply);
        handlers.put(MiningNode.PROCESS_CLARIFICATION, clarificationNode::apply);
        handlers.put(MiningNode.PROCESS_ADJUSTMENT, adjustmentNode::apply);
        handlers.put(MiningNode.PACKAGE_RESULTS, packageNode::apply);
        handlers.put(MiningNode.FINALIZE_RESULT, finalizeNode::apply);
        handlers.put(MiningNode.ERROR, MiningGraph::recordFailure);

        var graph = new StateGraph<>(MiningState.SCHEMA, MiningState::new);
        for (var entry : handlers.entrySet()) {
            graph.addNode(entry.getKey().id(), node_async(guarded(entry.getKey(), entry.getValue())));
        }

        graph.addConditionalEdges(START, edge_async(this::routeEntry), targets(
                        MiningNode.ANALYZE_DEMAND, MiningNode.PROCESS_CLARIFICATION,
                        MiningNode.PROCESS_ADJUSTMENT, MiningNode.GENERATE_ROADMAP,
                        MiningNode.PACKAGE_RESULTS))
                .addConditionalEdges(MiningNode.ANALYZE_DEMAND.id(), edge_async(this::routeAfterAnalysis), targets(
                        MiningNode.INTENT_ANALYSIS, MiningNode.CLARIFY_REQUIREMENTS, MiningNode.ERROR))
                .addConditionalEdges(MiningNode.CLARIFY_REQUIREMENTS.id(), edge_async(this::routeAfterClarify), targets(
                        MiningNode.INTENT_ANALYSIS, MiningNode.WAIT_FOR_USER_FEEDBACK, MiningNode.ERROR))
                .addConditionalEdges(MiningNode.INTENT_ANALYSIS.id(), edge_async(this::routeAfterIntent), targets(
                        MiningNode.META_ARCHITECT_FLOW, MiningNode.SIMPLE_STRATEGY_FLOW, MiningNode.ERROR))
                .addConditionalEdges(MiningNode.SIMPLE_STRATEGY_FLOW.id(),
                        edge_async(state -> orError(state, MiningNode.WAIT_FOR_USER_FEEDBACK)), targets(
                        MiningNode.WAIT_FOR_USER_FEEDBACK, MiningNode.ERROR))
                .addConditionalEdges(MiningNode.META_ARCHITECT_FLOW.id(),
                        edge_async(state -> orError(state, MiningNode.WAIT_FOR_USER_FEEDBACK)), targets(
                        MiningNode.WAIT_FOR_USER_FEEDBACK, MiningNode.ERROR))
                .addConditionalEdges(MiningNode.PROCESS_CLARIFICATION.id(),
                        edge_async(state -> orError(state, MiningNode.ANALYZE_DEMAND)), targets(
                        MiningNode.ANALYZE_DEMAND, MiningNode.ERROR))
                .addConditionalEdges(MiningNode.PROCESS_ADJUSTMENT.id(), edge_async(this::routeAfterAdjustment), targets(
                        MiningNode.META_ARCHITECT_FLOW, MiningNode.INTENT_ANALYSIS, MiningNode.ERROR))
                .addConditionalEdges(MiningNode.GENERATE_ROADMAP.id(),
                        edge_async(state -> orError(state, MiningNode.PACKAGE_RESULTS)), targets(
                        MiningNode.PACKAGE_RESULTS, MiningNode.ERROR))
                .addConditionalEdges(MiningNode.PACKAGE_RESULTS.id(),
                        edge_async(state -> orError(state, MiningNode.FINALIZE_RESULT)), targets(
                        MiningNode.FINALIZE_RESULT, MiningNode.ERROR))
                .addConditionalEdges(MiningNode.FINALIZE_RESULT.id(),
                        edge_async(state -> state.hasError() ? MiningNode.ERROR.id() : END),
                        Map.of(END, END, MiningNode.ERROR.id(), MiningNode.ERROR.id()))
                .addConditionalEdges(MiningNode.WAIT_FOR_USER_FEEDBACK.id(),
                        edge_async(state -> state.hasError() ? MiningNode.ERROR.id() : END),
                        Map.of(END, END, MiningNode.ERROR.id(), MiningNode.ERROR.id()))
                .addEdge(MiningNode.ERROR.id(), END);

        this.compiledGraph = graph.compile(CompileConfig.builder().recursionLimit(100).build());
        log.info("Mining graph compiled with {} nodes", handlers.size());
    }

    public CompiledGraph<MiningState> getCompiledGraph() {
        return compiledGraph;
    }

    // =================================================================
    //  Routing
    // =================================================================

    String routeEntry(MiningState state) {
        return dispatcher.route(state).id();
    }

    String routeAfterAnalysis(MiningState state) {
        if (state.hasError()) {
            return MiningNode.ERROR.id();
        }
        return state.demandState().filter(s -> s == DemandState.SMART_COMPLIANT).isPresent()
                ? MiningNode.INTENT_ANALYSIS.id()
                : MiningNode.CLARIFY_REQUIREMENTS.id();
    }

    String routeAfterClarify(MiningState state) {
        if (state.hasError()) {
            return MiningNode.ERROR.id();
        }
        return state.forcedProgression() && state.feedbackType().isEmpty()
                ? MiningNode.INTENT_ANALYSIS.id()
                : MiningNode.WAIT_FOR_USER_FEEDBACK.id();
    }

    /**
     * Complex requests span at least two planning categories at medium or high complexity.
     */
    String routeAfterIntent(MiningState state) {
        if (state.hasError()) {
            return MiningNode.ERROR.id();
        }
        var intent = state.intentAnalysis().orElse(null);
        if (intent == null) {
            return MiningNode.SIMPLE_STRATEGY_FLOW.id();
        }
        boolean complex = IntentCategories.planningCategoryCount(intent.categories()) >= 2
                && intent.complexity().isMediumOrHigh();
        return complex ? MiningNode.META_ARCHITECT_FLOW.id() : MiningNode.SIMPLE_STRATEGY_FLOW.id();
    }

    String routeAfterAdjustment(MiningState state) {
        if (state.hasError()) {
            return MiningNode.ERROR.id();
        }
        return state.planningPath().filter(p -> p == PlanningPath.META_ARCHITECT).isPresent()
                ? MiningNode.META_ARCHITECT_FLOW.id()
                : MiningNode.INTENT_ANALYSIS.id();
    }

    private static String orError(MiningState state, MiningNode next) {
        return state.hasError() ? MiningNode.ERROR.id() : next.id();
    }

    private static Map<String, String> targets(MiningNode... nodes) {
        var map = new HashMap<String, String>();
        for (MiningNode node : nodes) {
            map.put(node.id(), node.id());
        }
        return map;
    }

    // =================================================================
    //  Node guard
    // =================================================================

    /**
     * Wraps a handler so that a failure is recorded in state instead of escaping the graph.
     */
    static NodeAction<MiningState> guarded(MiningNode node, Function<MiningState, Map<String, Object>> handler) {
        return state -> {
            MdcContext.setNode(node.id());
            try {
                return handler.apply(state);
            } catch (RuntimeException e) {
                log.error("Node {} failed: {}", node.id(), e.getMessage(), e);
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                return Map.of(
                        MiningState.ERROR, message,
                        MiningState.FAILED_NODE, node.id(),
                        MiningState.STATUS, ServiceStatus.ERROR.name());
            } finally {
                MdcContext.clearNode();
            }
        };
    }

    private static Map<String, Object> recordFailure(MiningState state) {
        String node = state.failedNode().isEmpty() ? "unknown" : state.failedNode();
        return Map.of(
                MiningState.STATUS, ServiceStatus.ERROR.name(),
                MiningState.MESSAGES, state.messagesWith(TranscriptMessage.assistant(
                        "Mining failed at " + node + ": " + state.error())));
    }
}
