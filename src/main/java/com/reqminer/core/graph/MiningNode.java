package com.reqminer.core.graph;

import java.util.Arrays;
import java.util.Optional;

/**
 * Identifiers of the nodes of the mining graph.
 */
public enum MiningNode {
    ANALYZE_DEMAND("analyze_demand"),
    CLARIFY_REQUIREMENTS("clarify_requirements"),
    INTENT_ANALYSIS("intent_analysis"),
    SIMPLE_STRATEGY_FLOW("simple_strategy_flow"),
    META_ARCHITECT_FLOW("meta_architect_flow"),
    GENERATE_ROADMAP("generate_roadmap"),
    WAIT_FOR_USER_FEEDBACK("wait_for_user_feedback"),
    PROCESS_CLARIFICATION("process_clarification"),
    PROCESS_ADJUSTMENT("process_adjustment"),
    PACKAGE_RESULTS("package_results"),
    FINALIZE_RESULT("finalize_result"),
    ERROR("error");

    private final String id;

    MiningNode(String id) {
        this.id = id;
    }

    /** Node name as registered in the graph. */
    public String id() {
        return id;
    }

    public static Optional<MiningNode> fromId(String id) {
        return Arrays.stream(values()).filter(n -> n.id.equals(id)).findFirst();
    }
}
