package com.reqminer.core.nodes;

import com.reqminer.core.planner.StrategicPlannerAdapter;
import com.reqminer.core.model.ServiceStatus;
import com.reqminer.core.model.TranscriptMessage;
import com.reqminer.core.state.MiningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Turns a confirmed blueprint into an execution roadmap.
 */
@Component
public class GenerateRoadmapNode {

    private static final Logger log = LoggerFactory.getLogger(GenerateRoadmapNode.class);

    private final StrategicPlannerAdapter plannerAdapter;

    public GenerateRoadmapNode(StrategicPlannerAdapter plannerAdapter) {
        this.plannerAdapter = plannerAdapter;
    }

    public Map<String, Object> apply(MiningState state) {
        var result = state.metaArchitectResult()
                .orElseThrow(() -> new IllegalStateException("No blueprint to build a roadmap from"));

        if (result.hasRoadmap()) {
            log.info("Roadmap already generated, skipping planner");
            return Map.of(MiningState.STATUS, ServiceStatus.PROCESSING.name(), MiningState.FEEDBACK_TYPE, "");
        }

        var withRoadmap = plannerAdapter.attachRoadmap(result, state.context());
        return Map.of(
                MiningState.META_ARCHITECT_RESULT, withRoadmap,
                MiningState.STATUS, ServiceStatus.PROCESSING.name(),
                MiningState.FEEDBACK_TYPE, "",
                MiningState.MESSAGES, state.messagesWith(TranscriptMessage.assistant(
                        "Blueprint confirmed. Execution roadmap generated."))
        );
    }
}
