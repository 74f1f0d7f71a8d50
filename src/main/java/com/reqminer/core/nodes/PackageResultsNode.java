package com.reqminer.core.nodes;

import com.reqminer.core.model.DemandState;
import com.reqminer.core.model.MetaArchitectResult;
import com.reqminer.core.model.PackagedSummary;
import com.reqminer.core.model.PlanningPath;
import com.reqminer.core.model.SimpleStrategyResult;
import com.reqminer.core.model.TranscriptMessage;
import com.reqminer.core.state.MiningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Assembles the hand-off summary of a confirmed plan.
 */
@Component
public class PackageResultsNode {

    private static final Logger log = LoggerFactory.getLogger(PackageResultsNode.class);

    public Map<String, Object> apply(MiningState state) {
        PlanningPath flow = state.planningPath().orElse(PlanningPath.SIMPLE_STRATEGY);
        DemandState demandState = state.demandState().orElse(DemandState.SMART_LARGE_SCOPE);

        var highlights = new ArrayList<String>();
        state.intentAnalysis().ifPresent(intent -> {
            highlights.add("Categories: " + String.join(", ", intent.categories()));
            highlights.add("Complexity: " + intent.complexity().level());
        });
        if (flow == PlanningPath.META_ARCHITECT) {
            state.metaArchitectResult().ifPresent(r -> highlights.addAll(metaHighlights(r)));
        } else {
            state.simpleStrategyResult().ifPresent(r -> highlights.addAll(simpleHighlights(r)));
        }
        if (state.forcedProgression()) {
            highlights.add("Clarification limit reached; proceeding with partial requirements");
        }

        String headline = flow == PlanningPath.META_ARCHITECT
                ? "Complex request packaged with strategic blueprint"
                : "Request packaged with simple execution strategy";
        var summary = new PackagedSummary(flow, state.originalInput(), demandState,
                headline, List.copyOf(highlights), true);
        log.info("Packaged {} results with {} highlight(s)", flow, highlights.size());

        return Map.of(
                MiningState.PACKAGED_SUMMARY, summary,
                MiningState.MESSAGES, state.messagesWith(TranscriptMessage.assistant(
                        headline + ". Ready for workflow planning."))
        );
    }

    private static List<String> simpleHighlights(SimpleStrategyResult result) {
        var strategy = result.executionStrategy();
        return List.of(
                "Question type: " + result.questionType().primaryType(),
                "Execution mode: " + strategy.mode(),
                "Estimated steps: " + strategy.estimatedSteps());
    }

    private static List<String> metaHighlights(MetaArchitectResult result) {
        var lines = new ArrayList<String>();
        if (result.blueprint() != null && result.blueprint().approach() != null) {
            lines.add("Approach: " + result.blueprint().approach());
        }
        if (result.hasRoadmap()) {
            lines.add("Roadmap steps: " + result.roadmap().steps().size());
        }
        return lines;
    }
}
