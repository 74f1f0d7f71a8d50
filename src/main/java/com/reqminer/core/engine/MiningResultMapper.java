package com.reqminer.core.engine;

import com.reqminer.core.model.DemandState;
import com.reqminer.core.model.DemandStateSource;
import com.reqminer.core.model.MiningResult;
import com.reqminer.core.model.PlanningPath;
import com.reqminer.core.state.MiningState;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a graph state into the {@link MiningResult} handed back to callers.
 */
public final class MiningResultMapper {

    private MiningResultMapper() {}

    public static MiningResult toResult(MiningState state, long processingTimeMs) {
        var context = state.context();
        // A result never leaves without a demand state
        DemandState demandState = state.demandState().orElse(DemandState.SMART_LARGE_SCOPE);
        DemandStateSource source = state.demandStateSource()
                .orElse(state.demandState().isPresent() ? DemandStateSource.CLASSIFIER : DemandStateSource.DEFAULT);

        return new MiningResult(
                context.sessionId(),
                context.taskId(),
                state.status(),
                state.originalInput(),
                state.userInput(),
                finalRequirements(state),
                demandState,
                source,
                state.demandAnalysis().orElse(null),
                state.clarificationHistory(),
                state.clarificationQuestions(),
                state.feedbackType().orElse(null),
                state.forcedProgression(),
                state.intentAnalysis().orElse(null),
                state.simpleStrategyResult().orElse(null),
                state.metaArchitectResult().orElse(null),
                state.packagedSummary().orElse(null),
                state.messages(),
                state.hasError() ? state.error() : null,
                state.failedNode().isEmpty() ? null : state.failedNode(),
                processingTimeMs);
    }

    /**
     * Original input, then every user response and adjustment, then the analysis lines.
     */
    static List<String> finalRequirements(MiningState state) {
        var requirements = new ArrayList<String>();
        requirements.add(state.originalInput());
        state.userResponses().stream().filter(r -> r != null && !r.isBlank()).forEach(requirements::add);
        requirements.addAll(state.adjustments());

        state.intentAnalysis().ifPresent(intent -> {
            requirements.add("Intent categories: " + String.join(", ", intent.categories()));
            requirements.add("Complexity level: " + intent.complexity().level());
        });

        PlanningPath path = state.planningPath().orElse(null);
        if (path == PlanningPath.META_ARCHITECT) {
            state.metaArchitectResult()
                    .filter(r -> r.blueprint() != null && r.blueprint().problemAnalysis() != null)
                    .ifPresent(r -> requirements.add("Strategic analysis: " + r.blueprint().problemAnalysis()));
        } else if (path == PlanningPath.SIMPLE_STRATEGY) {
            state.simpleStrategyResult()
                    .ifPresent(r -> requirements.add("Execution mode: " + r.executionStrategy().mode()));
        }
        return List.copyOf(requirements);
    }
}
