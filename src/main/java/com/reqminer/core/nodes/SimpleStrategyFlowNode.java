package com.reqminer.core.nodes;

import com.reqminer.core.intent.RequestHeuristics;
import com.reqminer.core.model.FeedbackType;
import com.reqminer.core.model.PlanningPath;
import com.reqminer.core.model.SimpleStrategyResult;
import com.reqminer.core.model.TranscriptMessage;
import com.reqminer.core.state.MiningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Proposes a lightweight execution strategy and asks for confirmation.
 */
@Component
public class SimpleStrategyFlowNode {

    private static final Logger log = LoggerFactory.getLogger(SimpleStrategyFlowNode.class);

    public Map<String, Object> apply(MiningState state) {
        var intent = state.intentAnalysis()
                .orElseThrow(() -> new IllegalStateException("Intent analysis required before simple strategy"));

        var questionType = RequestHeuristics.classifyQuestionType(state.userInput());
        var strategy = RequestHeuristics.suggestExecutionStrategy(intent.categories(), intent.complexity());
        var result = new SimpleStrategyResult(questionType, strategy, intent.categories(),
                intent.complexity(), state.userInput());
        log.info("Simple strategy proposed: mode={}, agents={}", strategy.mode(), strategy.agentRequirements());

        String message = "Request analysis completed. Proposed " + strategy.mode()
                + " execution with " + String.join(", ", strategy.agentRequirements())
                + ". Confirm to proceed or send adjustments.";
        return Map.of(
                MiningState.SIMPLE_STRATEGY_RESULT, result,
                MiningState.PLANNING_PATH, PlanningPath.SIMPLE_STRATEGY.name(),
                MiningState.FEEDBACK_TYPE, FeedbackType.SIMPLE_STRATEGY_CONFIRMATION.name(),
                MiningState.MESSAGES, state.messagesWith(TranscriptMessage.assistant(message))
        );
    }
}
