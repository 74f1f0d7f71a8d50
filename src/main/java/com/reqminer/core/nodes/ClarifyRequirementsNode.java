package com.reqminer.core.nodes;

import com.reqminer.core.clarify.RoundLimiter;
import com.reqminer.core.model.DemandState;
import com.reqminer.core.model.DemandStateSource;
import com.reqminer.core.model.FeedbackType;
import com.reqminer.core.model.TranscriptMessage;
import com.reqminer.core.state.MiningState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Opens a clarification round, or forces progression once the round limit is reached.
 */
@Component
public class ClarifyRequirementsNode {

    private final RoundLimiter roundLimiter;

    public ClarifyRequirementsNode(RoundLimiter roundLimiter) {
        this.roundLimiter = roundLimiter;
    }

    public Map<String, Object> apply(MiningState state) {
        var context = state.context();
        var decision = roundLimiter.enter(context, state.demandAnalysis().orElse(null));

        if (decision.forced()) {
            String note = "Clarification limit reached after " + decision.round()
                    + " round(s); proceeding with the information provided.";
            return Map.of(
                    MiningState.DEMAND_STATE, DemandState.SMART_COMPLIANT.name(),
                    MiningState.DEMAND_STATE_SOURCE, DemandStateSource.ROUND_LIMIT.name(),
                    MiningState.FORCED_PROGRESSION, true,
                    MiningState.CLARIFICATION_QUESTIONS, List.of(),
                    MiningState.MESSAGES, state.messagesWith(TranscriptMessage.assistant(note))
            );
        }

        String message = RoundLimiter.clarificationMessage(decision.round(), decision.questions());
        return Map.of(
                MiningState.CONTEXT, context.withCurrentRound(decision.round()),
                MiningState.CLARIFICATION_QUESTIONS, decision.questions(),
                MiningState.FEEDBACK_TYPE, FeedbackType.CLARIFICATION.name(),
                MiningState.MESSAGES, state.messagesWith(TranscriptMessage.assistant(message))
        );
    }
}
