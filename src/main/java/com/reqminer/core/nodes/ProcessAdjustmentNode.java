package com.reqminer.core.nodes;

import com.reqminer.core.model.FeedbackPayload;
import com.reqminer.core.model.ServiceStatus;
import com.reqminer.core.model.TranscriptMessage;
import com.reqminer.core.state.MiningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Folds the adjustments of a rejected proposal into the request text.
 * <p>
 * The request always changes, even for a bare rejection, so that planners
 * re-run instead of replaying the rejected proposal.
 */
@Component
public class ProcessAdjustmentNode {

    private static final Logger log = LoggerFactory.getLogger(ProcessAdjustmentNode.class);

    static final String BARE_REJECTION = "User rejected the proposed plan without further comments.";

    public Map<String, Object> apply(MiningState state) {
        String adjustments = state.userFeedback().map(FeedbackPayload::adjustments).orElse("").trim();
        String applied = adjustments.isEmpty() ? BARE_REJECTION : adjustments;

        var recorded = new ArrayList<>(state.adjustments());
        recorded.add(applied);
        log.info("Applying adjustments to {} proposal: {}",
                state.planningPath().map(Enum::name).orElse("unknown"), applied);

        return Map.of(
                MiningState.USER_INPUT, state.userInput() + "\n\nUser adjustments: " + applied,
                MiningState.ADJUSTMENTS, List.copyOf(recorded),
                MiningState.FEEDBACK_TYPE, "",
                MiningState.STATUS, ServiceStatus.PROCESSING.name(),
                MiningState.MESSAGES, state.messagesWith(TranscriptMessage.user("Adjustments: " + applied))
        );
    }
}
