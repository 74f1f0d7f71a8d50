package com.reqminer.core.dispatch;

import com.reqminer.core.graph.MiningNode;
import com.reqminer.core.model.FeedbackPayload;
import com.reqminer.core.model.FeedbackType;
import com.reqminer.core.model.ServiceStatus;
import com.reqminer.core.state.MiningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Chooses where a graph invocation enters.
 * <p>
 * A fresh session starts at {@link MiningNode#ANALYZE_DEMAND}. A resumed session
 * is routed by the feedback type it was paused on. A payload naming an unknown
 * type goes to {@link MiningNode#PACKAGE_RESULTS}.
 */
@Component
public class FeedbackDispatcher {

    private static final Logger log = LoggerFactory.getLogger(FeedbackDispatcher.class);

    public MiningNode route(MiningState state) {
        Optional<FeedbackPayload> feedback = state.userFeedback();
        if (feedback.isEmpty() && state.status() != ServiceStatus.PROCESSING_FEEDBACK) {
            return MiningNode.ANALYZE_DEMAND;
        }

        if (feedback.map(FeedbackPayload::hasUnknownType).orElse(false)) {
            log.warn("Unrecognized feedback type '{}'; packaging current results", feedback.get().unknownType());
            return MiningNode.PACKAGE_RESULTS;
        }

        FeedbackType type = effectiveType(state).orElse(null);
        boolean confirmed = feedback.map(FeedbackPayload::confirmation).orElse(false);
        if (type == null) {
            log.warn("Missing feedback type; packaging current results");
            return MiningNode.PACKAGE_RESULTS;
        }

        MiningNode target = switch (type) {
            case CLARIFICATION -> MiningNode.PROCESS_CLARIFICATION;
            case SIMPLE_STRATEGY_CONFIRMATION -> confirmed ? MiningNode.PACKAGE_RESULTS : MiningNode.PROCESS_ADJUSTMENT;
            case META_ARCHITECT_CONFIRMATION -> confirmed ? MiningNode.GENERATE_ROADMAP : MiningNode.PROCESS_ADJUSTMENT;
        };
        log.info("Dispatching {} feedback (confirmed={}) to {}", type.value(), confirmed, target.id());
        return target;
    }

    /**
     * The pending type recorded at pause time. The payload's type counts only when
     * nothing is pending.
     */
    public Optional<FeedbackType> effectiveType(MiningState state) {
        Optional<FeedbackType> pending = state.feedbackType();
        return pending.isPresent() ? pending : state.userFeedback().map(FeedbackPayload::type);
    }
}
