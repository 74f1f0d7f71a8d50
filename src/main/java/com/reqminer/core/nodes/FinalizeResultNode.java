package com.reqminer.core.nodes;

import com.reqminer.core.model.DemandState;
import com.reqminer.core.model.DemandStateSource;
import com.reqminer.core.model.ServiceStatus;
import com.reqminer.core.model.TranscriptMessage;
import com.reqminer.core.state.MiningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Marks the session completed. A result never leaves without a demand state.
 */
@Component
public class FinalizeResultNode {

    private static final Logger log = LoggerFactory.getLogger(FinalizeResultNode.class);

    static final String COMPLETION_MESSAGE =
            "Mining process completed successfully. Analysis is ready for workflow planning.";

    public Map<String, Object> apply(MiningState state) {
        var updates = new HashMap<String, Object>();
        if (state.demandState().isEmpty()) {
            log.warn("No demand state recorded at finalization, applying default");
            updates.put(MiningState.DEMAND_STATE, DemandState.SMART_LARGE_SCOPE.name());
            updates.put(MiningState.DEMAND_STATE_SOURCE, DemandStateSource.DEFAULT.name());
        }
        updates.put(MiningState.STATUS, ServiceStatus.COMPLETED.name());
        updates.put(MiningState.FEEDBACK_TYPE, "");
        updates.put(MiningState.MESSAGES, state.messagesWith(TranscriptMessage.assistant(COMPLETION_MESSAGE)));
        log.info("Mining session {} completed", state.sessionId());
        return updates;
    }
}
