package com.reqminer.core.nodes;

import com.reqminer.core.model.ServiceStatus;
import com.reqminer.core.persistence.CheckpointStore;
import com.reqminer.core.persistence.MiningSnapshot;
import com.reqminer.core.state.MiningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Pause point of the graph. Marks the session as waiting and saves its snapshot.
 */
@Component
public class WaitForUserFeedbackNode {

    private static final Logger log = LoggerFactory.getLogger(WaitForUserFeedbackNode.class);

    private final CheckpointStore checkpointStore;

    public WaitForUserFeedbackNode(CheckpointStore checkpointStore) {
        this.checkpointStore = checkpointStore;
    }

    public Map<String, Object> apply(MiningState state) {
        var pending = state.feedbackType()
                .orElseThrow(() -> new IllegalStateException("Cannot pause without a pending feedback type"));

        Map<String, Object> updates = Map.of(MiningState.STATUS, ServiceStatus.WAITING_FOR_USER_FEEDBACK.name());

        var paused = new HashMap<>(state.data());
        paused.putAll(updates);
        checkpointStore.save(MiningSnapshot.from(new MiningState(paused)));
        log.info("Session paused awaiting {} feedback", pending.value());
        return updates;
    }
}
