package com.reqminer.core.nodes;

import com.reqminer.core.classify.DemandClassification;
import com.reqminer.core.classify.DemandClassifierAdapter;
import com.reqminer.core.model.ServiceStatus;
import com.reqminer.core.state.MiningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Classifies the current request text and records the resolved demand state.
 * Always re-classifies, since it is only reached for new or clarified input.
 */
@Component
public class AnalyzeDemandNode {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeDemandNode.class);

    private final DemandClassifierAdapter classifierAdapter;

    public AnalyzeDemandNode(DemandClassifierAdapter classifierAdapter) {
        this.classifierAdapter = classifierAdapter;
    }

    public Map<String, Object> apply(MiningState state) {
        DemandClassification classification = classifierAdapter.classify(state.userInput(), state.context());
        log.info("Demand classified as {} (source {})", classification.demandState(), classification.source());

        return Map.of(
                MiningState.DEMAND_STATE, classification.demandState().name(),
                MiningState.DEMAND_STATE_SOURCE, classification.source().name(),
                MiningState.DEMAND_ANALYSIS, classification.analysis(),
                MiningState.STATUS, ServiceStatus.PROCESSING.name(),
                MiningState.FEEDBACK_TYPE, ""
        );
    }
}
