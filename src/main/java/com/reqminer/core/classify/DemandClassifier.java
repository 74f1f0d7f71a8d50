package com.reqminer.core.classify;

import com.reqminer.core.model.DemandAnalysis;
import com.reqminer.core.model.MiningContext;

/**
 * Scores a request against SMART-style criteria.
 */
public interface DemandClassifier {

    /**
     * @param text    the current (possibly clarification-enriched) request text
     * @param context session metadata
     * @return the analysis; its demand state may be absent
     */
    DemandAnalysis classify(String text, MiningContext context);
}
