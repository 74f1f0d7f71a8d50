package com.reqminer.core.classify;

import com.reqminer.core.model.DemandAnalysis;
import com.reqminer.core.model.DemandState;
import com.reqminer.core.model.DemandStateSource;

import java.util.Objects;

/**
 * Resolved demand state together with the analysis it came from.
 */
public record DemandClassification(
    DemandAnalysis analysis,
    DemandState demandState,
    DemandStateSource source
) {
    public DemandClassification {
        Objects.requireNonNull(analysis, "analysis must not be null");
        Objects.requireNonNull(demandState, "demandState must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }
}
