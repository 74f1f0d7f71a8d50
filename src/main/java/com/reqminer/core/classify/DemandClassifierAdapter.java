package com.reqminer.core.classify;

import com.reqminer.core.config.MiningProperties;
import com.reqminer.core.model.DemandAnalysis;
import com.reqminer.core.model.DemandState;
import com.reqminer.core.model.DemandStateSource;
import com.reqminer.core.model.MiningContext;
import com.reqminer.core.model.SmartCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Calls the {@link DemandClassifier} and guarantees a demand state.
 * <p>
 * When the classifier returns no verdict the state is taken, in order, from:
 * <ol>
 *   <li>the classifier's own criteria and scope assessment,</li>
 *   <li>{@link LexicalDemandHeuristics} over the raw text,</li>
 *   <li>the fixed default {@link DemandState#SMART_LARGE_SCOPE}.</li>
 * </ol>
 * A classifier that throws is treated as having produced no analysis.
 */
@Component
public class DemandClassifierAdapter {

    private static final Logger log = LoggerFactory.getLogger(DemandClassifierAdapter.class);

    static final int CRITERIA_REQUIRED = 4;
    static final DemandState DEFAULT_STATE = DemandState.SMART_LARGE_SCOPE;

    private final DemandClassifier classifier;
    private final LexicalDemandHeuristics heuristics;

    public DemandClassifierAdapter(DemandClassifier classifier, MiningProperties properties) {
        this.classifier = classifier;
        this.heuristics = new LexicalDemandHeuristics(properties);
    }

    public DemandClassification classify(String text, MiningContext context) {
        DemandAnalysis analysis;
        try {
            analysis = classifier.classify(text, context);
            if (analysis == null) {
                analysis = DemandAnalysis.unavailable("classifier returned no analysis");
            }
        } catch (RuntimeException e) {
            log.warn("Demand classifier failed, falling back to heuristics: {}", e.getMessage());
            analysis = DemandAnalysis.unavailable(e.getMessage());
        }

        if (analysis.demandState() != null) {
            return new DemandClassification(analysis, analysis.demandState(), DemandStateSource.CLASSIFIER);
        }

        Optional<DemandState> inferred = inferFromAnalysis(analysis);
        if (inferred.isPresent()) {
            log.info("Demand state inferred from criteria analysis: {}", inferred.get());
            return resolved(analysis, inferred.get(), DemandStateSource.ANALYSIS_INFERENCE);
        }

        Optional<DemandState> lexical = heuristics.evaluate(text);
        if (lexical.isPresent()) {
            log.info("Demand state derived from lexical heuristics: {}", lexical.get());
            return resolved(analysis, lexical.get(), DemandStateSource.LEXICAL_HEURISTIC);
        }

        log.warn("No demand signal available; using default {}", DEFAULT_STATE);
        return resolved(analysis, DEFAULT_STATE, DemandStateSource.DEFAULT);
    }

    /**
     * Tier one: four or more criteria met means compliant, large-scope when the
     * scope is high or broad. Fewer means vague. Nothing assessed means no inference.
     */
    static Optional<DemandState> inferFromAnalysis(DemandAnalysis analysis) {
        SmartCriteria criteria = analysis.criteria();
        if (!criteria.isAssessed()) {
            return Optional.empty();
        }
        if (criteria.metCount() >= CRITERIA_REQUIRED) {
            boolean broad = analysis.scope() != null && analysis.scope().isBroad();
            return Optional.of(broad ? DemandState.SMART_LARGE_SCOPE : DemandState.SMART_COMPLIANT);
        }
        return Optional.of(DemandState.VAGUE_UNCLEAR);
    }

    private static DemandClassification resolved(DemandAnalysis analysis, DemandState state,
                                                 DemandStateSource source) {
        return new DemandClassification(analysis.withDemandState(state), state, source);
    }
}
