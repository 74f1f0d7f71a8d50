package com.reqminer.core.clarify;

import com.reqminer.core.config.MiningProperties;
import com.reqminer.core.model.DemandAnalysis;
import com.reqminer.core.model.MiningContext;
import com.reqminer.core.model.SmartCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Bounds the number of clarification rounds of a session.
 * <p>
 * Once {@code maxClarificationRounds} rounds have been asked, the next entry forces
 * progression instead of pausing again.
 */
@Component
public class RoundLimiter {

    private static final Logger log = LoggerFactory.getLogger(RoundLimiter.class);

    private final int maxRounds;

    public RoundLimiter(MiningProperties properties) {
        this.maxRounds = properties.getMaxClarificationRounds();
    }

    /**
     * Outcome of one clarification entry.
     *
     * @param forced    true when the bound was reached and the session must proceed
     * @param round     the round number after this entry
     * @param questions deduplicated questions to ask; empty when forced
     */
    public record Decision(boolean forced, int round, List<String> questions) {}

    public Decision enter(MiningContext context, DemandAnalysis analysis) {
        int current = context.currentRound();
        if (current >= maxRounds) {
            log.warn("Clarification limit of {} round(s) reached; forcing progression", maxRounds);
            return new Decision(true, current, List.of());
        }

        List<String> proposed = analysis == null ? List.of() : analysis.clarificationNeeded();
        List<String> questions = ClarificationQuestions.deduplicate(proposed);
        if (questions.isEmpty()) {
            SmartCriteria criteria = analysis == null ? SmartCriteria.none() : analysis.criteria();
            questions = ClarificationQuestions.defaults(criteria, context);
        }
        int next = current + 1;
        log.info("Clarification round {}/{} with {} question(s)", next, maxRounds, questions.size());
        return new Decision(false, next, questions);
    }

    public int maxRounds() {
        return maxRounds;
    }

    /**
     * Transcript line announcing a clarification round.
     */
    public static String clarificationMessage(int round, List<String> questions) {
        return "Clarification needed (Round " + round + "): " + String.join("; ", questions);
    }
}
