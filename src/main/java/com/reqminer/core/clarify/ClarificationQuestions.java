package com.reqminer.core.clarify;

import com.reqminer.core.model.MiningContext;
import com.reqminer.core.model.SmartCriteria;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Default clarification questions and question list hygiene.
 */
public final class ClarificationQuestions {

    static final String SPECIFIC = "Could you provide more specific details about what you want to achieve?";
    static final String MEASURABLE = "What specific measurable metrics or outcomes would indicate success?";
    static final String TIME_BOUND = "What is your desired timeframe for this request?";
    static final String RELEVANT = "What is the context or purpose behind this request?";
    static final String GENERIC = "Could you please provide more details about your requirements?";

    private ClarificationQuestions() {}

    /**
     * One question per unmet SMART criterion, plus a domain question outside the general domain.
     * A criterion the classifier did not assess counts as unmet.
     */
    public static List<String> defaults(SmartCriteria criteria, MiningContext context) {
        var questions = new ArrayList<String>();
        if (!Boolean.TRUE.equals(criteria.specific())) {
            questions.add(SPECIFIC);
        }
        if (!Boolean.TRUE.equals(criteria.measurable())) {
            questions.add(MEASURABLE);
        }
        if (!Boolean.TRUE.equals(criteria.timeBound())) {
            questions.add(TIME_BOUND);
        }
        if (!Boolean.TRUE.equals(criteria.relevant())) {
            questions.add(RELEVANT);
        }
        if (!context.isGeneralDomain()) {
            questions.add("Are there any " + context.domain() + "-specific requirements or constraints?");
        }
        if (questions.isEmpty()) {
            questions.add(GENERIC);
        }
        return List.copyOf(questions);
    }

    /**
     * Drops blanks and repeats, keeping first-seen order. Whitespace is trimmed before comparing.
     */
    public static List<String> deduplicate(List<String> questions) {
        var unique = new LinkedHashSet<String>();
        for (String question : questions) {
            if (question != null && !question.isBlank()) {
                unique.add(question.trim());
            }
        }
        return List.copyOf(unique);
    }
}
