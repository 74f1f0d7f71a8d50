package com.reqminer.core.clarify;

import com.reqminer.core.model.MiningContext;
import com.reqminer.core.model.SmartCriteria;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClarificationQuestionsTest {

    @Test
    @DisplayName("asks only about unmet criteria")
    void unmetCriteriaOnly() {
        var criteria = new SmartCriteria(true, false, true, true, true);

        assertEquals(List.of(ClarificationQuestions.MEASURABLE),
                ClarificationQuestions.defaults(criteria, MiningContext.of("s-1")));
    }

    @Test
    @DisplayName("adds a domain question outside the general domain")
    void domainQuestion() {
        var context = new MiningContext("s-1", null, "healthcare", null, Instant.now(), 0);
        var criteria = new SmartCriteria(true, true, true, true, true);

        assertEquals(List.of("Are there any healthcare-specific requirements or constraints?"),
                ClarificationQuestions.defaults(criteria, context));
    }

    @Test
    @DisplayName("fully met criteria in the general domain yield the generic question")
    void genericQuestion() {
        var criteria = new SmartCriteria(true, true, true, true, true);

        assertEquals(List.of(ClarificationQuestions.GENERIC),
                ClarificationQuestions.defaults(criteria, MiningContext.of("s-1")));
    }

    @Test
    @DisplayName("deduplicate trims, drops blanks and nulls, and keeps first-seen order")
    void deduplicate() {
        var raw = Arrays.asList("B?", null, " A? ", "", "B?", "A?");

        assertEquals(List.of("B?", "A?"), ClarificationQuestions.deduplicate(raw));
    }
}
