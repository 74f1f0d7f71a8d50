package com.reqminer.core.intent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntentCategoriesTest {

    @Test
    @DisplayName("validate normalizes, filters and deduplicates")
    void validate() {
        assertEquals(List.of("collect", "analyze"),
                IntentCategories.validate(Arrays.asList("Collect", null, "summarize", "ANALYZE ", "collect")));
    }

    @Test
    @DisplayName("validate falls back to answer")
    void validateFallback() {
        assertEquals(List.of("answer"), IntentCategories.validate(null));
        assertEquals(List.of("answer"), IntentCategories.validate(List.of("dance")));
    }

    @Test
    @DisplayName("keyword extraction finds category names in text")
    void extract() {
        assertEquals(List.of("process", "generate"),
                IntentCategories.extractFromText("Process the survey and generate a summary"));
        assertEquals(List.of("answer"), IntentCategories.extractFromText(null));
    }

    @Test
    @DisplayName("answer does not count as a planning category")
    void planningCount() {
        assertEquals(2, IntentCategories.planningCategoryCount(List.of("answer", "collect", "collect", "analyze")));
    }
}
