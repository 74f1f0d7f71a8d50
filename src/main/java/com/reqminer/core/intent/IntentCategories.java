package com.reqminer.core.intent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The closed set of task categories and helpers to sanitize parser output.
 */
public final class IntentCategories {

    public static final String ANSWER = "answer";
    public static final String COLLECT = "collect";
    public static final String PROCESS = "process";
    public static final String ANALYZE = "analyze";
    public static final String GENERATE = "generate";

    public static final List<String> SUPPORTED = List.of(ANSWER, COLLECT, PROCESS, ANALYZE, GENERATE);

    /** Categories whose co-occurrence marks a multi-stage request. */
    public static final Set<String> PLANNING_CATEGORIES = Set.of(COLLECT, PROCESS, ANALYZE, GENERATE);

    private IntentCategories() {}

    /**
     * Lower-cases, drops unsupported values and duplicates, and falls back to {@code answer}.
     */
    public static List<String> validate(Collection<String> raw) {
        var valid = new LinkedHashSet<String>();
        if (raw != null) {
            for (String category : raw) {
                if (category == null) {
                    continue;
                }
                String normalized = category.trim().toLowerCase(Locale.ROOT);
                if (SUPPORTED.contains(normalized)) {
                    valid.add(normalized);
                }
            }
        }
        if (valid.isEmpty()) {
            valid.add(ANSWER);
        }
        return List.copyOf(valid);
    }

    /**
     * Keyword extraction used when the parser is unavailable.
     */
    public static List<String> extractFromText(String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        var found = new ArrayList<String>();
        for (String category : SUPPORTED) {
            if (lower.contains(category)) {
                found.add(category);
            }
        }
        return validate(found);
    }

    public static long planningCategoryCount(Collection<String> categories) {
        return categories.stream().filter(PLANNING_CATEGORIES::contains).distinct().count();
    }
}
