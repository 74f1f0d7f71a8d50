package com.reqminer.core.classify;

import com.reqminer.core.config.MiningProperties;
import com.reqminer.core.model.DemandState;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Derives a demand state from surface features of the raw request text.
 * Rules are evaluated in order and the first match wins.
 */
public class LexicalDemandHeuristics {

    static final List<String> VAGUE_PHRASES = List.of(
            "help me", "give me", "please help", "can you", "could you");

    static final List<String> SPECIFIC_INDICATORS = List.of(
            "analyze", "compare", "performance", "financial", "revenue", "profit", "growth");

    static final List<String> TIME_INDICATORS = List.of(
            "2024", "2025", "q1", "q2", "q3", "q4", "quarter", "year", "month", "week");

    private final int shortInputWordThreshold;
    private final int largeScopeWordThreshold;

    public LexicalDemandHeuristics(MiningProperties properties) {
        this.shortInputWordThreshold = properties.getShortInputWordThreshold();
        this.largeScopeWordThreshold = properties.getLargeScopeWordThreshold();
    }

    /**
     * Returns empty only for blank input, which carries nothing to judge.
     */
    public Optional<DemandState> evaluate(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int wordCount = wordCount(text);

        if (containsAny(lower, VAGUE_PHRASES)) {
            return Optional.of(DemandState.VAGUE_UNCLEAR);
        }
        if (wordCount < shortInputWordThreshold) {
            return Optional.of(DemandState.VAGUE_UNCLEAR);
        }

        boolean specific = containsAny(lower, SPECIFIC_INDICATORS);
        boolean timeBound = containsAny(lower, TIME_INDICATORS);
        if (specific && timeBound) {
            return Optional.of(wordCount <= largeScopeWordThreshold
                    ? DemandState.SMART_COMPLIANT
                    : DemandState.SMART_LARGE_SCOPE);
        }
        if (specific) {
            return Optional.of(DemandState.SMART_COMPLIANT);
        }
        return Optional.of(DemandState.SMART_LARGE_SCOPE);
    }

    static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static boolean containsAny(String text, List<String> needles) {
        return needles.stream().anyMatch(text::contains);
    }
}
