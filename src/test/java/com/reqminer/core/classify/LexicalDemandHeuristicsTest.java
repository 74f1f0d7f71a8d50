package com.reqminer.core.classify;

import com.reqminer.core.config.MiningProperties;
import com.reqminer.core.model.DemandState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LexicalDemandHeuristicsTest {

    private final LexicalDemandHeuristics heuristics = new LexicalDemandHeuristics(new MiningProperties());

    @Test
    @DisplayName("vague phrasing wins regardless of length")
    void vaguePhrase() {
        assertEquals(Optional.of(DemandState.VAGUE_UNCLEAR),
                heuristics.evaluate("Please help me analyze Q2 2024 revenue growth in detail"));
    }

    @Test
    @DisplayName("short inputs are vague")
    void shortInput() {
        assertEquals(Optional.of(DemandState.VAGUE_UNCLEAR), heuristics.evaluate("Sales report"));
    }

    @Test
    @DisplayName("specific and time-bound within the word limit is compliant")
    void compliant() {
        assertEquals(Optional.of(DemandState.SMART_COMPLIANT),
                heuristics.evaluate("Analyze Q2 2024 revenue growth for our SaaS product"));
    }

    @Test
    @DisplayName("specific and time-bound beyond the word limit is large scope")
    void longSpecific() {
        String text = "Analyze revenue growth for 2024 across all product lines regions channels partners "
                + "segments customers markets teams offices countries languages platforms devices plans tiers "
                + "bundles currencies campaigns cohorts and vendors";

        assertEquals(Optional.of(DemandState.SMART_LARGE_SCOPE), heuristics.evaluate(text));
    }

    @Test
    @DisplayName("specific without a timeframe is compliant")
    void specificOnly() {
        assertEquals(Optional.of(DemandState.SMART_COMPLIANT),
                heuristics.evaluate("Compare the performance of our teams across every region"));
    }

    @Test
    @DisplayName("neither specific nor vague is large scope")
    void neither() {
        assertEquals(Optional.of(DemandState.SMART_LARGE_SCOPE),
                heuristics.evaluate("Build a new internal platform for our engineering organization"));
    }

    @Test
    @DisplayName("blank input has no verdict")
    void blank() {
        assertTrue(heuristics.evaluate("   ").isEmpty());
        assertTrue(heuristics.evaluate(null).isEmpty());
    }
}
