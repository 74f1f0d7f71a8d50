package com.reqminer.core.nodes;

import com.reqminer.core.intent.IntentParser;
import com.reqminer.core.model.IntentAnalysis;
import com.reqminer.core.model.IntentParseResult;
import com.reqminer.core.state.MiningState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class IntentAnalysisNodeTest {

    private final IntentParser parser = mock(IntentParser.class);
    private final IntentAnalysisNode node = new IntentAnalysisNode(parser);

    private IntentAnalysis analyze(String input) {
        var updates = node.apply(NodeStates.of(MiningState.USER_INPUT, input));
        return (IntentAnalysis) updates.get(MiningState.INTENT_ANALYSIS);
    }

    @Test
    @DisplayName("validates the parser's categories")
    void validatesParserOutput() {
        when(parser.parse(anyString(), any()))
                .thenReturn(new IntentParseResult(List.of(" Analyze ", "forecast", "analyze", "GENERATE"), "why", "raw"));

        var intent = analyze("Analyze churn and write a memo");

        assertEquals(List.of("analyze", "generate"), intent.categories());
        assertEquals("why", intent.reasoning());
        assertFalse(intent.categoriesFromFallback());
    }

    @Test
    @DisplayName("extracts categories by keyword when the parser fails")
    void fallsBackOnFailure() {
        when(parser.parse(anyString(), any())).thenThrow(new RuntimeException("timeout"));

        var intent = analyze("Collect the data and analyze it");

        assertEquals(List.of("collect", "analyze"), intent.categories());
        assertTrue(intent.categoriesFromFallback());
    }

    @Test
    @DisplayName("an empty parse result falls back to answer when no keyword matches")
    void emptyResult() {
        when(parser.parse(anyString(), any())).thenReturn(new IntentParseResult(List.of(), "", ""));

        var intent = analyze("Tell me a joke");

        assertEquals(List.of("answer"), intent.categories());
        assertTrue(intent.categoriesFromFallback());
        assertEquals("low", intent.complexity().level());
    }
}
