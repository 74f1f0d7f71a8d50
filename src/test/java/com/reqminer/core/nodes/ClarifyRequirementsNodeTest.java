package com.reqminer.core.nodes;

import com.reqminer.core.clarify.RoundLimiter;
import com.reqminer.core.config.MiningProperties;
import com.reqminer.core.model.*;
import com.reqminer.core.state.MiningState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClarifyRequirementsNodeTest {

    private final ClarifyRequirementsNode node = new ClarifyRequirementsNode(new RoundLimiter(new MiningProperties()));

    private static DemandAnalysis vague() {
        return new DemandAnalysis(DemandState.VAGUE_UNCLEAR, SmartCriteria.none(), 0.3, "",
                List.of("Which market?"), null);
    }

    @Test
    @DisplayName("opens the next round and asks for clarification")
    void opensRound() {
        var updates = node.apply(NodeStates.at(1, MiningState.DEMAND_ANALYSIS, vague()));

        assertEquals(2, ((MiningContext) updates.get(MiningState.CONTEXT)).currentRound());
        assertEquals(List.of("Which market?"), updates.get(MiningState.CLARIFICATION_QUESTIONS));
        assertEquals(FeedbackType.CLARIFICATION.name(), updates.get(MiningState.FEEDBACK_TYPE));
        @SuppressWarnings("unchecked")
        var messages = (List<TranscriptMessage>) updates.get(MiningState.MESSAGES);
        assertEquals("Clarification needed (Round 2): Which market?", messages.get(0).content());
    }

    @Test
    @DisplayName("at the limit the request is treated as compliant and progression is forced")
    void forcesProgression() {
        var updates = node.apply(NodeStates.at(3, MiningState.DEMAND_ANALYSIS, vague()));

        assertEquals(DemandState.SMART_COMPLIANT.name(), updates.get(MiningState.DEMAND_STATE));
        assertEquals(DemandStateSource.ROUND_LIMIT.name(), updates.get(MiningState.DEMAND_STATE_SOURCE));
        assertEquals(true, updates.get(MiningState.FORCED_PROGRESSION));
        assertEquals(List.of(), updates.get(MiningState.CLARIFICATION_QUESTIONS));
        assertFalse(updates.containsKey(MiningState.FEEDBACK_TYPE));
        assertFalse(updates.containsKey(MiningState.CONTEXT));
    }
}
