package com.reqminer.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MiningContextTest {

    @Test
    @DisplayName("blank domain and user fall back to defaults")
    void defaults() {
        var context = new MiningContext("s-1", "t-1", " ", null, Instant.now(), 0);

        assertEquals(MiningContext.DEFAULT_DOMAIN, context.domain());
        assertEquals(MiningContext.ANONYMOUS_USER, context.userId());
        assertTrue(context.isGeneralDomain());
    }

    @Test
    @DisplayName("rejects a negative round")
    void negativeRound() {
        assertThrows(IllegalArgumentException.class,
                () -> new MiningContext("s-1", "t-1", null, null, Instant.now(), -1));
    }

    @Test
    @DisplayName("withCurrentRound keeps the other fields")
    void withCurrentRound() {
        var context = new MiningContext("s-1", "t-1", "finance", "u-1", Instant.now(), 0);

        var next = context.withCurrentRound(2);

        assertEquals(2, next.currentRound());
        assertEquals("finance", next.domain());
        assertEquals("u-1", next.userId());
        assertFalse(next.isGeneralDomain());
    }
}
