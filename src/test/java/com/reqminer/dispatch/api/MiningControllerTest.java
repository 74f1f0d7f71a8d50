package com.reqminer.dispatch.api;

import com.reqminer.core.engine.InvalidMiningRequestException;
import com.reqminer.core.engine.MiningEngine;
import com.reqminer.core.engine.MiningWorkflowException;
import com.reqminer.core.engine.SessionBusyException;
import com.reqminer.core.engine.SessionNotFoundException;
import com.reqminer.core.metrics.MiningMetrics;
import com.reqminer.core.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MiningController.class)
class MiningControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private MiningEngine miningEngine;

    @MockitoBean
    private MiningMetrics metrics;

    private static MiningResult waitingResult(String sessionId) {
        return new MiningResult(sessionId, sessionId + "-task", ServiceStatus.WAITING_FOR_USER_FEEDBACK,
                "help me", "help me", List.of("help me"), DemandState.VAGUE_UNCLEAR,
                DemandStateSource.LEXICAL_HEURISTIC, null, List.of(),
                List.of("What is your desired timeframe for this request?"),
                FeedbackType.CLARIFICATION, false, null, null, null, null,
                List.of(TranscriptMessage.assistant("Clarification needed (Round 1): ...")),
                null, null, 12);
    }

    // ── POST /api/v1/mining ──────────────────────────────────────────

    @Test
    @DisplayName("POST /mining starts a session and returns the paused result")
    void mine() throws Exception {
        when(miningEngine.mineRequirements(eq("help me"), any(MiningContext.class)))
                .thenReturn(waitingResult("MINE-2026-0001-abcdef"));

        mockMvc.perform(post("/api/v1/mining")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"input": "help me", "domain": "finance", "user_id": "u-7"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value("MINE-2026-0001-abcdef"))
                .andExpect(jsonPath("$.status").value("WAITING_FOR_USER_FEEDBACK"))
                .andExpect(jsonPath("$.demand_state").value("VAGUE_UNCLEAR"))
                .andExpect(jsonPath("$.feedback_type").value("clarification"))
                .andExpect(jsonPath("$.clarification_questions", hasSize(1)));

        ArgumentCaptor<MiningContext> captor = ArgumentCaptor.forClass(MiningContext.class);
        verify(miningEngine).mineRequirements(eq("help me"), captor.capture());
        assertEquals("finance", captor.getValue().domain());
        assertEquals("u-7", captor.getValue().userId());
    }

    @Test
    @DisplayName("POST /mining with blank input returns 400")
    void mineBlankInput() throws Exception {
        when(miningEngine.mineRequirements(any(), any(MiningContext.class)))
                .thenThrow(new InvalidMiningRequestException("User input must not be blank"));

        mockMvc.perform(post("/api/v1/mining")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("User input must not be blank"));
    }

    @Test
    @DisplayName("POST /mining node failure returns 500 with session and node")
    void mineWorkflowFailure() throws Exception {
        when(miningEngine.mineRequirements(anyString(), any(MiningContext.class)))
                .thenThrow(new MiningWorkflowException("s-1", "meta_architect_flow", "quota exceeded",
                        (MiningResult) null));

        mockMvc.perform(post("/api/v1/mining")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\": \"plan things\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.session_id").value("s-1"))
                .andExpect(jsonPath("$.failed_node").value("meta_architect_flow"))
                .andExpect(jsonPath("$.error", containsString("quota exceeded")));
    }

    // ── POST /api/v1/mining/{id}/feedback ───────────────────────────

    @Test
    @DisplayName("POST /feedback converts the body into a feedback payload")
    void feedback() throws Exception {
        when(miningEngine.resumeWorkflow(eq("s-1"), any(FeedbackPayload.class)))
                .thenReturn(waitingResult("s-1"));

        mockMvc.perform(post("/api/v1/mining/s-1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type": "clarification", "responses": ["Q2 2024 revenue"]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value("s-1"));

        ArgumentCaptor<FeedbackPayload> captor = ArgumentCaptor.forClass(FeedbackPayload.class);
        verify(miningEngine).resumeWorkflow(eq("s-1"), captor.capture());
        assertEquals(FeedbackType.CLARIFICATION, captor.getValue().type());
        assertEquals(List.of("Q2 2024 revenue"), captor.getValue().responses());
        assertFalse(captor.getValue().confirmation());
    }

    @Test
    @DisplayName("POST /feedback keeps an unknown type name")
    void feedbackUnknownType() throws Exception {
        when(miningEngine.resumeWorkflow(eq("s-1"), any(FeedbackPayload.class)))
                .thenReturn(waitingResult("s-1"));

        mockMvc.perform(post("/api/v1/mining/s-1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\": \"something_else\", \"confirmation\": true}"))
                .andExpect(status().isOk());

        ArgumentCaptor<FeedbackPayload> captor = ArgumentCaptor.forClass(FeedbackPayload.class);
        verify(miningEngine).resumeWorkflow(eq("s-1"), captor.capture());
        assertNull(captor.getValue().type());
        assertEquals("something_else", captor.getValue().unknownType());
        assertTrue(captor.getValue().confirmation());
    }

    @Test
    @DisplayName("POST /feedback drops null clarification responses")
    void feedbackNullResponses() throws Exception {
        when(miningEngine.resumeWorkflow(eq("s-1"), any(FeedbackPayload.class)))
                .thenReturn(waitingResult("s-1"));

        mockMvc.perform(post("/api/v1/mining/s-1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\": \"clarification\", \"responses\": [\"Europe\", null]}"))
                .andExpect(status().isOk());

        ArgumentCaptor<FeedbackPayload> captor = ArgumentCaptor.forClass(FeedbackPayload.class);
        verify(miningEngine).resumeWorkflow(eq("s-1"), captor.capture());
        assertEquals(List.of("Europe"), captor.getValue().responses());
    }

    @Test
    @DisplayName("POST /feedback answering the wrong decision returns 400")
    void feedbackWrongDecision() throws Exception {
        when(miningEngine.resumeWorkflow(eq("s-1"), any(FeedbackPayload.class)))
                .thenThrow(new InvalidMiningRequestException(
                        "Session s-1 is waiting for clarification feedback, not simple_strategy_confirmation"));

        mockMvc.perform(post("/api/v1/mining/s-1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\": \"simple_strategy_confirmation\", \"confirmation\": true}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /feedback without a body resumes with no payload")
    void feedbackWithoutBody() throws Exception {
        when(miningEngine.resumeWorkflow(eq("s-1"), isNull())).thenReturn(waitingResult("s-1"));

        mockMvc.perform(post("/api/v1/mining/s-1/feedback"))
                .andExpect(status().isOk());

        verify(miningEngine).resumeWorkflow(eq("s-1"), isNull());
    }

    @Test
    @DisplayName("POST /feedback for an unknown session returns 404")
    void feedbackUnknownSession() throws Exception {
        when(miningEngine.resumeWorkflow(eq("nope"), any()))
                .thenThrow(new SessionNotFoundException("nope"));

        mockMvc.perform(post("/api/v1/mining/nope/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"confirmation\": true}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.session_id").value("nope"));
    }

    @Test
    @DisplayName("POST /feedback on a busy session returns 409")
    void feedbackBusySession() throws Exception {
        when(miningEngine.resumeWorkflow(eq("s-1"), any()))
                .thenThrow(new SessionBusyException("s-1", Duration.ofSeconds(30)));

        mockMvc.perform(post("/api/v1/mining/s-1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"confirmation\": true}"))
                .andExpect(status().isConflict());
    }

    // ── GET / DELETE /api/v1/mining/{id} ─────────────────────────────

    @Test
    @DisplayName("GET /mining/{id} returns the checkpointed session")
    void getSession() throws Exception {
        when(miningEngine.findSession("s-1")).thenReturn(Optional.of(waitingResult("s-1")));

        mockMvc.perform(get("/api/v1/mining/s-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.original_input").value("help me"));
    }

    @Test
    @DisplayName("GET /mining/{id} returns 404 for an unknown session")
    void getUnknownSession() throws Exception {
        when(miningEngine.findSession("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/mining/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE /mining/{id} returns 204 when a checkpoint was removed")
    void discardSession() throws Exception {
        when(miningEngine.discardSession("s-1")).thenReturn(true);
        when(miningEngine.discardSession("nope")).thenReturn(false);

        mockMvc.perform(delete("/api/v1/mining/s-1")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/mining/nope")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /mining/metrics returns service totals")
    void serviceMetrics() throws Exception {
        when(metrics.serviceMetrics()).thenReturn(new MiningMetrics.ServiceMetrics(4, 3, 0.75, 1.5));

        mockMvc.perform(get("/api/v1/mining/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalOperations").value(4))
                .andExpect(jsonPath("$.successRate").value(0.75));
    }
}
