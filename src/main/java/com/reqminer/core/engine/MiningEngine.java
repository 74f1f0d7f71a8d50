package com.reqminer.core.engine;

import com.reqminer.core.config.MiningProperties;
import com.reqminer.core.events.EventBus;
import com.reqminer.core.events.MiningEvent;
import com.reqminer.core.graph.MiningGraph;
import com.reqminer.core.logging.MdcContext;
import com.reqminer.core.metrics.MiningMetrics;
import com.reqminer.core.model.FeedbackPayload;
import com.reqminer.core.model.FeedbackType;
import com.reqminer.core.model.MiningContext;
import com.reqminer.core.model.MiningResult;
import com.reqminer.core.model.ServiceStatus;
import com.reqminer.core.persistence.CheckpointCorruptedException;
import com.reqminer.core.persistence.CheckpointStore;
import com.reqminer.core.persistence.MiningSnapshot;
import com.reqminer.core.state.MiningState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of requirement mining. Bridges callers to the LangGraph4j graph.
 * <p>
 * A call runs the graph until it either pauses for user feedback or completes.
 * Paused sessions are resumed from their checkpoint by replaying the saved state
 * through the graph's entry router. Calls on one session are serialized.
 */
@Service
public class MiningEngine {

    private static final Logger log = LoggerFactory.getLogger(MiningEngine.class);
    private static final AtomicInteger SESSION_COUNTER = new AtomicInteger(0);

    private final MiningGraph miningGraph;
    private final CheckpointStore checkpointStore;
    private final EventBus eventBus;
    private final MiningMetrics metrics;
    private final SessionLocks sessionLocks;

    public MiningEngine(MiningGraph miningGraph, CheckpointStore checkpointStore, EventBus eventBus,
                        MiningMetrics metrics, MiningProperties properties) {
        this.miningGraph = miningGraph;
        this.checkpointStore = checkpointStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.sessionLocks = new SessionLocks(properties.getLockTimeout());
    }

    /**
     * Starts a new mining session for a natural-language request.
     *
     * @param userInput the raw request; must not be blank
     * @param context   call metadata; a blank session id is generated, a blank task id is derived from it
     * @return the result at the first pause, or the completed result
     * @throws InvalidMiningRequestException if the input is blank
     * @throws MiningWorkflowException       if a node fails
     * @throws SessionBusyException          if the session is already being processed
     */
    public MiningResult mineRequirements(String userInput, MiningContext context) {
        if (userInput == null || userInput.isBlank()) {
            throw new InvalidMiningRequestException("User input must not be blank");
        }
        MiningContext effective = normalize(context);
        String sessionId = effective.sessionId();

        MdcContext.setSession(sessionId, effective.taskId());
        try (var held = sessionLocks.acquire(sessionId)) {
            log.info("Starting mining session {} for task {}", sessionId, effective.taskId());
            eventBus.publish(MiningEvent.of(MiningEvent.STARTED, sessionId, effective.taskId(),
                    Map.of("input", userInput, "domain", effective.domain())));

            var initialState = new HashMap<String, Object>();
            initialState.put(MiningState.ORIGINAL_INPUT, userInput);
            initialState.put(MiningState.USER_INPUT, userInput);
            initialState.put(MiningState.CONTEXT, effective);
            initialState.put(MiningState.STATUS, ServiceStatus.PROCESSING.name());

            return run(sessionId, effective.taskId(), initialState);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Resumes a paused session with the user's feedback.
     * <p>
     * A null payload returns the checkpointed result without running the graph.
     * A payload whose type differs from the decision the session is waiting on is rejected.
     *
     * @throws InvalidMiningRequestException if the feedback answers a different decision
     * @throws SessionNotFoundException if no usable checkpoint exists
     * @throws MiningWorkflowException  if a node fails
     * @throws SessionBusyException     if the session is already being processed
     */
    public MiningResult resumeWorkflow(String sessionId, FeedbackPayload feedback) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new InvalidMiningRequestException("Session id must not be blank");
        }

        MdcContext.setSession(sessionId, null);
        try (var held = sessionLocks.acquire(sessionId)) {
            MiningSnapshot snapshot = loadSnapshot(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            MdcContext.setSession(sessionId, snapshot.context().taskId());

            if (feedback == null) {
                log.info("Resume without feedback for session {}, returning checkpointed state", sessionId);
                return MiningResultMapper.toResult(new MiningState(snapshot.toStateData()), 0);
            }

            FeedbackType pending = snapshot.feedbackType();
            if (feedback.type() != null && pending != null && feedback.type() != pending) {
                log.warn("Session {} is waiting for {} feedback but received {}",
                        sessionId, pending.value(), feedback.type().value());
                throw new InvalidMiningRequestException("Session " + sessionId + " is waiting for "
                        + pending.value() + " feedback, not " + feedback.type().value());
            }

            FeedbackType type = pending != null ? pending : feedback.type();
            String label = feedback.hasUnknownType() ? "unknown" : type == null ? "none" : type.value();
            log.info("Resuming session {} with {} feedback", sessionId, label);
            metrics.recordResume(label);
            eventBus.publish(MiningEvent.of(MiningEvent.RESUMED, sessionId, snapshot.context().taskId(),
                    Map.of("feedbackType", label, "confirmation", feedback.confirmation())));

            var stateData = snapshot.toStateData();
            var responses = new ArrayList<>(snapshot.userResponses());
            responses.addAll(feedback.responses());
            stateData.put(MiningState.USER_FEEDBACK, feedback);
            stateData.put(MiningState.STATUS, ServiceStatus.PROCESSING_FEEDBACK.name());
            stateData.put(MiningState.USER_RESPONSES, List.copyOf(responses));

            return run(sessionId, snapshot.context().taskId(), stateData);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Returns the checkpointed state of a session without running the graph.
     *
     * @throws SessionNotFoundException if the checkpoint exists but cannot be read
     */
    public Optional<MiningResult> findSession(String sessionId) {
        return loadSnapshot(sessionId)
                .map(snapshot -> MiningResultMapper.toResult(new MiningState(snapshot.toStateData()), 0));
    }

    /**
     * Deletes the checkpoint of a session and forgets its subscribers.
     *
     * @return whether a checkpoint existed
     */
    public boolean discardSession(String sessionId) {
        boolean deleted;
        try (var held = sessionLocks.acquire(sessionId)) {
            deleted = checkpointStore.delete(sessionId);
        }
        eventBus.releaseSession(sessionId);
        log.info("Discarded session {} (checkpoint existed: {})", sessionId, deleted);
        return deleted;
    }

    /**
     * Generates a unique session ID in the format MINE-YYYY-NNNN-xxxxxx.
     */
    public String generateSessionId() {
        int count = SESSION_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        String suffix = UUID.randomUUID().toString().substring(0, 6);
        return String.format("MINE-%d-%04d-%s", year, count, suffix);
    }

    // =================================================================
    //  Internals
    // =================================================================

    private MiningResult run(String sessionId, String taskId, Map<String, Object> stateData) {
        long start = System.currentTimeMillis();
        var config = RunnableConfig.builder()
                .threadId(sessionId)
                .build();

        MiningState state;
        try {
            state = miningGraph.getCompiledGraph()
                    .invoke(stateData, config)
                    .orElseThrow(() -> new IllegalStateException(
                            "Graph execution returned empty state for session " + sessionId));
        } catch (RuntimeException e) {
            long elapsed = System.currentTimeMillis() - start;
            log.error("Graph execution failed for session {}: {}", sessionId, e.getMessage(), e);
            metrics.recordSessionResult(ServiceStatus.ERROR.name(), elapsed);
            eventBus.publish(MiningEvent.of(MiningEvent.FAILED, sessionId, taskId,
                    Map.of("error", String.valueOf(e.getMessage()))));
            throw new MiningWorkflowException(sessionId, "graph", String.valueOf(e.getMessage()), e);
        }

        long elapsed = System.currentTimeMillis() - start;
        MiningResult result = MiningResultMapper.toResult(state, elapsed);
        metrics.recordSessionResult(result.status().name(), elapsed);

        if (state.hasError()) {
            eventBus.publish(MiningEvent.of(MiningEvent.FAILED, sessionId, taskId,
                    Map.of("failedNode", state.failedNode(), "error", state.error())));
            throw new MiningWorkflowException(sessionId, state.failedNode(), state.error(), result);
        }

        if (result.isCompleted()) {
            metrics.recordClarificationRounds(result.clarificationRounds());
            metrics.recordDemandStateSource(result.demandStateSource().name());
            if (result.forcedProgression()) {
                metrics.incrementForcedProgressions();
            }
            eventBus.publish(MiningEvent.of(MiningEvent.COMPLETED, sessionId, taskId,
                    Map.of("demandState", result.demandState().name(), "processingTimeMs", elapsed)));
        } else {
            eventBus.publish(MiningEvent.of(MiningEvent.PAUSED, sessionId, taskId,
                    Map.of("feedbackType", result.feedbackType() == null ? "none" : result.feedbackType().value())));
        }
        log.info("Session {} returned with status {} in {}ms", sessionId, result.status(), elapsed);
        return result;
    }

    private Optional<MiningSnapshot> loadSnapshot(String sessionId) {
        try {
            return checkpointStore.load(sessionId);
        } catch (CheckpointCorruptedException e) {
            log.error("Checkpoint for session {} cannot be read: {}", sessionId, e.getMessage());
            throw new SessionNotFoundException(sessionId, "Checkpoint for session " + sessionId + " is corrupt", e);
        }
    }

    private MiningContext normalize(MiningContext context) {
        MiningContext effective = context != null ? context : MiningContext.of(null);
        if (effective.sessionId() == null || effective.sessionId().isBlank()) {
            effective = effective.withSessionId(generateSessionId());
        }
        if (effective.taskId() == null || effective.taskId().isBlank()) {
            effective = effective.withTaskId(effective.sessionId() + "-task");
        }
        if (effective.timestamp() == null) {
            effective = effective.withTimestamp(Instant.now());
        }
        return effective;
    }
}
