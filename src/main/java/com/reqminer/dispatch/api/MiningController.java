package com.reqminer.dispatch.api;

import com.reqminer.core.engine.MiningEngine;
import com.reqminer.core.metrics.MiningMetrics;
import com.reqminer.core.model.FeedbackPayload;
import com.reqminer.core.model.MiningContext;
import com.reqminer.core.model.MiningResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

/**
 * REST controller for mining session operations. Calls run synchronously until
 * the session pauses for feedback or completes.
 */
@RestController
@RequestMapping("/api/v1/mining")
public class MiningController {

    private static final Logger log = LoggerFactory.getLogger(MiningController.class);

    private final MiningEngine miningEngine;
    private final MiningMetrics metrics;

    public MiningController(MiningEngine miningEngine, MiningMetrics metrics) {
        this.miningEngine = miningEngine;
        this.metrics = metrics;
    }

    /**
     * POST /api/v1/mining: start a session.
     */
    @PostMapping
    public ResponseEntity<MiningResult> mine(@RequestBody MineRequest request) {
        var context = new MiningContext(request.sessionId(), request.taskId(), request.domain(),
                request.userId(), Instant.now(), 0);
        MiningResult result = miningEngine.mineRequirements(request.input(), context);
        log.info("Session {} started, status {}", result.sessionId(), result.status());
        return ResponseEntity.ok(result);
    }

    /**
     * POST /api/v1/mining/{sessionId}/feedback: resume a paused session.
     * An empty body returns the checkpointed result unchanged.
     */
    @PostMapping("/{sessionId}/feedback")
    public ResponseEntity<MiningResult> feedback(@PathVariable String sessionId,
                                                 @RequestBody(required = false) FeedbackRequest request) {
        FeedbackPayload payload = request == null ? null : request.toPayload();
        return ResponseEntity.ok(miningEngine.resumeWorkflow(sessionId, payload));
    }

    /**
     * GET /api/v1/mining/{sessionId}: inspect the checkpointed state.
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<MiningResult> get(@PathVariable String sessionId) {
        return miningEngine.findSession(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * DELETE /api/v1/mining/{sessionId}: discard the checkpoint.
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> discard(@PathVariable String sessionId) {
        return miningEngine.discardSession(sessionId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    /**
     * GET /api/v1/mining/metrics: totals since startup.
     */
    @GetMapping("/metrics")
    public ResponseEntity<MiningMetrics.ServiceMetrics> serviceMetrics() {
        return ResponseEntity.ok(metrics.serviceMetrics());
    }
}
