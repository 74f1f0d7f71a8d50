package com.reqminer.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralised Micrometer metrics for requirement mining.
 * <p>
 * Besides the registry meters it keeps in-process totals for {@link #serviceMetrics()}.
 */
@Service
public class MiningMetrics {

    private final MeterRegistry registry;

    private final AtomicLong totalOperations = new AtomicLong();
    private final AtomicLong successfulOperations = new AtomicLong();
    private final AtomicLong finishedSessions = new AtomicLong();
    private final AtomicLong clarificationRoundSum = new AtomicLong();

    public MiningMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the outcome of one engine call. Paused and completed calls count as successful.
     */
    public void recordSessionResult(String status, long ms) {
        Counter.builder("reqminer.sessions.total")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("reqminer.processing.duration")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));

        totalOperations.incrementAndGet();
        if (!"ERROR".equals(status)) {
            successfulOperations.incrementAndGet();
        }
    }

    public void recordClarificationRounds(int rounds) {
        DistributionSummary.builder("reqminer.clarification.rounds")
                .description("Clarification rounds used by completed sessions")
                .register(registry)
                .record(rounds);
        finishedSessions.incrementAndGet();
        clarificationRoundSum.addAndGet(rounds);
    }

    public void recordDemandStateSource(String source) {
        Counter.builder("reqminer.demand_state.source")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void incrementForcedProgressions() {
        Counter.builder("reqminer.clarification.forced")
                .description("Sessions forced past the clarification round limit")
                .register(registry)
                .increment();
    }

    public void recordResume(String feedbackType) {
        Counter.builder("reqminer.resumes.total")
                .tag("feedback_type", feedbackType)
                .register(registry)
                .increment();
    }

    public ServiceMetrics serviceMetrics() {
        long total = totalOperations.get();
        long successful = successfulOperations.get();
        long finished = finishedSessions.get();
        double successRate = total == 0 ? 0.0 : (double) successful / total;
        double averageRounds = finished == 0 ? 0.0 : (double) clarificationRoundSum.get() / finished;
        return new ServiceMetrics(total, successful, successRate, averageRounds);
    }

    /**
     * Totals since startup.
     *
     * @param totalOperations              engine calls made
     * @param successfulOperations         engine calls that did not fail
     * @param successRate                  successful over total, 0 when nothing ran
     * @param averageClarificationRounds   mean rounds over completed sessions
     */
    public record ServiceMetrics(
        long totalOperations,
        long successfulOperations,
        double successRate,
        double averageClarificationRounds
    ) {}
}
