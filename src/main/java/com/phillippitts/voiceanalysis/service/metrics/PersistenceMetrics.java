package com.phillippitts.voiceanalysis.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the persistence pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Create latency and outcome (committed, rolled back, unresolved)</li>
 *   <li>Delete outcomes, including orphaned vault directories</li>
 *   <li>Prediction updates per channel</li>
 *   <li>Reconciliation repairs</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PersistenceMetrics {

    private static final String METRIC_PREFIX = "voiceanalysis.persistence";

    private final MeterRegistry registry;

    public PersistenceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records create latency and outcome.
     *
     * @param outcome committed, rolled_back, unresolved or rejected
     * @param durationNanos duration in nanoseconds
     */
    public void recordCreate(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".create")
                .description("Time taken to create an analysis with its audio artifact")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param outcome deleted, orphaned or missing
     */
    public void incrementDelete(String outcome) {
        Counter.builder(METRIC_PREFIX + ".delete")
                .description("Number of analysis deletions")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementPrediction(String channel) {
        Counter.builder(METRIC_PREFIX + ".prediction")
                .description("Number of prediction channel updates")
                .tag("channel", channel)
                .register(registry)
                .increment();
    }

    /**
     * @param kind commit, rollback or orphan
     */
    public void incrementReconciled(String kind) {
        Counter.builder(METRIC_PREFIX + ".reconciled")
                .description("Number of repairs made by reconciliation")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
