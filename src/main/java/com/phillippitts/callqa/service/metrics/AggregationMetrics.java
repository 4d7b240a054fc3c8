package com.phillippitts.callqa.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for finding aggregation and the embedding pre-pass.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Aggregation latency, input findings and output clusters per profile</li>
 *   <li>Embedding batch outcomes (success, retried, failed)</li>
 *   <li>Embedding keys omitted from the resulting index</li>
 * </ul>
 */
@Component
public class AggregationMetrics {

    private static final String AGGREGATION_PREFIX = "callqa.aggregation";
    private static final String EMBEDDING_PREFIX = "callqa.embedding";

    private final MeterRegistry registry;

    public AggregationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one aggregation call.
     *
     * @param profile       profile name (issues, custom-audits, scenarios)
     * @param durationNanos duration in nanoseconds
     * @param findings      input finding count
     * @param clusters      output cluster count
     */
    public void recordAggregation(String profile, long durationNanos, int findings, int clusters) {
        Timer.builder(AGGREGATION_PREFIX + ".latency")
                .description("Time taken to aggregate findings")
                .tag("profile", profile)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(AGGREGATION_PREFIX + ".findings")
                .description("Findings submitted for aggregation")
                .tag("profile", profile)
                .register(registry)
                .increment(findings);
        Counter.builder(AGGREGATION_PREFIX + ".clusters")
                .description("Clusters produced by aggregation")
                .tag("profile", profile)
                .register(registry)
                .increment(clusters);
    }

    /**
     * Records the outcome of one embedding batch.
     *
     * @param outcome success, retried or failed
     */
    public void recordEmbeddingBatch(String outcome) {
        Counter.builder(EMBEDDING_PREFIX + ".batches")
                .description("Embedding batches by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records keys left out of the embedding index after all attempts failed.
     */
    public void recordOmittedKeys(int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(EMBEDDING_PREFIX + ".omitted")
                .description("Embedding keys omitted after provider failures")
                .register(registry)
                .increment(count);
    }
}
