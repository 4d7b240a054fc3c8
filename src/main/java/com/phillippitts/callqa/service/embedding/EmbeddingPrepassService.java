package com.phillippitts.callqa.service.embedding;

import com.phillippitts.callqa.config.properties.EmbeddingProperties;
import com.phillippitts.callqa.domain.Finding;
import com.phillippitts.callqa.service.cluster.AggregationProfile;
import com.phillippitts.callqa.service.metrics.AggregationMetrics;
import com.phillippitts.callqa.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Computes embeddings for distinct finding labels before aggregation.
 *
 * <p><b>Batching:</b> keys are de-duplicated (first occurrence order) and sent in batches of
 * {@code aggregation.embedding.batch-size}, with {@code batch-delay-ms} between batches.
 *
 * <p><b>Error Handling:</b> a failing batch is retried up to {@code max-attempts} times with linear
 * backoff ({@code attempt * retry-backoff-ms}). If it still fails, each key of the batch is embedded on
 * its own so that only the keys that keep failing are omitted. Nothing is thrown to the caller; the
 * returned index may be partial and aggregation treats missing keys as "no embedding".
 *
 * <p><b>Thread Model:</b> the work runs as one sequential task on {@code embeddingExecutor}. The async
 * variant can be cancelled and the blocking variant carries its deadline into the task; both are observed
 * between batches. A saturated pool runs the task on the calling thread, where only the deadline check
 * can stop it.
 */
@Service
public class EmbeddingPrepassService {

    private static final Logger LOG = LogManager.getLogger(EmbeddingPrepassService.class);
    private static final int LOG_PREVIEW_CHARS = 60;

    private final EmbeddingProvider provider;
    private final EmbeddingProperties properties;
    private final Executor executor;
    private final AggregationMetrics metrics;

    public EmbeddingPrepassService(EmbeddingProvider provider,
                                   EmbeddingProperties properties,
                                   @Qualifier("embeddingExecutor") Executor executor,
                                   AggregationMetrics metrics) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Starts the pre-pass asynchronously.
     *
     * @param keys texts to embed (nulls and blanks ignored, duplicates collapsed)
     * @return future completing with the (possibly partial) index; cancelling it stops further batches
     */
    public CompletableFuture<EmbeddingIndex> embedAsync(Collection<String> keys) {
        return start(distinct(keys), new ConcurrentHashMap<>(), () -> false);
    }

    /**
     * Runs the pre-pass and waits at most {@code timeoutMs}.
     *
     * @param keys      texts to embed
     * @param timeoutMs wait budget; values {@code <= 0} use {@code aggregation.embedding.timeout-ms}
     * @return every vector completed before the deadline
     */
    public EmbeddingIndex embed(Collection<String> keys, long timeoutMs) {
        long budget = timeoutMs > 0 ? timeoutMs : properties.getTimeoutMs();
        Map<String, float[]> sink = new ConcurrentHashMap<>();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(budget);
        CompletableFuture<EmbeddingIndex> future = start(distinct(keys), sink,
                () -> System.nanoTime() - deadline >= 0);
        try {
            return future.get(budget, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
            LOG.warn("Embedding pre-pass timed out after {} ms; continuing with {} vectors", budget, sink.size());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            LOG.warn("Embedding pre-pass interrupted; continuing with {} vectors", sink.size());
        } catch (ExecutionException ee) {
            LOG.warn("Embedding pre-pass failed; continuing with {} vectors", sink.size(), ee.getCause());
        }
        return EmbeddingIndex.of(new HashMap<>(sink));
    }

    /**
     * Embeds the labels the given profile uses as embedding keys, within the configured timeout.
     */
    public EmbeddingIndex embedLabels(List<Finding> findings, AggregationProfile profile) {
        Objects.requireNonNull(profile, "profile");
        if (findings == null || findings.isEmpty()) {
            return EmbeddingIndex.empty();
        }
        List<String> labels = new ArrayList<>(findings.size());
        for (Finding f : findings) {
            if (f != null) {
                labels.add(profile.label().apply(f));
            }
        }
        return embed(labels, properties.getTimeoutMs());
    }

    private CompletableFuture<EmbeddingIndex> start(List<String> keys, Map<String, float[]> sink,
                                                    BooleanSupplier expired) {
        if (keys.isEmpty() || !provider.isEnabled()) {
            return CompletableFuture.completedFuture(EmbeddingIndex.empty());
        }
        CompletableFuture<EmbeddingIndex> future = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                run(keys, sink, () -> future.isDone() || expired.getAsBoolean());
                future.complete(EmbeddingIndex.of(sink));
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    private void run(List<String> keys, Map<String, float[]> sink, BooleanSupplier stopped) {
        long t0 = System.nanoTime();
        int batchSize = properties.getBatchSize();
        for (int from = 0; from < keys.size(); from += batchSize) {
            if (stopped.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                LOG.info("Embedding pre-pass stopped after {} of {} keys", sink.size(), keys.size());
                return;
            }
            if (from > 0 && !pause(properties.getBatchDelayMs())) {
                return;
            }
            embedBatch(keys.subList(from, Math.min(from + batchSize, keys.size())), sink);
        }
        int omitted = keys.size() - sink.size();
        if (omitted > 0) {
            metrics.recordOmittedKeys(omitted);
            LOG.warn("Embedding pre-pass omitted {} of {} keys (provider={})", omitted, keys.size(),
                    provider.getProviderName());
        }
        LOG.debug("Embedded {} keys in {} ms", sink.size(), (System.nanoTime() - t0) / 1_000_000L);
    }

    private void embedBatch(List<String> batch, Map<String, float[]> sink) {
        int maxAttempts = properties.getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Map<String, float[]> vectors = provider.embedAll(batch);
                for (String key : batch) {
                    store(sink, key, vectors.get(key));
                }
                metrics.recordEmbeddingBatch(attempt == 1 ? "success" : "retried");
                return;
            } catch (RuntimeException e) {
                if (attempt < maxAttempts) {
                    long delay = attempt * properties.getRetryBackoffMs();
                    LOG.warn("Embedding batch of {} keys failed (attempt {}/{}): {}; retrying in {} ms",
                            batch.size(), attempt, maxAttempts, e.getMessage(), delay);
                    if (!pause(delay)) {
                        return;
                    }
                } else {
                    LOG.warn("Embedding batch of {} keys failed after {} attempts: {}; embedding keys one by one",
                            batch.size(), maxAttempts, e.getMessage());
                }
            }
        }
        metrics.recordEmbeddingBatch("failed");
        for (String key : batch) {
            try {
                store(sink, key, provider.embed(key));
            } catch (RuntimeException e) {
                LOG.warn("Omitting embedding for \"{}\": {}", LogSanitizer.preview(key, LOG_PREVIEW_CHARS),
                        e.getMessage());
            }
        }
    }

    private static void store(Map<String, float[]> sink, String key, float[] vector) {
        if (vector != null && vector.length > 0) {
            sink.put(key, vector);
        }
    }

    private static boolean pause(long ms) {
        if (ms <= 0) {
            return true;
        }
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static List<String> distinct(Collection<String> keys) {
        if (keys == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String k : keys) {
            if (k != null && !k.isBlank()) {
                unique.add(k);
            }
        }
        return new ArrayList<>(unique);
    }
}
