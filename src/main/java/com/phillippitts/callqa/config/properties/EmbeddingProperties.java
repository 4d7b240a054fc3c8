package com.phillippitts.callqa.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the optional embedding pre-pass.
 *
 * <p>When {@code enabled} is false a no-op provider is wired and aggregation runs on the
 * structured and token signals only.
 */
@Validated
@ConfigurationProperties(prefix = "aggregation.embedding")
public class EmbeddingProperties {

    private final boolean enabled;

    @Min(1)
    private final int batchSize;

    /** Pause between consecutive batches, in milliseconds. */
    @Min(0)
    private final long batchDelayMs;

    @Min(1)
    private final int maxAttempts;

    /** Base backoff; attempt N waits N times this value. */
    @Min(0)
    private final long retryBackoffMs;

    /** Budget for the blocking pre-pass variant. */
    @Min(1)
    private final long timeoutMs;

    private final String modelName;
    private final String apiKey;

    @ConstructorBinding
    public EmbeddingProperties(Boolean enabled, Integer batchSize, Long batchDelayMs, Integer maxAttempts,
                               Long retryBackoffMs, Long timeoutMs, String modelName, String apiKey) {
        this.enabled = enabled != null && enabled;
        this.batchSize = positive(batchSize == null ? 50 : batchSize, "batch-size");
        this.batchDelayMs = nonNegative(batchDelayMs == null ? 200L : batchDelayMs, "batch-delay-ms");
        this.maxAttempts = positive(maxAttempts == null ? 3 : maxAttempts, "max-attempts");
        this.retryBackoffMs = nonNegative(retryBackoffMs == null ? 500L : retryBackoffMs, "retry-backoff-ms");
        long t = timeoutMs == null ? 30_000L : timeoutMs;
        if (t <= 0) {
            throw new IllegalArgumentException("aggregation.embedding.timeout-ms must be > 0");
        }
        this.timeoutMs = t;
        this.modelName = modelName == null || modelName.isBlank() ? "text-embedding-3-small" : modelName;
        this.apiKey = apiKey == null ? "" : apiKey;
    }

    /** Defaults with the pre-pass disabled. */
    public static EmbeddingProperties defaults() {
        return new EmbeddingProperties(null, null, null, null, null, null, null, null);
    }

    private static int positive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException("aggregation.embedding." + name + " must be > 0");
        }
        return value;
    }

    private static long nonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException("aggregation.embedding." + name + " must be >= 0");
        }
        return value;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public long getBatchDelayMs() {
        return batchDelayMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public String getModelName() {
        return modelName;
    }

    public String getApiKey() {
        return apiKey;
    }
}
