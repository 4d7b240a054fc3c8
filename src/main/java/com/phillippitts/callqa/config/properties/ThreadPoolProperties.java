package com.phillippitts.callqa.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Sizes the executor that runs the embedding pre-pass. Each pre-pass is a single sequential
 * task, so the pool only needs to cover concurrent aggregation requests.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private EmbeddingPoolProperties embedding = new EmbeddingPoolProperties();

    public EmbeddingPoolProperties getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingPoolProperties embedding) {
        this.embedding = embedding;
    }

    /**
     * Embedding executor pool configuration.
     */
    public static class EmbeddingPoolProperties {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 20;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "embedding-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
