package com.phillippitts.callqa.config;

import com.phillippitts.callqa.config.properties.EmbeddingProperties;
import com.phillippitts.callqa.service.embedding.EmbeddingProvider;
import com.phillippitts.callqa.service.embedding.LangChainEmbeddingProvider;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the embedding provider. OpenAI embeddings through LangChain4j when
 * {@code aggregation.embedding.enabled=true}, a no-op provider otherwise.
 */
@Configuration
public class EmbeddingConfig {

    @Bean
    @ConditionalOnProperty(prefix = "aggregation.embedding", name = "enabled", havingValue = "true")
    EmbeddingModel embeddingModel(EmbeddingProperties props) {
        if (props.getApiKey().isBlank()) {
            throw new IllegalStateException(
                    "aggregation.embedding.api-key is required when aggregation.embedding.enabled=true");
        }
        return OpenAiEmbeddingModel.builder()
                .apiKey(props.getApiKey())
                .modelName(props.getModelName())
                .timeout(Duration.ofMillis(props.getTimeoutMs()))
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "aggregation.embedding", name = "enabled", havingValue = "true")
    EmbeddingProvider langChainEmbeddingProvider(EmbeddingModel embeddingModel) {
        return new LangChainEmbeddingProvider(embeddingModel, "openai");
    }

    @Bean
    @ConditionalOnProperty(prefix = "aggregation.embedding", name = "enabled", havingValue = "false",
            matchIfMissing = true)
    EmbeddingProvider noopEmbeddingProvider() {
        return EmbeddingProvider.NOOP;
    }
}
