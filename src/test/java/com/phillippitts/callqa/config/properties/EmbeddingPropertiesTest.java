package com.phillippitts.callqa.config.properties;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingPropertiesTest {

    @Test
    void defaultsAreDisabledWithBatchOfFifty() {
        EmbeddingProperties p = EmbeddingProperties.defaults();

        assertThat(p.isEnabled()).isFalse();
        assertThat(p.getBatchSize()).isEqualTo(50);
        assertThat(p.getBatchDelayMs()).isEqualTo(200);
        assertThat(p.getMaxAttempts()).isEqualTo(3);
        assertThat(p.getRetryBackoffMs()).isEqualTo(500);
        assertThat(p.getTimeoutMs()).isEqualTo(30_000);
        assertThat(p.getModelName()).isEqualTo("text-embedding-3-small");
        assertThat(p.getApiKey()).isEmpty();
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> new EmbeddingProperties(true, 0, null, null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("batch-size");
        assertThatThrownBy(() -> new EmbeddingProperties(true, null, -1L, null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("batch-delay-ms");
        assertThatThrownBy(() -> new EmbeddingProperties(true, null, null, 0, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-attempts");
        assertThatThrownBy(() -> new EmbeddingProperties(true, null, null, null, null, 0L, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timeout-ms");
    }
}
