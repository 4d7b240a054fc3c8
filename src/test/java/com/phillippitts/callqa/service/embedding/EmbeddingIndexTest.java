package com.phillippitts.callqa.service.embedding;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EmbeddingIndexTest {

    @Test
    void dropsBlankKeysAndEmptyVectors() {
        Map<String, float[]> raw = new HashMap<>();
        raw.put("ok", new float[]{1f});
        raw.put(" ", new float[]{1f});
        raw.put("empty", new float[0]);
        raw.put("null", null);

        EmbeddingIndex index = EmbeddingIndex.of(raw);

        assertThat(index.keys()).containsExactly("ok");
        assertThat(index.contains("empty")).isFalse();
        assertThat(index.vectorFor("missing")).isNull();
        assertThat(index.vectorFor(null)).isNull();
    }

    @Test
    void copiesVectors() {
        float[] v = {1f, 2f};
        EmbeddingIndex index = EmbeddingIndex.of(Map.of("k", v));

        v[0] = 9f;

        assertThat(index.vectorFor("k")).containsExactly(1f, 2f);
    }

    @Test
    void returnedVectorCannotChangeIndex() {
        EmbeddingIndex index = EmbeddingIndex.of(Map.of("k", new float[]{1f, 2f}));

        index.vectorFor("k")[0] = 9f;

        assertThat(index.vectorFor("k")).containsExactly(1f, 2f);
    }

    @Test
    void emptyIndex() {
        assertThat(EmbeddingIndex.of(null).isEmpty()).isTrue();
        assertThat(EmbeddingIndex.empty().size()).isZero();
    }
}
