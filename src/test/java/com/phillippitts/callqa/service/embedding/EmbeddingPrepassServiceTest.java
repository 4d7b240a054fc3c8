package com.phillippitts.callqa.service.embedding;

import com.phillippitts.callqa.config.properties.EmbeddingProperties;
import com.phillippitts.callqa.exception.EmbeddingException;
import com.phillippitts.callqa.service.cluster.AggregationProfile;
import com.phillippitts.callqa.service.metrics.AggregationMetrics;
import com.phillippitts.callqa.testutil.SyncExecutor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.callqa.testutil.Findings.issue;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmbeddingPrepassServiceTest {

    private static final float[] V = {0.1f, 0.2f, 0.3f};

    private EmbeddingProvider provider;
    private SimpleMeterRegistry registry;
    private EmbeddingProperties props;

    @BeforeEach
    void setUp() {
        provider = mock(EmbeddingProvider.class);
        when(provider.isEnabled()).thenReturn(true);
        when(provider.getProviderName()).thenReturn("test");
        registry = new SimpleMeterRegistry();
        // batch size 2, no delays, 3 attempts
        props = new EmbeddingProperties(true, 2, 0L, 3, 0L, 2_000L, null, null);
    }

    private EmbeddingPrepassService service(Executor executor) {
        return new EmbeddingPrepassService(provider, props, executor, new AggregationMetrics(registry));
    }

    @Test
    void deduplicatesAndBatchesKeys() {
        when(provider.embedAll(List.of("a", "b"))).thenReturn(Map.of("a", V, "b", V));
        when(provider.embedAll(List.of("c"))).thenReturn(Map.of("c", V));

        EmbeddingIndex index = service(new SyncExecutor()).embed(List.of("a", "b", "a", "", "c"), 0);

        assertThat(index.keys()).containsExactlyInAnyOrder("a", "b", "c");
        verify(provider).embedAll(List.of("a", "b"));
        verify(provider).embedAll(List.of("c"));
        assertThat(counter("success").count()).isEqualTo(2.0);
    }

    @Test
    void retriesFailingBatch() {
        when(provider.embedAll(List.of("a", "b")))
                .thenThrow(new EmbeddingException("rate limited", "test", 2))
                .thenReturn(Map.of("a", V, "b", V));

        EmbeddingIndex index = service(new SyncExecutor()).embed(List.of("a", "b"), 0);

        assertThat(index.size()).isEqualTo(2);
        verify(provider, times(2)).embedAll(List.of("a", "b"));
        assertThat(counter("retried").count()).isEqualTo(1.0);
    }

    @Test
    void fallsBackToPerKeyCallsAndOmitsOnlyFailingKeys() {
        when(provider.embedAll(anyList())).thenThrow(new EmbeddingException("boom", "test", 2));
        when(provider.embed("a")).thenReturn(V);
        when(provider.embed("b")).thenThrow(new EmbeddingException("bad input", "test", 1));

        EmbeddingIndex index = service(new SyncExecutor()).embed(List.of("a", "b"), 0);

        assertThat(index.keys()).containsExactly("a");
        verify(provider, times(3)).embedAll(List.of("a", "b"));
        assertThat(counter("failed").count()).isEqualTo(1.0);
        assertThat(registry.find("callqa.embedding.omitted").counter().count()).isEqualTo(1.0);
    }

    @Test
    void disabledProviderYieldsEmptyIndexWithoutCalls() {
        when(provider.isEnabled()).thenReturn(false);

        EmbeddingIndex index = service(new SyncExecutor()).embed(List.of("a"), 0);

        assertThat(index.isEmpty()).isTrue();
        verify(provider, never()).embedAll(anyList());
        verify(provider, never()).embed(anyString());
    }

    @Test
    void cancelledFutureStopsBeforeNextBatch() {
        List<Runnable> queued = new ArrayList<>();
        CompletableFuture<EmbeddingIndex> future = service(queued::add).embedAsync(List.of("a", "b", "c"));

        future.cancel(true);
        queued.forEach(Runnable::run);

        assertThat(future.isCancelled()).isTrue();
        verify(provider, never()).embedAll(anyList());
    }

    @Test
    void asyncCompletesWithIndex() throws Exception {
        when(provider.embedAll(List.of("a"))).thenReturn(Map.of("a", V));

        EmbeddingIndex index = service(new SyncExecutor()).embedAsync(List.of("a")).get(1, TimeUnit.SECONDS);

        assertThat(index.vectorFor("a")).containsExactly(V);
    }

    @Test
    void timeoutReturnsVectorsCompletedSoFar() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(provider.embedAll(List.of("a", "b"))).thenReturn(Map.of("a", V, "b", V));
        when(provider.embedAll(List.of("c"))).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return Map.of("c", V);
        });
        Executor threaded = r -> new Thread(r, "embedding-test").start();

        try {
            EmbeddingIndex index = service(threaded).embed(List.of("a", "b", "c"), 500);

            assertThat(index.keys()).containsExactlyInAnyOrder("a", "b");
        } finally {
            release.countDown();
        }
    }

    @Test
    void deadlineStopsBatchesWhenWorkRunsOnCallingThread() {
        when(provider.embedAll(anyList())).thenAnswer(inv -> {
            Thread.sleep(300);
            List<String> batch = inv.getArgument(0);
            return Map.of(batch.get(0), V, batch.get(1), V);
        });

        EmbeddingIndex index = service(new SyncExecutor()).embed(List.of("a", "b", "c", "d", "e", "f"), 100);

        assertThat(index.keys()).containsExactlyInAnyOrder("a", "b");
        verify(provider, times(1)).embedAll(anyList());
    }

    @Test
    void embedLabelsUsesProfileLabels() {
        when(provider.embedAll(List.of("quality_issue", "flow_deviation")))
                .thenReturn(Map.of("quality_issue", V, "flow_deviation", V));

        EmbeddingIndex index = service(new SyncExecutor()).embedLabels(List.of(
                issue("1", "c1", "quality_issue", "x"),
                issue("2", "c2", "flow_deviation", "y"),
                issue("3", "c3", "quality_issue", "z")), AggregationProfile.issues());

        assertThat(index.keys()).containsExactlyInAnyOrder("quality_issue", "flow_deviation");
    }

    private Counter counter(String outcome) {
        return registry.find("callqa.embedding.batches").tag("outcome", outcome).counter();
    }
}
