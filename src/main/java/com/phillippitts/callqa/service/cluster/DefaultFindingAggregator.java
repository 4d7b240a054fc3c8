package com.phillippitts.callqa.service.cluster;

import com.phillippitts.callqa.domain.Finding;
import com.phillippitts.callqa.domain.FindingCluster;
import com.phillippitts.callqa.service.embedding.EmbeddingIndex;
import com.phillippitts.callqa.service.metrics.AggregationMetrics;
import com.phillippitts.callqa.service.similarity.TextFeatures;
import com.phillippitts.callqa.service.similarity.TextSimilarityScorer;
import com.phillippitts.callqa.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Default aggregation pipeline: features → greedy clustering → summarization → ordering.
 *
 * <p>Features (entities, action-objects, tokens, embedding) are computed once per finding from the
 * profile's canonical text, so each pairwise comparison only combines precomputed sets.
 * The call runs synchronously on the caller's thread; {@code aggregationId} and {@code profile} are
 * put in the Log4j2 ThreadContext for its duration.
 */
@Service
public class DefaultFindingAggregator implements FindingAggregator {

    private static final Logger LOG = LogManager.getLogger(DefaultFindingAggregator.class);
    private static final int LOG_PREVIEW_CHARS = 60;

    private final TextSimilarityScorer scorer;
    private final GreedyClusterer clusterer;
    private final ClusterSummarizer summarizer;
    private final AggregationMetrics metrics;

    public DefaultFindingAggregator(TextSimilarityScorer scorer, GreedyClusterer clusterer,
                                    ClusterSummarizer summarizer, AggregationMetrics metrics) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.clusterer = Objects.requireNonNull(clusterer, "clusterer");
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public List<FindingCluster> aggregate(List<Finding> findings, AggregationProfile profile,
                                          EmbeddingIndex embeddings) {
        Objects.requireNonNull(profile, "profile");
        long t0 = System.nanoTime();
        ThreadContext.put("aggregationId", UUID.randomUUID().toString().substring(0, 8));
        ThreadContext.put("profile", profile.name());
        try {
            Map<PartitionKey, List<List<Entry>>> partitions = clusterEntries(findings, profile, embeddings);

            List<FindingCluster> result = new ArrayList<>();
            int globalIndex = 0;
            for (Map.Entry<PartitionKey, List<List<Entry>>> partition : partitions.entrySet()) {
                int partitionIndex = 0;
                for (List<Entry> cluster : partition.getValue()) {
                    result.add(summarizer.summarize(members(cluster), profile, partition.getKey(),
                            partitionIndex++, globalIndex++));
                }
            }
            result.sort(profile.ordering().comparator());

            int inputCount = result.stream().mapToInt(FindingCluster::size).sum();
            long elapsed = System.nanoTime() - t0;
            metrics.recordAggregation(profile.name(), elapsed, inputCount, result.size());
            LOG.info("Aggregated {} findings into {} clusters across {} partitions in {} ms (embeddings={})",
                    inputCount, result.size(), partitions.size(), elapsed / 1_000_000L,
                    embeddings == null ? 0 : embeddings.size());
            return result;
        } finally {
            ThreadContext.remove("aggregationId");
            ThreadContext.remove("profile");
        }
    }

    @Override
    public List<List<Finding>> cluster(List<Finding> findings, AggregationProfile profile,
                                       EmbeddingIndex embeddings) {
        Objects.requireNonNull(profile, "profile");
        List<List<Finding>> out = new ArrayList<>();
        clusterEntries(findings, profile, embeddings).values()
                .forEach(clusters -> clusters.forEach(c -> out.add(members(c))));
        return out;
    }

    private Map<PartitionKey, List<List<Entry>>> clusterEntries(List<Finding> findings, AggregationProfile profile,
                                                                EmbeddingIndex embeddings) {
        EmbeddingIndex index = embeddings == null ? EmbeddingIndex.empty() : embeddings;
        List<Entry> entries = new ArrayList<>();
        if (findings != null) {
            for (Finding f : findings) {
                if (f == null) {
                    LOG.warn("Skipping null finding in aggregation input");
                    continue;
                }
                String text = profile.canonicalText().apply(f);
                TextFeatures features = scorer.features(text, profile.label().apply(f), index);
                if (LOG.isDebugEnabled() && features.entities().isEmpty() && features.actions().isEmpty()) {
                    LOG.debug("Finding {} has no entity or action tags: \"{}\"", f.id(),
                            LogSanitizer.preview(text, LOG_PREVIEW_CHARS));
                }
                entries.add(new Entry(f, features));
            }
        }
        return clusterer.clusterPartitioned(entries,
                e -> profile.partitionKey().apply(e.finding()),
                (a, b) -> scorer.score(a.features(), b.features()));
    }

    private static List<Finding> members(List<Entry> cluster) {
        List<Finding> members = new ArrayList<>(cluster.size());
        for (Entry e : cluster) {
            members.add(e.finding());
        }
        return members;
    }

    private record Entry(Finding finding, TextFeatures features) {
    }
}
