package com.phillippitts.callqa.service.cluster;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.ToDoubleBiFunction;

/**
 * Single-pass greedy clustering with a fixed decision threshold.
 *
 * <p>Items are processed in input order. Each item is compared against the <b>first member</b> of
 * every existing cluster, in cluster-creation order, and joins the <b>first</b> cluster whose score is
 * {@code >= threshold}; otherwise it opens a new singleton cluster. Clusters are never re-evaluated or
 * merged. Cost is O(n·k) for k clusters.
 *
 * <p>Because assignment is first-match and similarity is not transitive, membership can change when
 * the input is permuted. Identical input order always yields identical clusters.
 */
public final class GreedyClusterer {

    public static final double DEFAULT_THRESHOLD = 0.30;

    private static final Logger LOG = LogManager.getLogger(GreedyClusterer.class);

    private final double threshold;

    /**
     * Creates a clusterer with the given threshold.
     *
     * @param threshold minimum combined similarity to join a cluster (0.0 to 1.0)
     * @throws IllegalArgumentException if threshold is not in [0,1]
     */
    public GreedyClusterer(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold in [0,1]");
        }
        this.threshold = threshold;
    }

    public GreedyClusterer() {
        this(DEFAULT_THRESHOLD);
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * Clusters items without partitioning.
     *
     * @param items      items in input order (null treated as empty; null elements skipped)
     * @param similarity pairwise score in [0,1]
     * @return clusters in creation order, members in input order
     */
    public <T> List<List<T>> cluster(List<T> items, ToDoubleBiFunction<T, T> similarity) {
        Objects.requireNonNull(similarity, "similarity");
        List<List<T>> clusters = new ArrayList<>();
        if (items == null) {
            return clusters;
        }
        for (T item : items) {
            if (item == null) {
                continue;
            }
            List<T> home = null;
            for (List<T> cluster : clusters) {
                double score = similarity.applyAsDouble(item, cluster.get(0));
                if (score >= threshold) {
                    home = cluster;
                    break;
                }
            }
            if (home == null) {
                home = new ArrayList<>();
                clusters.add(home);
            }
            home.add(item);
        }
        LOG.debug("Clustered {} items into {} clusters (threshold={})", items.size(), clusters.size(), threshold);
        return clusters;
    }

    /**
     * Partitions items by an exact key, then clusters each partition independently.
     *
     * @param items        items in input order
     * @param partitionKey hard partition key (items with different keys are never compared)
     * @param similarity   pairwise score in [0,1]
     * @return partitions in first-seen key order, each with its clusters in creation order
     */
    public <T, K> Map<K, List<List<T>>> clusterPartitioned(List<T> items, Function<T, K> partitionKey,
                                                           ToDoubleBiFunction<T, T> similarity) {
        Objects.requireNonNull(partitionKey, "partitionKey");
        Map<K, List<T>> partitions = new LinkedHashMap<>();
        if (items != null) {
            for (T item : items) {
                if (item != null) {
                    partitions.computeIfAbsent(partitionKey.apply(item), k -> new ArrayList<>()).add(item);
                }
            }
        }
        Map<K, List<List<T>>> result = new LinkedHashMap<>();
        partitions.forEach((key, members) -> result.put(key, cluster(members, similarity)));
        return result;
    }

    /**
     * Partitioned clustering flattened to a single list (partition order, then creation order).
     */
    public <T, K> List<List<T>> cluster(List<T> items, Function<T, K> partitionKey,
                                        ToDoubleBiFunction<T, T> similarity) {
        List<List<T>> flat = new ArrayList<>();
        clusterPartitioned(items, partitionKey, similarity).values().forEach(flat::addAll);
        return flat;
    }
}
