package com.phillippitts.callqa.service.cluster;

import com.phillippitts.callqa.domain.Finding;

import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Per-call-site configuration of the aggregation engine.
 *
 * <p>The similarity signals and the greedy clusterer are shared; a profile only decides what text is
 * compared, how findings are pre-partitioned and how clusters are labelled, counted and ordered.
 *
 * @param name               profile name used in logs and metrics
 * @param idPrefix           prefix for cluster ids
 * @param canonicalText      text fed to every similarity signal
 * @param label              representative label (also the embedding key)
 * @param partitionKey       hard pre-partition; {@link PartitionKey#NONE} for a single partition
 * @param occurrenceMode     what {@code occurrences} counts
 * @param ordering           result-set ordering
 * @param builtInLabels      labels the representative avoids when a custom label is available
 * @param prefixSourceChecks whether the pattern text is prefixed with the source check names
 */
public record AggregationProfile(
        String name,
        String idPrefix,
        Function<Finding, String> canonicalText,
        Function<Finding, String> label,
        Function<Finding, PartitionKey> partitionKey,
        OccurrenceMode occurrenceMode,
        ClusterOrdering ordering,
        Set<String> builtInLabels,
        boolean prefixSourceChecks
) {

    /** Issue types produced by the built-in checks. */
    public static final Set<String> BUILT_IN_ISSUE_TYPES = Set.of(
            "flow_deviation", "repetition_loop", "language_mismatch", "mid_call_restart", "quality_issue");

    /**
     * What a cluster's occurrence count measures.
     */
    public enum OccurrenceMode {
        /** Distinct calls among members. */
        UNIQUE_CALLS,
        /** Member findings. */
        MEMBERS
    }

    public AggregationProfile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(idPrefix, "idPrefix");
        Objects.requireNonNull(canonicalText, "canonicalText");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(partitionKey, "partitionKey");
        Objects.requireNonNull(occurrenceMode, "occurrenceMode");
        Objects.requireNonNull(ordering, "ordering");
        builtInLabels = builtInLabels == null ? Set.of() : Set.copyOf(builtInLabels);
    }

    /**
     * Standard issue aggregation: type + explanation, no partitioning, counted by calls.
     */
    public static AggregationProfile issues() {
        return new AggregationProfile("issues", "agg",
                f -> join(f.type(), f.title(), f.description()),
                Finding::type,
                f -> PartitionKey.NONE,
                OccurrenceMode.UNIQUE_CALLS,
                ClusterOrdering.OCCURRENCES_THEN_SEVERITY,
                Set.of(),
                false);
    }

    /**
     * Custom-audit aggregation: like {@link #issues()} but prefers custom type names as the
     * representative and prefixes the pattern text with the source check names.
     */
    public static AggregationProfile customAudits() {
        return new AggregationProfile("custom-audits", "custom-agg",
                f -> join(f.type(), f.title(), f.description()),
                Finding::type,
                f -> PartitionKey.NONE,
                OccurrenceMode.UNIQUE_CALLS,
                ClusterOrdering.OCCURRENCES_THEN_SEVERITY,
                BUILT_IN_ISSUE_TYPES,
                true);
    }

    /**
     * Scenario aggregation: title + what-happened, partitioned by (dimension, root cause),
     * counted by members and ordered by impact.
     */
    public static AggregationProfile scenarios() {
        return new AggregationProfile("scenarios", "agg",
                f -> join(f.title(), f.description()),
                Finding::title,
                f -> PartitionKey.of(f.dimension(), f.rootCauseType()),
                OccurrenceMode.MEMBERS,
                ClusterOrdering.IMPACT_THEN_UNIQUE_CALLS,
                Set.of(),
                false);
    }

    private static String join(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String p : parts) {
            if (p != null && !p.isBlank()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(p.trim());
            }
        }
        return sb.toString();
    }
}
