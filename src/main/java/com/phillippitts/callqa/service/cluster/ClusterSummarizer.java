package com.phillippitts.callqa.service.cluster;

import com.phillippitts.callqa.domain.Finding;
import com.phillippitts.callqa.domain.FindingCluster;
import com.phillippitts.callqa.domain.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a cluster of findings into a {@link FindingCluster} record.
 *
 * <ul>
 *   <li>representative: most frequent label, ties to the first seen; custom labels preferred over
 *       the profile's built-in labels when any are present</li>
 *   <li>severity: highest rank among members, never lower than {@link Severity#LOW}</li>
 *   <li>average confidence: arithmetic mean rounded half-up ({@link Math#round(double)})</li>
 *   <li>affected calls: distinct call ids in first-occurrence order</li>
 *   <li>pattern text: the single distinct description verbatim, otherwise an
 *       "N patterns across M calls" summary (prefixed with the distinct label count when several
 *       labels were merged)</li>
 * </ul>
 */
public final class ClusterSummarizer {

    public static final int DEFAULT_EVIDENCE_SAMPLE_SIZE = 3;

    private final int evidenceSampleSize;

    public ClusterSummarizer(int evidenceSampleSize) {
        if (evidenceSampleSize < 1) {
            throw new IllegalArgumentException("evidenceSampleSize must be >= 1");
        }
        this.evidenceSampleSize = evidenceSampleSize;
    }

    public ClusterSummarizer() {
        this(DEFAULT_EVIDENCE_SAMPLE_SIZE);
    }

    /**
     * Summarizes an issue cluster as the first (index 0) cluster of the issues profile.
     */
    public FindingCluster summarize(List<Finding> members) {
        return summarize(members, AggregationProfile.issues(), PartitionKey.NONE, 0, 0);
    }

    /**
     * Summarizes one cluster.
     *
     * @param members        cluster members in input order
     * @param profile        aggregation profile
     * @param partition      partition the cluster came from ({@link PartitionKey#NONE} if unpartitioned)
     * @param partitionIndex creation index within the partition
     * @param globalIndex    creation index across the whole result
     */
    public FindingCluster summarize(List<Finding> members, AggregationProfile profile, PartitionKey partition,
                                    int partitionIndex, int globalIndex) {
        List<Finding> safeMembers = members == null ? List.of() : members;
        boolean partitioned = partition != null && !PartitionKey.NONE.equals(partition);

        Map<String, Integer> labelCounts = new LinkedHashMap<>();
        Set<String> callIds = new LinkedHashSet<>();
        Set<String> descriptions = new LinkedHashSet<>();
        Set<String> evidence = new LinkedHashSet<>();
        Set<String> sourceChecks = new LinkedHashSet<>();
        Severity severity = Severity.UNKNOWN;
        long confidenceSum = 0;

        for (Finding f : safeMembers) {
            String label = profile.label().apply(f);
            if (label != null && !label.isBlank()) {
                labelCounts.merge(label, 1, Integer::sum);
            }
            callIds.add(f.callId());
            if (!f.description().isBlank()) {
                descriptions.add(f.description());
            }
            if (!f.evidenceSnippet().isBlank()) {
                evidence.add(f.evidenceSnippet());
            }
            if (!f.sourceCheckName().isBlank()) {
                sourceChecks.add(f.sourceCheckName());
            }
            severity = Severity.max(severity, f.severity());
            confidenceSum += f.confidence();
        }

        int avgConfidence = safeMembers.isEmpty() ? 0 : (int) Math.round(confidenceSum / (double) safeMembers.size());
        if (severity == Severity.UNKNOWN) {
            severity = Severity.LOW;
        }

        String pattern = patternText(descriptions, labelCounts.size(), callIds.size());
        if (profile.prefixSourceChecks() && !sourceChecks.isEmpty()) {
            pattern = "[" + String.join(", ", sourceChecks) + "] " + pattern;
        }

        int occurrences = profile.occurrenceMode() == AggregationProfile.OccurrenceMode.UNIQUE_CALLS
                ? callIds.size()
                : safeMembers.size();

        String id;
        String groupKey;
        if (partitioned) {
            id = profile.idPrefix() + "-" + partition + "-" + partitionIndex;
            groupKey = partition.dimension() + "-" + partition.rootCauseType() + "-" + partitionIndex;
        } else {
            id = profile.idPrefix() + "-" + globalIndex;
            groupKey = id;
        }

        return new FindingCluster(
                id,
                groupKey,
                representative(labelCounts, profile.builtInLabels()),
                partitioned ? partition.dimension() : "",
                partitioned && partition.hasRootCause() ? partition.rootCauseType() : "",
                pattern,
                severity,
                avgConfidence,
                occurrences,
                callIds.size(),
                new ArrayList<>(callIds),
                safeMembers,
                evidence.stream().limit(evidenceSampleSize).toList(),
                new ArrayList<>(sourceChecks),
                labelCounts.size());
    }

    static String representative(Map<String, Integer> labelCounts, Set<String> builtInLabels) {
        boolean hasCustom = labelCounts.keySet().stream().anyMatch(l -> !builtInLabels.contains(l));
        String best = "";
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : labelCounts.entrySet()) {
            if (hasCustom && builtInLabels.contains(e.getKey())) {
                continue;
            }
            // strict > keeps the first-seen label on ties
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    static String patternText(Set<String> descriptions, int distinctLabels, int calls) {
        if (descriptions.isEmpty()) {
            return "";
        }
        if (descriptions.size() == 1) {
            return descriptions.iterator().next();
        }
        String summary = descriptions.size() + " patterns across " + calls + (calls == 1 ? " call" : " calls");
        return distinctLabels > 1 ? distinctLabels + " similar types clustered: " + summary : summary;
    }
}
