package com.phillippitts.callqa.domain;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Headline numbers over an aggregation result.
 *
 * @param totalFindings        findings across all clusters
 * @param totalGroups          number of clusters
 * @param avgFindingsPerGroup  findings per cluster, rounded half-up (0 when there are no clusters)
 * @param totalCalls           distinct calls touched by any cluster
 */
public record AggregationSummary(int totalFindings, int totalGroups, int avgFindingsPerGroup, int totalCalls) {

    public static AggregationSummary of(List<FindingCluster> clusters) {
        if (clusters == null || clusters.isEmpty()) {
            return new AggregationSummary(0, 0, 0, 0);
        }
        int findings = 0;
        Set<String> calls = new HashSet<>();
        for (FindingCluster c : clusters) {
            findings += c.size();
            calls.addAll(c.affectedCallIds());
        }
        int avg = (int) Math.round(findings / (double) clusters.size());
        return new AggregationSummary(findings, clusters.size(), avg, calls.size());
    }
}
