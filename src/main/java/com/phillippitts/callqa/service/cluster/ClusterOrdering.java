package com.phillippitts.callqa.service.cluster;

import com.phillippitts.callqa.domain.FindingCluster;

import java.util.Comparator;

/**
 * Result-set orderings. Both are applied with a stable sort, so clusters that tie on every key keep
 * their creation order.
 */
public enum ClusterOrdering {

    /** Occurrences descending, then severity descending (issue aggregation). */
    OCCURRENCES_THEN_SEVERITY(Comparator
            .comparingInt(FindingCluster::occurrences).reversed()
            .thenComparing(Comparator.comparingInt((FindingCluster c) -> c.severity().rank()).reversed())),

    /** Occurrences × severity weight descending, then unique calls descending (scenario aggregation). */
    IMPACT_THEN_UNIQUE_CALLS(Comparator
            .comparingInt(FindingCluster::impact).reversed()
            .thenComparing(Comparator.comparingInt(FindingCluster::uniqueCalls).reversed()));

    private final Comparator<FindingCluster> comparator;

    ClusterOrdering(Comparator<FindingCluster> comparator) {
        this.comparator = comparator;
    }

    public Comparator<FindingCluster> comparator() {
        return comparator;
    }
}
