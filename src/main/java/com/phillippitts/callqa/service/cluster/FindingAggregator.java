package com.phillippitts.callqa.service.cluster;

import com.phillippitts.callqa.domain.Finding;
import com.phillippitts.callqa.domain.FindingCluster;
import com.phillippitts.callqa.service.embedding.EmbeddingIndex;

import java.util.List;

/**
 * Groups semantically duplicate findings into ordered, summarized clusters.
 *
 * <p><b>Contract:</b> total and side-effect free apart from logging and metrics. Every input finding
 * appears in exactly one returned cluster; empty input yields an empty list. Missing embeddings
 * degrade the similarity weighting and never cause a failure.
 *
 * <p><b>Thread Safety:</b> implementations keep no state between calls.
 */
public interface FindingAggregator {

    /**
     * Aggregates findings without embeddings.
     */
    default List<FindingCluster> aggregate(List<Finding> findings, AggregationProfile profile) {
        return aggregate(findings, profile, EmbeddingIndex.empty());
    }

    /**
     * Aggregates findings, using embeddings keyed by each finding's profile label where available.
     *
     * @param findings   findings in input order (null treated as empty)
     * @param profile    call-site profile
     * @param embeddings possibly partial embedding index (null treated as empty)
     * @return clusters sorted by the profile's ordering
     */
    List<FindingCluster> aggregate(List<Finding> findings, AggregationProfile profile, EmbeddingIndex embeddings);

    /**
     * Raw cluster assignment before summarization, partitions first, then creation order.
     */
    List<List<Finding>> cluster(List<Finding> findings, AggregationProfile profile, EmbeddingIndex embeddings);
}
