/**
 * Greedy clustering of findings and per-cluster summaries.
 *
 * <p>{@link com.phillippitts.callqa.service.cluster.FindingAggregator} is the entry point; an
 * {@link com.phillippitts.callqa.service.cluster.AggregationProfile} selects the canonical text, label,
 * partitioning, occurrence counting and ordering for each kind of finding.
 */
package com.phillippitts.callqa.service.cluster;
