/**
 * Domain models for finding aggregation.
 *
 * <p>All types here are immutable records or enums with no framework dependencies:
 * <ul>
 *   <li>{@link com.phillippitts.callqa.domain.Finding} - one detected issue or scenario on one call</li>
 *   <li>{@link com.phillippitts.callqa.domain.Severity} - totally ordered severity with a rank-0 fallback</li>
 *   <li>{@link com.phillippitts.callqa.domain.FindingCluster} - aggregate of similar findings</li>
 *   <li>{@link com.phillippitts.callqa.domain.AggregationSummary} - totals over a result set</li>
 * </ul>
 *
 * <p>Findings are created upstream and passed in read-only; clusters are rebuilt on every
 * aggregation call and never persisted here.
 */
package com.phillippitts.callqa.domain;
