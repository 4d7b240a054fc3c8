/**
 * Spring configuration for the aggregation engine.
 *
 * <ul>
 *   <li>{@link com.phillippitts.callqa.config.AggregationConfig} - vocabulary, scorer, clusterer
 *       and summarizer beans</li>
 *   <li>{@link com.phillippitts.callqa.config.EmbeddingConfig} - embedding provider selection</li>
 *   <li>{@link com.phillippitts.callqa.config.ThreadPoolConfig} - executor for the embedding pre-pass</li>
 * </ul>
 *
 * <p>Externalized settings live in {@code application.properties}.
 */
package com.phillippitts.callqa.config;
