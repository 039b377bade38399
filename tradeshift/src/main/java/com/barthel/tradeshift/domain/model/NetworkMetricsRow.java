package com.barthel.tradeshift.domain.model;

import java.util.OptionalDouble;

/**
 * Network-level summary of one scenario.
 *
 * @param scenarioId scenario id, 0 is the base
 * @param efficiency graph efficiency
 * @param clustering average weighted clustering coefficient
 * @param betweenness mean betweenness centrality
 * @param stability network stability, empty when it could not be computed
 * @param exportThreshold collapse threshold of the export-weighted attack
 * @param entropicThreshold collapse threshold of the entropic attack
 * @param randomThreshold mean collapse threshold of the random attack
 * @param randomStandardError standard error of the random attack threshold
 */
public record NetworkMetricsRow(
        int scenarioId,
        double efficiency,
        double clustering,
        double betweenness,
        OptionalDouble stability,
        double exportThreshold,
        double entropicThreshold,
        double randomThreshold,
        double randomStandardError) {
}
