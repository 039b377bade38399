package com.barthel.tradeshift.domain.model;

/**
 * Graph distance of one scenario to the base scenario.
 *
 * @param scenarioId id of the compared scenario
 * @param frobenius Frobenius norm of the aligned adjacency difference
 * @param markov Euclidean distance of the aligned stationary distributions
 * @param entropyRate entropy rate of the scenario minus that of the base
 */
public record DistanceMetricsRow(int scenarioId, double frobenius, double markov, double entropyRate) {
}
