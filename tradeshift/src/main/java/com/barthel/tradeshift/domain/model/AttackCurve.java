package com.barthel.tradeshift.domain.model;

import java.util.List;

/**
 * Outcome of one node-removal attack.
 *
 * @param threshold fraction of removed nodes at which the spectral radius first drops to 1 or below
 * @param removedCounts number of removed nodes at each step, starting at 0
 * @param eigenvalues spectral radius of the remaining adjacency matrix at each step
 */
public record AttackCurve(double threshold, List<Integer> removedCounts, List<Double> eigenvalues) {

    public AttackCurve {
        if (removedCounts.size() != eigenvalues.size()) {
            throw new IllegalArgumentException("Each removal step needs exactly one eigenvalue");
        }
        removedCounts = List.copyOf(removedCounts);
        eigenvalues = List.copyOf(eigenvalues);
    }
}
