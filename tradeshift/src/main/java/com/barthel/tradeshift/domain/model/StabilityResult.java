package com.barthel.tradeshift.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stability indices of all scenarios.
 *
 * @param nodeStability per scenario, stability index of each importer
 * @param nodeStabilityDifference per comparison scenario, relative change of each importer's stability vs base
 * @param networkStability per scenario, in-degree weighted sum of node stabilities
 */
public record StabilityResult(
        List<Map<String, Double>> nodeStability,
        List<Map<String, Double>> nodeStabilityDifference,
        List<Double> networkStability) {

    public StabilityResult {
        nodeStability = frozen(nodeStability);
        nodeStabilityDifference = frozen(nodeStabilityDifference);
        networkStability = List.copyOf(networkStability);
    }

    private static List<Map<String, Double>> frozen(List<Map<String, Double>> maps) {
        List<Map<String, Double>> copy = new ArrayList<>(maps.size());
        maps.forEach(map -> copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(map))));
        return Collections.unmodifiableList(copy);
    }
}
