package com.barthel.tradeshift.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Metrics of one analysis run.
 * <p>
 * Per-scenario lists are indexed by scenario id, the base scenario first.
 * Lists holding a comparison with the base start at scenario 1 and thus have
 * one entry less.
 */
@Value
@Builder
public class ScenarioAnalysis {

    List<String> labels;
    List<AlignedCountries> aligned;
    List<CommunityPartition> communities;

    List<Map<String, Double>> imports;
    List<Map<String, Double>> importsDifference;
    List<Map<String, Double>> importsDifferenceAbsolute;

    List<Map<String, Double>> communityDifference;
    List<DistanceMetricsRow> distances;

    List<Map<String, Double>> inDegree;
    List<Map<String, Double>> outDegree;
    List<DegreeExtrema> globalExtrema;
    List<List<DegreeExtrema>> communityExtrema;

    List<Map<String, Double>> communitySatisfaction;
    List<Map<String, Double>> communitySatisfactionDifference;

    List<Double> efficiency;
    List<Double> clustering;
    List<Double> betweenness;

    List<Map<String, Double>> withinCommunityDegree;
    List<Map<String, Double>> participation;
    List<Map<String, NodeRole>> roles;

    /** Null when no distance matrix was available. */
    StabilityResult stability;

    List<Map<String, Double>> entropicOutDegree;
    List<AttackResilience> percolation;

    List<String> warnings;

    public Optional<StabilityResult> getStability() {
        return Optional.ofNullable(stability);
    }

    public int scenarioCount() {
        return labels.size();
    }

    /**
     * One row of network-level metrics per scenario.
     */
    public List<NetworkMetricsRow> networkMetrics() {
        List<NetworkMetricsRow> rows = new ArrayList<>(scenarioCount());
        for (int id = 0; id < scenarioCount(); id++) {
            OptionalDouble networkStability = stability == null
                    ? OptionalDouble.empty()
                    : OptionalDouble.of(stability.networkStability().get(id));
            AttackResilience resilience = percolation.get(id);
            rows.add(new NetworkMetricsRow(
                    id,
                    efficiency.get(id),
                    clustering.get(id),
                    betweenness.get(id),
                    networkStability,
                    resilience.export().threshold(),
                    resilience.entropic().threshold(),
                    resilience.random().meanThreshold(),
                    resilience.random().standardError()));
        }
        return rows;
    }
}
