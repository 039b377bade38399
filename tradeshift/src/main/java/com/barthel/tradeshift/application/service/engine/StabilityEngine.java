package com.barthel.tradeshift.application.service.engine;

import com.barthel.tradeshift.application.port.out.FetchDistanceMatrixPort;
import com.barthel.tradeshift.application.port.out.FetchStabilityIndexPort;
import com.barthel.tradeshift.domain.model.AnalysisSettings;
import com.barthel.tradeshift.domain.model.DistanceMatrix;
import com.barthel.tradeshift.domain.model.MetricResult;
import com.barthel.tradeshift.domain.model.Scenario;
import com.barthel.tradeshift.domain.model.StabilityResult;
import com.barthel.tradeshift.domain.model.TradeGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Node and network stability indices (Wang et al., 2023; Ji, Zhang &amp; Fan, 2014).
 * <p>
 * The stability of an importer sums, over its potential suppliers, the
 * supplier's stability score times its export share, decayed by distance.
 * Units are arbitrary; only comparisons between scenarios are meaningful.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StabilityEngine {

    private final FetchStabilityIndexPort fetchStabilityIndexPort;
    private final FetchDistanceMatrixPort fetchDistanceMatrixPort;
    private final AnalysisSettings settings;

    /**
     * Computes node stability, its relative difference vs base and network
     * stability for every scenario.
     *
     * @param scenarios all scenarios, base first
     * @param inDegree in-degree centrality per scenario
     * @param outDegree out-degree centrality per scenario
     * @return empty when no distance matrix could be built for the countries of all scenarios
     */
    public MetricResult<Optional<StabilityResult>> compute(
            List<Scenario> scenarios, List<Map<String, Double>> inDegree, List<Map<String, Double>> outDegree) {
        List<String> warnings = new ArrayList<>();
        Set<String> countries = new TreeSet<>();
        scenarios.forEach(scenario -> countries.addAll(scenario.graph().countries()));
        Optional<DistanceMatrix> distances = fetchDistanceMatrixPort.fetchDistanceMatrix(countries);
        if (distances.isEmpty()) {
            warn(warnings, "Distance matrix unavailable, node stability shall not be computed");
            return MetricResult.of(Optional.empty(), warnings);
        }
        Map<String, Double> stabilityIndex = fetchStabilityIndexPort.fetchStabilityIndex();

        List<Map<String, Double>> nodeStability = new ArrayList<>(scenarios.size());
        for (int i = 0; i < scenarios.size(); i++) {
            MetricResult<Map<String, Double>> result = nodeStability(
                    scenarios.get(i).graph(), outDegree.get(i), stabilityIndex, distances.get());
            warnings.addAll(result.warnings());
            nodeStability.add(result.value());
        }
        List<Map<String, Double>> difference = new ArrayList<>();
        for (int i = 1; i < nodeStability.size(); i++) {
            MetricResult<Map<String, Double>> result = relativeDifference(nodeStability.get(0), nodeStability.get(i));
            warnings.addAll(result.warnings());
            difference.add(result.value());
        }
        List<Double> network = new ArrayList<>(scenarios.size());
        for (int i = 0; i < scenarios.size(); i++) {
            network.add(networkStability(inDegree.get(i), nodeStability.get(i)));
        }
        return MetricResult.of(Optional.of(new StabilityResult(nodeStability, difference, network)), warnings);
    }

    /**
     * Stability of each importer of the graph:
     * {@code sum_e risk(e) * out_degree(e) * distance(n, e)^-gamma} over exporters
     * with positive out-degree centrality, other than the importer itself.
     * Exporters without a stability score are skipped with a warning.
     */
    public MetricResult<Map<String, Double>> nodeStability(TradeGraph graph, Map<String, Double> outDegree,
                                                           Map<String, Double> stabilityIndex, DistanceMatrix distances) {
        Set<String> warnings = new LinkedHashSet<>();
        Map<String, Double> stability = new LinkedHashMap<>();
        for (String importer : graph.countries()) {
            double importerStability = 0.0;
            for (Map.Entry<String, Double> exporter : outDegree.entrySet()) {
                if (exporter.getValue() <= 0 || exporter.getKey().equals(importer)) {
                    continue;
                }
                Double risk = stabilityIndex.get(exporter.getKey());
                if (risk == null) {
                    if (warnings.add(exporter.getKey() + " not found in stability index")) {
                        log.warn("{} not found in stability index", exporter.getKey());
                    }
                    continue;
                }
                double distance = distances.distance(importer, exporter.getKey());
                importerStability += risk * exporter.getValue() * Math.pow(distance, -settings.gamma());
            }
            stability.put(importer, importerStability);
        }
        return MetricResult.of(stability, warnings);
    }

    /**
     * {@code (stability(n) - base(n)) / base(n)}; NaN when the country is
     * missing from the base or its base stability is 0.
     */
    public MetricResult<Map<String, Double>> relativeDifference(Map<String, Double> base, Map<String, Double> stability) {
        List<String> warnings = new ArrayList<>();
        Map<String, Double> difference = new LinkedHashMap<>();
        stability.forEach((country, value) -> {
            Double baseValue = base.get(country);
            if (baseValue == null) {
                warn(warnings, country + " not found in the base scenario");
                difference.put(country, Double.NaN);
            } else if (baseValue == 0.0) {
                difference.put(country, Double.NaN);
            } else {
                difference.put(country, (value - baseValue) / baseValue);
            }
        });
        return MetricResult.of(difference, warnings);
    }

    /**
     * Sum of node stabilities weighted by in-degree centrality.
     */
    public double networkStability(Map<String, Double> inDegree, Map<String, Double> nodeStability) {
        double sum = 0.0;
        for (Map.Entry<String, Double> importer : inDegree.entrySet()) {
            Double stability = nodeStability.get(importer.getKey());
            if (stability != null) {
                sum += importer.getValue() * stability;
            }
        }
        return sum;
    }

    private void warn(List<String> warnings, String warning) {
        log.warn(warning);
        warnings.add(warning);
    }
}
