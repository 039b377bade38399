package com.barthel.tradeshift.application.service.engine;

import com.barthel.tradeshift.domain.exception.NumericalException;
import com.barthel.tradeshift.domain.graph.GraphAlgebra;
import com.barthel.tradeshift.domain.model.AlignedCountries;
import com.barthel.tradeshift.domain.model.DistanceMetricsRow;
import com.barthel.tradeshift.domain.model.MetricResult;
import com.barthel.tradeshift.domain.model.Scenario;
import com.barthel.tradeshift.domain.model.TradeGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Distances between the base scenario's trade graph and each comparison graph.
 */
@Service
@Slf4j
public class DistanceMetricsEngine {

    /**
     * Computes the Frobenius, Markov and entropy-rate distance of each
     * comparison scenario to the base scenario.
     *
     * @param aligned aligned countries, one entry per comparison scenario in the same order
     */
    public MetricResult<List<DistanceMetricsRow>> compare(
            Scenario base, List<Scenario> comparisons, List<AlignedCountries> aligned) {
        if (comparisons.size() != aligned.size()) {
            throw new IllegalArgumentException("Each comparison scenario needs its aligned countries");
        }
        List<String> warnings = new ArrayList<>();
        double baseEntropyRate = entropyRate(base.graph(), 0, warnings);
        List<DistanceMetricsRow> rows = new ArrayList<>(comparisons.size());
        for (int i = 0; i < comparisons.size(); i++) {
            TradeGraph graph = comparisons.get(i).graph();
            AlignedCountries countries = aligned.get(i);
            int scenarioId = countries.scenarioId();
            rows.add(new DistanceMetricsRow(
                    scenarioId,
                    frobenius(base.graph(), graph, countries.countries()),
                    markov(base.graph(), graph, countries, warnings),
                    entropyRate(graph, scenarioId, warnings) - baseEntropyRate));
        }
        return MetricResult.of(rows, warnings);
    }

    /**
     * Frobenius norm of the difference of both adjacency matrices restricted to {@code countries}.
     */
    public double frobenius(TradeGraph base, TradeGraph other, List<String> countries) {
        double[][] a = GraphAlgebra.adjacency(base, countries);
        double[][] b = GraphAlgebra.adjacency(other, countries);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < a.length; j++) {
                double difference = a[i][j] - b[i][j];
                sum += difference * difference;
            }
        }
        return Math.sqrt(sum);
    }

    /**
     * Euclidean distance between the stationary distributions of both graphs'
     * random walks, each restricted to {@code countries}.
     *
     * @throws NumericalException if either distribution cannot be computed
     */
    public double markov(TradeGraph base, TradeGraph other, List<String> countries) {
        double[] p = GraphAlgebra.stationaryDistribution(
                GraphAlgebra.rightStochastic(GraphAlgebra.adjacency(base, countries)));
        double[] q = GraphAlgebra.stationaryDistribution(
                GraphAlgebra.rightStochastic(GraphAlgebra.adjacency(other, countries)));
        double sum = 0.0;
        for (int i = 0; i < p.length; i++) {
            sum += (p[i] - q[i]) * (p[i] - q[i]);
        }
        return Math.sqrt(sum);
    }

    private double markov(TradeGraph base, TradeGraph other, AlignedCountries aligned, List<String> warnings) {
        try {
            return markov(base, other, aligned.countries());
        } catch (NumericalException e) {
            String warning = "Markov distance of scenario " + aligned.scenarioId() + " is undefined: " + e.getMessage();
            log.warn(warning);
            warnings.add(warning);
            return Double.NaN;
        }
    }

    private double entropyRate(TradeGraph graph, int scenarioId, List<String> warnings) {
        try {
            return GraphAlgebra.entropyRate(graph);
        } catch (NumericalException e) {
            String warning = "Entropy rate of scenario " + scenarioId + " is undefined: " + e.getMessage();
            log.warn(warning);
            warnings.add(warning);
            return Double.NaN;
        }
    }
}
