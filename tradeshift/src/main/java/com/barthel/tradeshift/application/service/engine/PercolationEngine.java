package com.barthel.tradeshift.application.service.engine;

import com.barthel.tradeshift.domain.graph.GraphAlgebra;
import com.barthel.tradeshift.domain.model.AnalysisSettings;
import com.barthel.tradeshift.domain.model.AttackCurve;
import com.barthel.tradeshift.domain.model.AttackResilience;
import com.barthel.tradeshift.domain.model.RandomAttackResult;
import com.barthel.tradeshift.domain.model.TradeGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Attack vulnerability of a trade network (Restrepo, Ott &amp; Hunt, 2008).
 * <p>
 * Nodes are removed one by one in decreasing order of a priority vector while
 * the spectral radius of the remaining binary adjacency matrix is tracked. The
 * network is considered collapsed once the radius drops to 1 or below.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PercolationEngine {

    private static final double CRITICAL_EIGENVALUE = 1.0;
    private static final double EIGENVALUE_TOLERANCE = 1e-9;

    private final AnalysisSettings settings;
    private final RandomGenerator randomGenerator;

    /**
     * Runs the export, entropic and random attacks on one scenario.
     *
     * @param outDegree removal priority of the export attack
     * @param entropicOutDegree removal priority of the entropic attack
     */
    public AttackResilience resilience(TradeGraph graph, Map<String, Double> outDegree,
                                       Map<String, Double> entropicOutDegree) {
        List<String> countries = graph.countries();
        double[][] binary = binarise(GraphAlgebra.adjacency(graph, countries));
        AttackCurve export = attack(binary, priorities(countries, outDegree));
        AttackCurve entropic = attack(binary, priorities(countries, entropicOutDegree));
        RandomAttackResult random = randomAttack(binary);
        log.debug("Attack thresholds over {} countries: export {}, entropic {}, random {} +/- {}",
                countries.size(), export.threshold(), entropic.threshold(),
                random.meanThreshold(), random.standardError());
        return new AttackResilience(export, entropic, random);
    }

    /**
     * Removes nodes in decreasing order of priority, equal priorities in matrix
     * order, and records the spectral radius before the first and after every removal.
     *
     * @param binary square 0/1 adjacency matrix
     * @param priorities removal priority of each row
     */
    public AttackCurve attack(double[][] binary, double[] priorities) {
        int n = binary.length;
        if (priorities.length != n) {
            throw new IllegalArgumentException(
                    "Expected " + n + " removal priorities, got " + priorities.length);
        }
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> priorities[i]).reversed());

        boolean[] removed = new boolean[n];
        List<Integer> removedCounts = new ArrayList<>(n + 1);
        List<Double> eigenvalues = new ArrayList<>(n + 1);
        double threshold = Double.NaN;
        double radius = GraphAlgebra.spectralRadius(binary);
        for (int k = 0; k <= n; k++) {
            if (k > 0) {
                removed[order[k - 1]] = true;
                // a principal submatrix of a non-negative matrix never has a larger radius
                radius = radius == 0.0 ? 0.0 : GraphAlgebra.spectralRadius(remaining(binary, removed));
            }
            removedCounts.add(k);
            eigenvalues.add(radius);
            if (Double.isNaN(threshold) && radius <= CRITICAL_EIGENVALUE + EIGENVALUE_TOLERANCE) {
                threshold = n == 0 ? 0.0 : k / (double) n;
            }
        }
        return new AttackCurve(threshold, removedCounts, eigenvalues);
    }

    /**
     * Repeats the attack with uniformly random priorities and reports the
     * mean threshold with its standard error.
     */
    public RandomAttackResult randomAttack(double[][] binary) {
        int trials = settings.randomAttackSampleSize();
        DescriptiveStatistics thresholds = new DescriptiveStatistics();
        List<AttackCurve> curves = new ArrayList<>(trials);
        for (int trial = 0; trial < trials; trial++) {
            double[] priorities = new double[binary.length];
            for (int i = 0; i < priorities.length; i++) {
                priorities[i] = randomGenerator.nextDouble();
            }
            AttackCurve curve = attack(binary, priorities);
            thresholds.addValue(curve.threshold());
            curves.add(curve);
        }
        double standardError = thresholds.getStandardDeviation() / Math.sqrt(thresholds.getN());
        return new RandomAttackResult(thresholds.getMean(), standardError, curves);
    }

    static double[][] binarise(double[][] adjacency) {
        double[][] binary = new double[adjacency.length][];
        for (int i = 0; i < adjacency.length; i++) {
            binary[i] = new double[adjacency[i].length];
            for (int j = 0; j < adjacency[i].length; j++) {
                binary[i][j] = adjacency[i][j] > 0 ? 1.0 : 0.0;
            }
        }
        return binary;
    }

    private static double[] priorities(List<String> countries, Map<String, Double> values) {
        double[] priorities = new double[countries.size()];
        for (int i = 0; i < priorities.length; i++) {
            priorities[i] = values.getOrDefault(countries.get(i), 0.0);
        }
        return priorities;
    }

    private static double[][] remaining(double[][] matrix, boolean[] removed) {
        int[] kept = new int[matrix.length];
        int size = 0;
        for (int i = 0; i < matrix.length; i++) {
            if (!removed[i]) {
                kept[size++] = i;
            }
        }
        double[][] sub = new double[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                sub[i][j] = matrix[kept[i]][kept[j]];
            }
        }
        return sub;
    }
}
