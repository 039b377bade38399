package com.barthel.tradeshift.domain.graph;

import com.barthel.tradeshift.domain.exception.NumericalException;
import com.barthel.tradeshift.domain.model.EfficiencyNormalisation;
import com.barthel.tradeshift.domain.model.TradeGraph;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.jgrapht.Graph;
import org.jgrapht.alg.interfaces.ShortestPathAlgorithm.SingleSourcePaths;
import org.jgrapht.alg.shortestpath.DijkstraShortestPath;
import org.jgrapht.graph.DefaultDirectedWeightedGraph;
import org.jgrapht.graph.DefaultWeightedEdge;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Matrix and random-walk primitives over trade graphs.
 * <p>
 * Matrices are plain {@code double[][]}, rows and columns follow the node order
 * passed to {@link #adjacency(TradeGraph, List)}.
 */
public final class GraphAlgebra {

    /** Maximum deviation of a row sum from 1 for a row to count as stochastic. */
    public static final double STOCHASTIC_ROW_TOLERANCE = 1e-6;

    private static final double CONVERGENCE_TOLERANCE = 1e-12;
    private static final int MAX_ITERATIONS = 100_000;

    private GraphAlgebra() {
    }

    /**
     * Weighted adjacency matrix over the given node order. Entry (i, j) is the
     * volume flowing from {@code order[i]} to {@code order[j]}; nodes of the
     * graph outside {@code order} are ignored, nodes of {@code order} missing
     * from the graph get empty rows and columns.
     */
    public static double[][] adjacency(TradeGraph graph, List<String> order) {
        int n = order.size();
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < n; i++) {
            position.put(order.get(i), i);
        }
        double[][] matrix = new double[n][n];
        Graph<String, DefaultWeightedEdge> g = graph.asGraph();
        for (DefaultWeightedEdge edge : g.edgeSet()) {
            Integer from = position.get(g.getEdgeSource(edge));
            Integer to = position.get(g.getEdgeTarget(edge));
            if (from != null && to != null) {
                matrix[from][to] = g.getEdgeWeight(edge);
            }
        }
        return matrix;
    }

    /**
     * Row-normalised copy of a non-negative square matrix. Rows summing to 0 stay all-zero.
     */
    public static double[][] rightStochastic(double[][] matrix) {
        double[][] stochastic = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            double rowSum = 0.0;
            for (double value : matrix[i]) {
                rowSum += value;
            }
            stochastic[i] = new double[matrix[i].length];
            if (rowSum == 0.0) {
                continue;
            }
            for (int j = 0; j < matrix[i].length; j++) {
                stochastic[i][j] = matrix[i][j] / rowSum;
            }
        }
        return stochastic;
    }

    /**
     * Stationary distribution of a random walk, the limit of the lazy walk
     * {@code (I + P) / 2} started from the uniform distribution. All-zero rows
     * are absorbing states. When the walk has several closed classes each one
     * keeps the mass the uniform start sends into it.
     *
     * @throws NumericalException if the matrix is empty, a row sums to neither 0 nor 1,
     *                            or the iteration does not converge
     */
    public static double[] stationaryDistribution(double[][] stochastic) {
        int n = stochastic.length;
        if (n == 0) {
            throw new NumericalException("Cannot compute the stationary distribution of an empty matrix");
        }
        double[][] lazy = new double[n][];
        for (int i = 0; i < n; i++) {
            double rowSum = 0.0;
            for (double value : stochastic[i]) {
                rowSum += value;
            }
            lazy[i] = new double[n];
            if (rowSum == 0.0) {
                lazy[i][i] = 1.0;
                continue;
            }
            if (Math.abs(rowSum - 1.0) > STOCHASTIC_ROW_TOLERANCE) {
                throw new NumericalException("Row " + i + " sums to " + rowSum + ", no eigenvalue of 1");
            }
            for (int j = 0; j < n; j++) {
                lazy[i][j] = stochastic[i][j] / 2.0;
            }
            lazy[i][i] += 0.5;
        }
        RealMatrix walk = MatrixUtils.createRealMatrix(lazy);
        double[] distribution = new double[n];
        Arrays.fill(distribution, 1.0 / n);
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            double[] next = walk.preMultiply(distribution);
            double sum = 0.0;
            for (double p : next) {
                sum += p;
            }
            double change = 0.0;
            for (int i = 0; i < n; i++) {
                next[i] /= sum;
                change += Math.abs(next[i] - distribution[i]);
            }
            distribution = next;
            if (change < CONVERGENCE_TOLERANCE) {
                return distribution;
            }
        }
        throw new NumericalException("Stationary distribution did not converge within " + MAX_ITERATIONS + " steps");
    }

    /**
     * Entropy rate of the random walk on the graph: the stationary distribution
     * dotted with the Shannon entropy (natural log) of each node's outgoing transition probabilities.
     */
    public static double entropyRate(TradeGraph graph) {
        double[][] transitions = rightStochastic(adjacency(graph, graph.countries()));
        double[] stationary = stationaryDistribution(transitions);
        double rate = 0.0;
        for (int i = 0; i < transitions.length; i++) {
            double entropy = 0.0;
            for (double p : transitions[i]) {
                if (p > 0) {
                    entropy -= p * Math.log(p);
                }
            }
            rate += stationary[i] * entropy;
        }
        return rate;
    }

    /**
     * Communication efficiency of the flow network (Bertagnolli, Gallotti &amp; De Domenico, 2021),
     * normalised against the ideal flow network with the same in/out strengths.
     */
    public static double efficiency(TradeGraph graph, EfficiencyNormalisation normalisation) {
        List<String> countries = graph.countries();
        double[][] adjacency = adjacency(graph, countries);
        double actual = flowEfficiency(countries, adjacency);
        if (normalisation == EfficiencyNormalisation.NONE) {
            return actual;
        }
        double ideal = flowEfficiency(countries, idealFlow(adjacency));
        double denominator = switch (normalisation) {
            case STRONG -> ideal;
            case WEAK -> (actual + ideal) / 2.0;
            case NONE -> 1.0;
        };
        return denominator == 0.0 ? 0.0 : actual / denominator;
    }

    /**
     * Share of the graph's total in- or out-flow carried by each country; all
     * zero when the graph carries no flow.
     */
    public static Map<String, Double> degreeCentrality(TradeGraph graph, FlowDirection direction) {
        Map<String, Double> strengths = strengths(graph, direction);
        double total = strengths.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Double> centrality = new LinkedHashMap<>();
        strengths.forEach((country, strength) -> centrality.put(country, total == 0.0 ? 0.0 : strength / total));
        return centrality;
    }

    /**
     * Entropic degree (Bompard, Napoli &amp; Xue, 2009): a country's strength
     * scaled by one plus the entropy of its flow distribution.
     */
    public static Map<String, Double> entropicDegree(TradeGraph graph, FlowDirection direction) {
        Graph<String, DefaultWeightedEdge> g = graph.asGraph();
        Map<String, Double> degrees = new LinkedHashMap<>();
        for (String country : graph.countries()) {
            Set<DefaultWeightedEdge> edges = direction == FlowDirection.OUT
                    ? g.outgoingEdgesOf(country)
                    : g.incomingEdgesOf(country);
            double strength = edges.stream().mapToDouble(g::getEdgeWeight).sum();
            if (strength == 0.0) {
                degrees.put(country, 0.0);
                continue;
            }
            double entropy = 0.0;
            for (DefaultWeightedEdge edge : edges) {
                double p = g.getEdgeWeight(edge) / strength;
                if (p > 0) {
                    entropy -= p * Math.log(p);
                }
            }
            degrees.put(country, (1.0 + entropy) * strength);
        }
        return degrees;
    }

    /**
     * Copy of the graph where each edge costs the reciprocal of its volume.
     * Zero-volume edges have infinite cost and are left out, as are self-loops.
     */
    public static Graph<String, DefaultWeightedEdge> reciprocalWeights(TradeGraph graph) {
        List<String> countries = graph.countries();
        return reciprocalWeights(countries, adjacency(graph, countries));
    }

    /**
     * Largest eigenvalue modulus of a square matrix, 0 for an empty or all-zero matrix.
     */
    public static double spectralRadius(double[][] matrix) {
        if (matrix.length == 0 || isZero(matrix)) {
            return 0.0;
        }
        EigenDecomposition eigen = decompose(matrix);
        double[] real = eigen.getRealEigenvalues();
        double[] imaginary = eigen.getImagEigenvalues();
        double radius = 0.0;
        for (int k = 0; k < real.length; k++) {
            radius = Math.max(radius, Math.hypot(real[k], imaginary[k]));
        }
        return radius;
    }

    private static EigenDecomposition decompose(double[][] matrix) {
        try {
            return new EigenDecomposition(MatrixUtils.createRealMatrix(matrix));
        } catch (MathIllegalStateException | MathArithmeticException e) {
            throw new NumericalException("Eigen decomposition failed: " + e.getMessage(), e);
        }
    }

    private static boolean isZero(double[][] matrix) {
        for (double[] row : matrix) {
            for (double value : row) {
                if (value != 0.0) {
                    return false;
                }
            }
        }
        return true;
    }

    private static Map<String, Double> strengths(TradeGraph graph, FlowDirection direction) {
        Graph<String, DefaultWeightedEdge> g = graph.asGraph();
        Map<String, Double> strengths = new LinkedHashMap<>();
        for (String country : graph.countries()) {
            Set<DefaultWeightedEdge> edges = direction == FlowDirection.OUT
                    ? g.outgoingEdgesOf(country)
                    : g.incomingEdgesOf(country);
            strengths.put(country, edges.stream().mapToDouble(g::getEdgeWeight).sum());
        }
        return strengths;
    }

    private static double[][] idealFlow(double[][] adjacency) {
        int n = adjacency.length;
        double[] out = new double[n];
        double[] in = new double[n];
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                out[i] += adjacency[i][j];
                in[j] += adjacency[i][j];
                total += adjacency[i][j];
            }
        }
        double[][] ideal = new double[n][n];
        if (total == 0.0) {
            return ideal;
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i != j) {
                    ideal[i][j] = out[i] * in[j] / total;
                }
            }
        }
        return ideal;
    }

    private static double flowEfficiency(List<String> countries, double[][] weights) {
        int n = countries.size();
        if (n < 2) {
            return 0.0;
        }
        Graph<String, DefaultWeightedEdge> costs = reciprocalWeights(countries, weights);
        DijkstraShortestPath<String, DefaultWeightedEdge> dijkstra = new DijkstraShortestPath<>(costs);
        double sum = 0.0;
        for (String source : countries) {
            SingleSourcePaths<String, DefaultWeightedEdge> paths = dijkstra.getPaths(source);
            for (String target : countries) {
                if (source.equals(target)) {
                    continue;
                }
                double length = paths.getWeight(target);
                if (length > 0 && !Double.isInfinite(length)) {
                    sum += 1.0 / length;
                }
            }
        }
        return sum / (n * (double) (n - 1));
    }

    private static Graph<String, DefaultWeightedEdge> reciprocalWeights(List<String> countries, double[][] weights) {
        Graph<String, DefaultWeightedEdge> costs = new DefaultDirectedWeightedGraph<>(DefaultWeightedEdge.class);
        countries.forEach(costs::addVertex);
        for (int i = 0; i < countries.size(); i++) {
            for (int j = 0; j < countries.size(); j++) {
                if (i == j || weights[i][j] <= 0.0) {
                    continue;
                }
                DefaultWeightedEdge edge = costs.addEdge(countries.get(i), countries.get(j));
                costs.setEdgeWeight(edge, 1.0 / weights[i][j]);
            }
        }
        return costs;
    }
}
