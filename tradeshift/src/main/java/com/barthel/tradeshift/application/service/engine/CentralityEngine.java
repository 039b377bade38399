package com.barthel.tradeshift.application.service.engine;

import com.barthel.tradeshift.domain.graph.FlowDirection;
import com.barthel.tradeshift.domain.graph.GraphAlgebra;
import com.barthel.tradeshift.domain.model.CommunityPartition;
import com.barthel.tradeshift.domain.model.DegreeExtrema;
import com.barthel.tradeshift.domain.model.Extremum;
import com.barthel.tradeshift.domain.model.TradeGraph;
import lombok.extern.slf4j.Slf4j;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.alg.scoring.BetweennessCentrality;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Node centrality and network-level centrality summaries of a single scenario.
 */
@Service
@Slf4j
public class CentralityEngine {

    public Map<String, Double> inDegree(TradeGraph graph) {
        return GraphAlgebra.degreeCentrality(graph, FlowDirection.IN);
    }

    public Map<String, Double> outDegree(TradeGraph graph) {
        return GraphAlgebra.degreeCentrality(graph, FlowDirection.OUT);
    }

    public Map<String, Double> entropicOutDegree(TradeGraph graph) {
        return GraphAlgebra.entropicDegree(graph, FlowDirection.OUT);
    }

    /**
     * Countries with the smallest and largest in/out-degree centrality.
     *
     * @param scenarioId id stored in the result
     */
    public DegreeExtrema globalExtrema(int scenarioId, Map<String, Double> inDegree, Map<String, Double> outDegree) {
        return extrema(scenarioId, inDegree, outDegree);
    }

    /**
     * Degree extrema restricted to each community, in community order.
     */
    public List<DegreeExtrema> communityExtrema(
            CommunityPartition communities, Map<String, Double> inDegree, Map<String, Double> outDegree) {
        List<DegreeExtrema> extrema = new ArrayList<>(communities.size());
        for (int id = 0; id < communities.size(); id++) {
            Set<String> members = communities.community(id);
            extrema.add(extrema(id, restrict(inDegree, members), restrict(outDegree, members)));
        }
        return extrema;
    }

    /**
     * Mean betweenness centrality, where an edge costs the reciprocal of its volume.
     * Scores are normalised by {@code (n-1)(n-2)}.
     */
    public double meanBetweenness(TradeGraph graph) {
        Map<String, Double> scores = betweenness(graph);
        return scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
    }

    public Map<String, Double> betweenness(TradeGraph graph) {
        Graph<String, DefaultWeightedEdge> costs = GraphAlgebra.reciprocalWeights(graph);
        Map<String, Double> raw = new BetweennessCentrality<>(costs, false).getScores();
        int n = graph.size();
        log.debug("Betweenness over {} countries and {} weighted edges", n, costs.edgeSet().size());
        double scale = n > 2 ? 1.0 / ((n - 1) * (double) (n - 2)) : 1.0;
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String country : graph.countries()) {
            scores.put(country, raw.getOrDefault(country, 0.0) * scale);
        }
        return scores;
    }

    /**
     * Average of the weighted directed clustering coefficient (Fagiolo, 2007)
     * over all countries; weights are scaled by the largest weight.
     */
    public double averageClustering(TradeGraph graph) {
        Map<String, Double> clustering = clustering(graph);
        return clustering.values().stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
    }

    public Map<String, Double> clustering(TradeGraph graph) {
        Graph<String, DefaultWeightedEdge> g = graph.asGraph();
        double maxWeight = g.edgeSet().stream().mapToDouble(g::getEdgeWeight).max().orElse(0.0);
        Map<String, Double> clustering = new LinkedHashMap<>();
        for (String i : graph.countries()) {
            if (maxWeight == 0.0) {
                clustering.put(i, 0.0);
                continue;
            }
            Set<String> predecessors = predecessors(g, i);
            Set<String> successors = successors(g, i);
            double triangles = 0.0;
            for (String j : predecessors) {
                Set<String> jPredecessors = predecessors(g, j);
                Set<String> jSuccessors = successors(g, j);
                double wji = scaled(graph, j, i, maxWeight);
                triangles += triangleSum(graph, maxWeight, wji, i, j, predecessors, successors, jPredecessors, jSuccessors);
            }
            for (String j : successors) {
                Set<String> jPredecessors = predecessors(g, j);
                Set<String> jSuccessors = successors(g, j);
                double wij = scaled(graph, i, j, maxWeight);
                triangles += triangleSum(graph, maxWeight, wij, i, j, predecessors, successors, jPredecessors, jSuccessors);
            }
            int total = predecessors.size() + successors.size();
            Set<String> reciprocal = new HashSet<>(predecessors);
            reciprocal.retainAll(successors);
            double possible = (total * (double) (total - 1) - 2.0 * reciprocal.size()) * 2.0;
            clustering.put(i, triangles == 0.0 || possible == 0.0 ? 0.0 : triangles / possible);
        }
        return clustering;
    }

    // closes the triangle through k in all four orientations of the (i,k) and (k,j) edges
    private double triangleSum(TradeGraph graph, double maxWeight, double firstEdge, String i, String j,
                               Set<String> iPredecessors, Set<String> iSuccessors,
                               Set<String> jPredecessors, Set<String> jSuccessors) {
        double sum = 0.0;
        for (String k : intersection(iPredecessors, jPredecessors)) {
            sum += Math.cbrt(firstEdge * scaled(graph, k, i, maxWeight) * scaled(graph, k, j, maxWeight));
        }
        for (String k : intersection(iPredecessors, jSuccessors)) {
            sum += Math.cbrt(firstEdge * scaled(graph, k, i, maxWeight) * scaled(graph, j, k, maxWeight));
        }
        for (String k : intersection(iSuccessors, jPredecessors)) {
            sum += Math.cbrt(firstEdge * scaled(graph, i, k, maxWeight) * scaled(graph, k, j, maxWeight));
        }
        for (String k : intersection(iSuccessors, jSuccessors)) {
            sum += Math.cbrt(firstEdge * scaled(graph, i, k, maxWeight) * scaled(graph, j, k, maxWeight));
        }
        return sum;
    }

    private static double scaled(TradeGraph graph, String from, String to, double maxWeight) {
        return graph.weight(from, to) / maxWeight;
    }

    private static Set<String> predecessors(Graph<String, DefaultWeightedEdge> g, String node) {
        Set<String> predecessors = new HashSet<>(Graphs.predecessorListOf(g, node));
        predecessors.remove(node);
        return predecessors;
    }

    private static Set<String> successors(Graph<String, DefaultWeightedEdge> g, String node) {
        Set<String> successors = new HashSet<>(Graphs.successorListOf(g, node));
        successors.remove(node);
        return successors;
    }

    private static Set<String> intersection(Set<String> a, Set<String> b) {
        Set<String> result = new HashSet<>(a);
        result.retainAll(b);
        return result;
    }

    private static Map<String, Double> restrict(Map<String, Double> values, Set<String> members) {
        Map<String, Double> restricted = new LinkedHashMap<>();
        values.forEach((country, value) -> {
            if (members.contains(country)) {
                restricted.put(country, value);
            }
        });
        return restricted;
    }

    private static DegreeExtrema extrema(int id, Map<String, Double> inDegree, Map<String, Double> outDegree) {
        return new DegreeExtrema(id, min(inDegree), max(inDegree), min(outDegree), max(outDegree));
    }

    private static Extremum min(Map<String, Double> values) {
        Extremum min = Extremum.NONE;
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            if (!min.isPresent() || entry.getValue() < min.value()) {
                min = new Extremum(entry.getKey(), entry.getValue());
            }
        }
        return min;
    }

    private static Extremum max(Map<String, Double> values) {
        Extremum max = Extremum.NONE;
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            if (!max.isPresent() || entry.getValue() > max.value()) {
                max = new Extremum(entry.getKey(), entry.getValue());
            }
        }
        return max;
    }
}
