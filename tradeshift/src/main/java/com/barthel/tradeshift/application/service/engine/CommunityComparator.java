package com.barthel.tradeshift.application.service.engine;

import com.barthel.tradeshift.domain.exception.ConfigurationException;
import com.barthel.tradeshift.domain.model.CommunityPartition;
import com.barthel.tradeshift.domain.model.MetricResult;
import com.barthel.tradeshift.domain.model.Scenario;
import com.barthel.tradeshift.domain.model.TradeGraph;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Compares community structure across scenarios and computes the
 * community-role metrics of Guimerà &amp; Nunes Amaral (2005).
 */
@Service
@Slf4j
public class CommunityComparator {

    /**
     * Reorders communities so that the communities of the anchor countries come
     * first, in anchor order, followed by the remaining communities in their
     * original order. Membership is unchanged.
     *
     * @throws ConfigurationException if two anchors share a community
     */
    public CommunityPartition arrange(CommunityPartition partition, List<String> anchors) {
        Map<Integer, String> anchoredCommunities = new LinkedHashMap<>();
        for (String anchor : anchors) {
            OptionalInt index = partition.indexOf(anchor);
            if (index.isEmpty()) {
                log.warn("Anchor country {} has no community", anchor);
                continue;
            }
            String previous = anchoredCommunities.putIfAbsent(index.getAsInt(), anchor);
            if (previous != null) {
                throw new ConfigurationException(
                        "Anchor countries " + previous + " and " + anchor + " belong to the same community");
            }
        }
        List<Set<String>> ordered = new ArrayList<>(partition.size());
        anchoredCommunities.keySet().forEach(index -> ordered.add(partition.community(index)));
        for (int i = 0; i < partition.size(); i++) {
            if (!anchoredCommunities.containsKey(i)) {
                ordered.add(partition.community(i));
            }
        }
        return new CommunityPartition(ordered);
    }

    /**
     * Jaccard similarity between each base country's community in the base
     * scenario and in the comparison scenario, the country itself excluded
     * from both. Countries without a community in either scenario are skipped
     * with a warning.
     *
     * @param scenarioId id of the comparison scenario, used in warnings
     */
    public MetricResult<Map<String, Double>> communityDifference(Scenario base, Scenario comparison, int scenarioId) {
        List<String> warnings = new ArrayList<>();
        Map<String, Double> similarity = new LinkedHashMap<>();
        for (String country : base.graph().countries()) {
            Optional<Set<String>> current = comparison.communities().communityOf(country);
            if (current.isEmpty()) {
                warn(warnings, country + " has no community in scenario " + scenarioId);
                continue;
            }
            Optional<Set<String>> original = base.communities().communityOf(country);
            if (original.isEmpty()) {
                warn(warnings, country + " has no community in the base scenario");
                continue;
            }
            similarity.put(country, jaccard(without(current.get(), country), without(original.get(), country)));
        }
        return MetricResult.of(similarity, warnings);
    }

    /**
     * |A ∩ B| / |A ∪ B|, 0 when both sets are empty.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return intersection.size() / (double) union.size();
    }

    /**
     * Z-score of each country's degree within the subgraph induced by its
     * community, direction and weight ignored. Communities whose members all
     * have the same internal degree yield NaN.
     */
    public Map<String, Double> withinCommunityDegree(TradeGraph graph, CommunityPartition communities) {
        Map<String, Set<String>> neighbours = undirectedNeighbours(graph);
        Map<String, Double> scores = new LinkedHashMap<>();
        for (Set<String> community : communities.communities()) {
            List<String> members = community.stream().filter(graph::contains).toList();
            if (members.isEmpty()) {
                continue;
            }
            double[] degrees = new double[members.size()];
            for (int i = 0; i < members.size(); i++) {
                Set<String> internal = new HashSet<>(neighbours.get(members.get(i)));
                internal.retainAll(community);
                degrees[i] = internal.size();
            }
            double mean = StatUtils.mean(degrees);
            double deviation = Math.sqrt(StatUtils.populationVariance(degrees));
            for (int i = 0; i < members.size(); i++) {
                scores.put(members.get(i), deviation == 0.0 ? Double.NaN : (degrees[i] - mean) / deviation);
            }
        }
        return scores;
    }

    /**
     * Participation coefficient {@code 1 - sum_s (k_s / k)^2} of each country,
     * where {@code k} is its undirected degree and {@code k_s} the number of its
     * neighbours in community {@code s}. Isolated countries get 0.
     */
    public Map<String, Double> participation(TradeGraph graph, CommunityPartition communities) {
        Map<String, Set<String>> neighbours = undirectedNeighbours(graph);
        Map<String, Double> coefficients = new LinkedHashMap<>();
        for (String country : graph.countries()) {
            Set<String> adjacent = neighbours.get(country);
            int degree = adjacent.size();
            if (degree == 0) {
                coefficients.put(country, 0.0);
                continue;
            }
            double concentration = 0.0;
            for (Set<String> community : communities.communities()) {
                long links = adjacent.stream().filter(community::contains).count();
                concentration += links * (double) links;
            }
            coefficients.put(country, 1.0 - concentration / (degree * (double) degree));
        }
        return coefficients;
    }

    private static Map<String, Set<String>> undirectedNeighbours(TradeGraph graph) {
        Graph<String, DefaultWeightedEdge> g = graph.asGraph();
        Map<String, Set<String>> neighbours = new LinkedHashMap<>();
        for (String country : graph.countries()) {
            Set<String> adjacent = new LinkedHashSet<>(Graphs.neighborListOf(g, country));
            adjacent.remove(country);
            neighbours.put(country, adjacent);
        }
        return neighbours;
    }

    private static Set<String> without(Set<String> community, String country) {
        Set<String> others = new HashSet<>(community);
        others.remove(country);
        return others;
    }

    private void warn(List<String> warnings, String warning) {
        log.warn(warning);
        warnings.add(warning);
    }
}
