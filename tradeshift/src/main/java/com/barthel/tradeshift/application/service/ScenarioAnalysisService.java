package com.barthel.tradeshift.application.service;

import com.barthel.tradeshift.application.port.in.AnalyseScenariosUseCase;
import com.barthel.tradeshift.application.service.engine.AlignmentResolver;
import com.barthel.tradeshift.application.service.engine.CentralityEngine;
import com.barthel.tradeshift.application.service.engine.CommunityComparator;
import com.barthel.tradeshift.application.service.engine.DistanceMetricsEngine;
import com.barthel.tradeshift.application.service.engine.PercolationEngine;
import com.barthel.tradeshift.application.service.engine.RoleClassifier;
import com.barthel.tradeshift.application.service.engine.StabilityEngine;
import com.barthel.tradeshift.application.service.engine.TradeFlowEngine;
import com.barthel.tradeshift.domain.graph.GraphAlgebra;
import com.barthel.tradeshift.domain.model.AlignedCountries;
import com.barthel.tradeshift.domain.model.AnalysisSettings;
import com.barthel.tradeshift.domain.model.AttackResilience;
import com.barthel.tradeshift.domain.model.DegreeExtrema;
import com.barthel.tradeshift.domain.model.DistanceMetricsRow;
import com.barthel.tradeshift.domain.model.MetricResult;
import com.barthel.tradeshift.domain.model.NodeRole;
import com.barthel.tradeshift.domain.model.Scenario;
import com.barthel.tradeshift.domain.model.ScenarioAnalysis;
import com.barthel.tradeshift.domain.model.ScenarioMetadata;
import com.barthel.tradeshift.domain.model.StabilityResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runs every analysis over a base scenario and its comparison scenarios, in
 * dependency order, and collects the results together with all data-quality
 * warnings raised on the way.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScenarioAnalysisService implements AnalyseScenariosUseCase {

    private final AnalysisSettings settings;
    private final AlignmentResolver alignmentResolver;
    private final TradeFlowEngine tradeFlowEngine;
    private final DistanceMetricsEngine distanceMetricsEngine;
    private final CentralityEngine centralityEngine;
    private final CommunityComparator communityComparator;
    private final RoleClassifier roleClassifier;
    private final StabilityEngine stabilityEngine;
    private final PercolationEngine percolationEngine;

    @Override
    public ScenarioAnalysis analyse(Scenario base, List<Scenario> comparisons) {
        log.info("Starting postprocessing computations for {} scenarios", comparisons.size() + 1);
        List<String> warnings = new ArrayList<>();
        checkMetadata(base, comparisons, warnings);

        log.info("Aligning countries with base scenario {}", base.label());
        List<AlignedCountries> aligned = alignmentResolver.resolve(base, comparisons);

        List<Scenario> scenarios = new ArrayList<>(comparisons.size() + 1);
        scenarios.add(arrange(base));
        comparisons.forEach(comparison -> scenarios.add(arrange(comparison)));
        Scenario arrangedBase = scenarios.get(0);
        List<Scenario> arrangedComparisons = scenarios.subList(1, scenarios.size());

        log.info("Computing imports");
        List<Map<String, Double>> imports = each(scenarios, s -> tradeFlowEngine.imports(s.tradeMatrix()));
        List<Map<String, Double>> importsDifference = new ArrayList<>();
        List<Map<String, Double>> importsDifferenceAbsolute = new ArrayList<>();
        for (int i = 1; i < scenarios.size(); i++) {
            importsDifference.add(collect(
                    tradeFlowEngine.importsDifference(imports.get(0), imports.get(i)), warnings));
            importsDifferenceAbsolute.add(collect(
                    tradeFlowEngine.importsDifferenceAbsolute(imports.get(0), imports.get(i)), warnings));
        }

        log.info("Computing community difference");
        List<Map<String, Double>> communityDifference = new ArrayList<>();
        for (int i = 1; i < scenarios.size(); i++) {
            communityDifference.add(collect(
                    communityComparator.communityDifference(arrangedBase, scenarios.get(i), i), warnings));
        }

        log.info("Computing distance metrics");
        List<DistanceMetricsRow> distances = collect(
                distanceMetricsEngine.compare(arrangedBase, arrangedComparisons, aligned), warnings);

        log.info("Computing degree centrality");
        List<Map<String, Double>> inDegree = each(scenarios, s -> centralityEngine.inDegree(s.graph()));
        List<Map<String, Double>> outDegree = each(scenarios, s -> centralityEngine.outDegree(s.graph()));
        List<DegreeExtrema> globalExtrema = new ArrayList<>(scenarios.size());
        List<List<DegreeExtrema>> communityExtrema = new ArrayList<>(scenarios.size());
        for (int i = 0; i < scenarios.size(); i++) {
            globalExtrema.add(centralityEngine.globalExtrema(i, inDegree.get(i), outDegree.get(i)));
            communityExtrema.add(centralityEngine.communityExtrema(
                    scenarios.get(i).communities(), inDegree.get(i), outDegree.get(i)));
        }

        log.info("Computing community satisfaction");
        List<Map<String, Double>> satisfaction = new ArrayList<>(scenarios.size());
        scenarios.forEach(s -> satisfaction.add(collect(tradeFlowEngine.communitySatisfaction(s), warnings)));
        List<Map<String, Double>> satisfactionDifference = new ArrayList<>();
        for (int i = 1; i < scenarios.size(); i++) {
            satisfactionDifference.add(collect(
                    tradeFlowEngine.communitySatisfactionDifference(satisfaction.get(0), satisfaction.get(i)),
                    warnings));
        }

        log.info("Computing efficiency with {} normalisation", settings.normalisation().value());
        List<Double> efficiency = each(scenarios, s -> GraphAlgebra.efficiency(s.graph(), settings.normalisation()));

        log.info("Computing clustering coefficient");
        List<Double> clustering = each(scenarios, s -> centralityEngine.averageClustering(s.graph()));

        log.info("Computing betweenness centrality");
        List<Double> betweenness = each(scenarios, s -> centralityEngine.meanBetweenness(s.graph()));

        log.info("Computing community roles");
        List<Map<String, Double>> zScores = each(scenarios,
                s -> communityComparator.withinCommunityDegree(s.graph(), s.communities()));
        List<Map<String, Double>> participation = each(scenarios,
                s -> communityComparator.participation(s.graph(), s.communities()));
        List<Map<String, NodeRole>> roles = new ArrayList<>(scenarios.size());
        for (int i = 0; i < scenarios.size(); i++) {
            roles.add(roleClassifier.classify(zScores.get(i), participation.get(i), settings.roleThresholds()));
        }

        log.info("Computing stability");
        Optional<StabilityResult> stability = collect(stabilityEngine.compute(scenarios, inDegree, outDegree), warnings);

        log.info("Computing attack resilience");
        List<Map<String, Double>> entropicOutDegree = each(scenarios,
                s -> centralityEngine.entropicOutDegree(s.graph()));
        List<AttackResilience> percolation = new ArrayList<>(scenarios.size());
        for (int i = 0; i < scenarios.size(); i++) {
            percolation.add(percolationEngine.resilience(
                    scenarios.get(i).graph(), outDegree.get(i), entropicOutDegree.get(i)));
        }

        log.info("Finished postprocessing computations with {} warnings", warnings.size());
        return ScenarioAnalysis.builder()
                .labels(List.copyOf(each(scenarios, Scenario::label)))
                .aligned(List.copyOf(aligned))
                .communities(List.copyOf(each(scenarios, Scenario::communities)))
                .imports(frozenMaps(imports))
                .importsDifference(frozenMaps(importsDifference))
                .importsDifferenceAbsolute(frozenMaps(importsDifferenceAbsolute))
                .communityDifference(frozenMaps(communityDifference))
                .distances(List.copyOf(distances))
                .inDegree(frozenMaps(inDegree))
                .outDegree(frozenMaps(outDegree))
                .globalExtrema(List.copyOf(globalExtrema))
                .communityExtrema(communityExtrema.stream().map(List::copyOf).toList())
                .communitySatisfaction(frozenMaps(satisfaction))
                .communitySatisfactionDifference(frozenMaps(satisfactionDifference))
                .efficiency(List.copyOf(efficiency))
                .clustering(List.copyOf(clustering))
                .betweenness(List.copyOf(betweenness))
                .withinCommunityDegree(frozenMaps(zScores))
                .participation(frozenMaps(participation))
                .roles(frozenMaps(roles))
                .stability(stability.orElse(null))
                .entropicOutDegree(frozenMaps(entropicOutDegree))
                .percolation(List.copyOf(percolation))
                .warnings(List.copyOf(warnings))
                .build();
    }

    private Scenario arrange(Scenario scenario) {
        if (settings.anchorCountries().isEmpty()) {
            return scenario;
        }
        return scenario.withCommunities(
                communityComparator.arrange(scenario.communities(), settings.anchorCountries()));
    }

    private void checkMetadata(Scenario base, List<Scenario> comparisons, List<String> warnings) {
        ScenarioMetadata reference = base.metadata();
        for (Scenario comparison : comparisons) {
            ScenarioMetadata metadata = comparison.metadata();
            if (!Objects.equals(reference.communityAlgorithm(), metadata.communityAlgorithm())) {
                warn(warnings, "Scenario " + metadata.label() + " detects communities with "
                        + metadata.communityAlgorithm() + " instead of " + reference.communityAlgorithm());
            }
            if (!Objects.equals(reference.communityParameters(), metadata.communityParameters())) {
                warn(warnings, "Scenario " + metadata.label() + " detects communities with parameters "
                        + metadata.communityParameters() + " instead of " + reference.communityParameters());
            }
        }
    }

    private static <T> List<T> each(List<Scenario> scenarios, Function<Scenario, T> metric) {
        List<T> values = new ArrayList<>(scenarios.size());
        for (Scenario scenario : scenarios) {
            values.add(metric.apply(scenario));
        }
        return values;
    }

    private static <V> List<Map<String, V>> frozenMaps(List<Map<String, V>> maps) {
        List<Map<String, V>> copy = new ArrayList<>(maps.size());
        maps.forEach(map -> copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(map))));
        return Collections.unmodifiableList(copy);
    }

    private static <T> T collect(MetricResult<T> result, List<String> warnings) {
        warnings.addAll(result.warnings());
        return result.value();
    }

    private void warn(List<String> warnings, String warning) {
        log.warn(warning);
        warnings.add(warning);
    }
}
