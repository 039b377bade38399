package com.barthel.tradeshift.application.service.engine;

import com.barthel.tradeshift.domain.model.MetricResult;
import com.barthel.tradeshift.domain.model.Scenario;
import com.barthel.tradeshift.domain.model.TradeGraph;
import com.barthel.tradeshift.domain.model.TradeMatrix;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Import volumes and community self-sufficiency of each country, and how they
 * change relative to the base scenario.
 */
@Service
@Slf4j
public class TradeFlowEngine {

    /**
     * Total imports of every importer of the trade matrix.
     */
    public Map<String, Double> imports(TradeMatrix tradeMatrix) {
        Map<String, Double> imports = new LinkedHashMap<>();
        for (String importer : tradeMatrix.importers()) {
            imports.put(importer, tradeMatrix.totalImports(importer));
        }
        return imports;
    }

    /**
     * Relative change of imports vs base, in percent. A country importing
     * nothing in the base scenario has a change of 0.
     */
    public MetricResult<Map<String, Double>> importsDifference(Map<String, Double> base, Map<String, Double> imports) {
        List<String> warnings = new ArrayList<>();
        Map<String, Double> difference = new LinkedHashMap<>();
        imports.forEach((country, volume) -> {
            Double baseVolume = base.get(country);
            if (baseVolume == null) {
                warn(warnings, country + " not found in the base scenario");
                difference.put(country, Double.NaN);
            } else if (baseVolume == 0.0) {
                difference.put(country, 0.0);
            } else {
                difference.put(country, (volume - baseVolume) / baseVolume * 100.0);
            }
        });
        return MetricResult.of(difference, warnings);
    }

    public MetricResult<Map<String, Double>> importsDifferenceAbsolute(
            Map<String, Double> base, Map<String, Double> imports) {
        return difference(base, imports);
    }

    /**
     * Share of each country's imports supplied by members of its own community
     * (Wang et al., 2023). Countries without imports score 0, countries without
     * a community score NaN.
     */
    public MetricResult<Map<String, Double>> communitySatisfaction(Scenario scenario) {
        List<String> warnings = new ArrayList<>();
        TradeGraph graph = scenario.graph();
        Map<String, Double> satisfaction = new LinkedHashMap<>();
        for (String country : graph.countries()) {
            Optional<Set<String>> community = scenario.communities().communityOf(country);
            if (community.isEmpty()) {
                warn(warnings, country + " has no community in scenario " + scenario.label());
                satisfaction.put(country, Double.NaN);
                continue;
            }
            double total = 0.0;
            double internal = 0.0;
            for (String exporter : graph.countries()) {
                double volume = graph.weight(exporter, country);
                total += volume;
                if (community.get().contains(exporter)) {
                    internal += volume;
                }
            }
            satisfaction.put(country, total == 0.0 ? 0.0 : internal / total);
        }
        return MetricResult.of(satisfaction, warnings);
    }

    public MetricResult<Map<String, Double>> communitySatisfactionDifference(
            Map<String, Double> base, Map<String, Double> satisfaction) {
        return difference(base, satisfaction);
    }

    private MetricResult<Map<String, Double>> difference(Map<String, Double> base, Map<String, Double> values) {
        List<String> warnings = new ArrayList<>();
        Map<String, Double> difference = new LinkedHashMap<>();
        values.forEach((country, value) -> {
            Double baseValue = base.get(country);
            if (baseValue == null) {
                warn(warnings, country + " not found in the base scenario");
                difference.put(country, Double.NaN);
            } else {
                difference.put(country, value - baseValue);
            }
        });
        return MetricResult.of(difference, warnings);
    }

    private void warn(List<String> warnings, String warning) {
        log.warn(warning);
        warnings.add(warning);
    }
}
