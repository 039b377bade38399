package com.barthel.tradeshift.application.service.engine;

import com.barthel.tradeshift.domain.model.CommunityPartition;
import com.barthel.tradeshift.domain.model.MetricResult;
import com.barthel.tradeshift.domain.model.Scenario;
import com.barthel.tradeshift.domain.model.TradeGraph;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TradeFlowEngineTest {

    private final TradeFlowEngine engine = new TradeFlowEngine();

    @Test
    void importsPerCountry() {
        Map<String, Double> imports = engine.imports(scenario().tradeMatrix());

        assertThat(imports).containsEntry("B", 4.0).containsEntry("A", 0.0).containsEntry("C", 0.0);
    }

    @Test
    void relativeImportsDifferenceInPercent() {
        Map<String, Double> base = Map.of("A", 4.0, "B", 0.0);
        Map<String, Double> imports = new LinkedHashMap<>();
        imports.put("A", 3.0);
        imports.put("B", 2.0);
        imports.put("C", 1.0);

        MetricResult<Map<String, Double>> difference = engine.importsDifference(base, imports);

        assertThat(difference.value().get("A")).isCloseTo(-25.0, within(1e-12));
        assertThat(difference.value().get("B")).isZero();
        assertThat(difference.value().get("C")).isNaN();
        assertThat(difference.warnings()).containsExactly("C not found in the base scenario");
    }

    @Test
    void absoluteImportsDifference() {
        MetricResult<Map<String, Double>> difference =
                engine.importsDifferenceAbsolute(Map.of("A", 4.0), Map.of("A", 1.5));

        assertThat(difference.value()).containsEntry("A", -2.5);
        assertThat(difference.hasWarnings()).isFalse();
    }

    @Test
    void communitySatisfactionIsTheShareImportedFromTheOwnCommunity() {
        MetricResult<Map<String, Double>> satisfaction = engine.communitySatisfaction(scenario());

        assertThat(satisfaction.value()).containsEntry("B", 0.75).containsEntry("A", 0.0).containsEntry("C", 0.0);
        assertThat(satisfaction.hasWarnings()).isFalse();
    }

    @Test
    void countryWithoutCommunityHasUndefinedSatisfaction() {
        Scenario scenario = Scenario.of("partial", scenario().graph(), CommunityPartition.of(Set.of("A", "C")));

        MetricResult<Map<String, Double>> satisfaction = engine.communitySatisfaction(scenario);

        assertThat(satisfaction.value().get("B")).isNaN();
        assertThat(satisfaction.warnings()).containsExactly("B has no community in scenario partial");
    }

    @Test
    void satisfactionDifference() {
        MetricResult<Map<String, Double>> difference =
                engine.communitySatisfactionDifference(Map.of("B", 0.75), Map.of("B", 0.5, "X", 1.0));

        assertThat(difference.value()).containsEntry("B", -0.25);
        assertThat(difference.value().get("X")).isNaN();
        assertThat(difference.warnings()).hasSize(1);
    }

    private static Scenario scenario() {
        TradeGraph graph = TradeGraph.builder()
                .flow("A", "B", 3)
                .flow("C", "B", 1)
                .build();
        return Scenario.of("base", graph, CommunityPartition.of(Set.of("A", "B"), Set.of("C")));
    }
}
