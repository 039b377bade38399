package com.barthel.tradeshift.application.service.engine;

import com.barthel.tradeshift.application.port.out.FetchDistanceMatrixPort;
import com.barthel.tradeshift.application.port.out.FetchStabilityIndexPort;
import com.barthel.tradeshift.domain.model.AnalysisSettings;
import com.barthel.tradeshift.domain.model.CommunityPartition;
import com.barthel.tradeshift.domain.model.DistanceMatrix;
import com.barthel.tradeshift.domain.model.EfficiencyNormalisation;
import com.barthel.tradeshift.domain.model.MetricResult;
import com.barthel.tradeshift.domain.model.Scenario;
import com.barthel.tradeshift.domain.model.StabilityResult;
import com.barthel.tradeshift.domain.model.TradeGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StabilityEngineTest {

    private static final Map<String, Double> RISK = Map.of("A", 0.8, "B", 0.4);

    @Mock
    private FetchStabilityIndexPort fetchStabilityIndexPort;

    @Mock
    private FetchDistanceMatrixPort fetchDistanceMatrixPort;

    private DistanceMatrix distances;

    @BeforeEach
    void setUp() {
        distances = new DistanceMatrix(List.of("A", "B", "C"), new double[][]{
                {0, 1, 2},
                {1, 0, 4},
                {2, 4, 0}});
    }

    @Test
    void withoutDistanceDecayStabilityIsRiskWeightedExportShare() {
        StabilityEngine engine = engine(0.0);
        TradeGraph graph = graph();

        MetricResult<Map<String, Double>> stability =
                engine.nodeStability(graph, new CentralityEngine().outDegree(graph), RISK, distances);

        // out-degree centrality: A 0.75, B 0.25, C 0
        assertThat(stability.value().get("C")).isCloseTo(0.8 * 0.75 + 0.4 * 0.25, within(1e-12));
        assertThat(stability.value().get("A")).isCloseTo(0.4 * 0.25, within(1e-12));
        assertThat(stability.value().get("B")).isCloseTo(0.8 * 0.75, within(1e-12));
        assertThat(stability.hasWarnings()).isFalse();
    }

    @Test
    void distanceDecaysStability() {
        StabilityEngine engine = engine(1.0);
        TradeGraph graph = graph();

        MetricResult<Map<String, Double>> stability =
                engine.nodeStability(graph, new CentralityEngine().outDegree(graph), RISK, distances);

        assertThat(stability.value().get("C")).isCloseTo(0.8 * 0.75 / 2 + 0.4 * 0.25 / 4, within(1e-12));
    }

    @Test
    void exporterWithoutRiskScoreIsSkippedWithOneWarning() {
        StabilityEngine engine = engine(0.0);
        TradeGraph graph = graph();

        MetricResult<Map<String, Double>> stability = engine.nodeStability(
                graph, new CentralityEngine().outDegree(graph), Map.of("A", 0.8), distances);

        assertThat(stability.value().get("C")).isCloseTo(0.8 * 0.75, within(1e-12));
        assertThat(stability.warnings()).containsExactly("B not found in stability index");
    }

    @Test
    void relativeDifferenceIsUndefinedForZeroOrMissingBase() {
        MetricResult<Map<String, Double>> difference = engine(1.0).relativeDifference(
                Map.of("A", 2.0, "B", 0.0), Map.of("A", 3.0, "B", 1.0, "X", 1.0));

        assertThat(difference.value().get("A")).isCloseTo(0.5, within(1e-12));
        assertThat(difference.value().get("B")).isNaN();
        assertThat(difference.value().get("X")).isNaN();
        assertThat(difference.warnings()).containsExactly("X not found in the base scenario");
    }

    @Test
    void networkStabilityWeightsByImportShare() {
        double network = engine(1.0).networkStability(
                Map.of("A", 0.25, "C", 0.75), Map.of("A", 2.0, "C", 4.0));

        assertThat(network).isCloseTo(3.5, within(1e-12));
    }

    @Test
    void computesEveryScenarioOverOneDistanceMatrix() {
        StabilityEngine engine = engine(0.0);
        CentralityEngine centrality = new CentralityEngine();
        Scenario base = Scenario.of("base", graph(), CommunityPartition.of(Set.of("A", "B", "C")));
        TradeGraph shifted = TradeGraph.builder().flow("A", "C", 1).flow("B", "C", 3).build();
        Scenario shift = Scenario.of("shift", shifted, CommunityPartition.of(Set.of("A", "B", "C")));
        when(fetchDistanceMatrixPort.fetchDistanceMatrix(any())).thenReturn(Optional.of(distances));
        when(fetchStabilityIndexPort.fetchStabilityIndex()).thenReturn(RISK);

        MetricResult<Optional<StabilityResult>> result = engine.compute(List.of(base, shift),
                List.of(centrality.inDegree(base.graph()), centrality.inDegree(shifted)),
                List.of(centrality.outDegree(base.graph()), centrality.outDegree(shifted)));

        StabilityResult stability = result.value().orElseThrow();
        assertThat(stability.nodeStability()).hasSize(2);
        assertThat(stability.nodeStabilityDifference()).hasSize(1);
        // C imports everything, so network stability equals C's stability
        assertThat(stability.networkStability().get(0)).isCloseTo(0.7, within(1e-12));
        assertThat(stability.networkStability().get(1)).isCloseTo(0.8 * 0.25 + 0.4 * 0.75, within(1e-12));
        assertThat(stability.nodeStabilityDifference().get(0).get("C")).isCloseTo((0.5 - 0.7) / 0.7, within(1e-12));
        verify(fetchDistanceMatrixPort).fetchDistanceMatrix(argThat((Collection<String> countries) ->
                countries.containsAll(List.of("A", "B", "C")) && countries.size() == 3));
    }

    @Test
    void missingDistanceMatrixSkipsStability() {
        StabilityEngine engine = engine(1.0);
        Scenario base = Scenario.of("base", graph(), CommunityPartition.of(Set.of("A", "B", "C")));
        when(fetchDistanceMatrixPort.fetchDistanceMatrix(any())).thenReturn(Optional.empty());

        MetricResult<Optional<StabilityResult>> result =
                engine.compute(List.of(base), List.of(Map.of()), List.of(Map.of()));

        assertThat(result.value()).isEmpty();
        assertThat(result.warnings()).singleElement().asString().contains("Distance matrix unavailable");
        verifyNoInteractions(fetchStabilityIndexPort);
    }

    private StabilityEngine engine(double gamma) {
        AnalysisSettings settings = new AnalysisSettings(EfficiencyNormalisation.NONE, gamma, 2, null, null, null);
        return new StabilityEngine(fetchStabilityIndexPort, fetchDistanceMatrixPort, settings);
    }

    // A and B export to C, 3:1
    private static TradeGraph graph() {
        return TradeGraph.builder()
                .flow("A", "C", 3)
                .flow("B", "C", 1)
                .build();
    }
}
