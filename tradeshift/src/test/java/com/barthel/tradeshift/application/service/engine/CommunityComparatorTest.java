package com.barthel.tradeshift.application.service.engine;

import com.barthel.tradeshift.TradeNetworks;
import com.barthel.tradeshift.domain.exception.ConfigurationException;
import com.barthel.tradeshift.domain.model.CommunityPartition;
import com.barthel.tradeshift.domain.model.MetricResult;
import com.barthel.tradeshift.domain.model.Scenario;
import com.barthel.tradeshift.domain.model.TradeGraph;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CommunityComparatorTest {

    private final CommunityComparator comparator = new CommunityComparator();

    @Test
    void anchoredCommunitiesComeFirstInAnchorOrder() {
        CommunityPartition partition = CommunityPartition.of(Set.of("A"), Set.of("B", "C"), Set.of("D"), Set.of("E"));

        CommunityPartition arranged = comparator.arrange(partition, List.of("D", "B"));

        assertThat(arranged.communities()).containsExactly(Set.of("D"), Set.of("B", "C"), Set.of("A"), Set.of("E"));
        assertThat(partition.community(0)).isEqualTo(Set.of("A"));
    }

    @Test
    void anchorWithoutCommunityIsSkipped() {
        CommunityPartition partition = CommunityPartition.of(Set.of("A"), Set.of("B"));

        CommunityPartition arranged = comparator.arrange(partition, List.of("X", "B"));

        assertThat(arranged.communities()).containsExactly(Set.of("B"), Set.of("A"));
    }

    @Test
    void anchorsSharingACommunityAreRejected() {
        CommunityPartition partition = CommunityPartition.of(Set.of("A", "B"), Set.of("C"));

        assertThatThrownBy(() -> comparator.arrange(partition, List.of("A", "B")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("same community");
    }

    @Test
    void jaccardIsSymmetric() {
        Set<String> a = Set.of("A", "B", "C");
        Set<String> b = Set.of("B", "C", "D", "E");

        assertThat(CommunityComparator.jaccard(a, b)).isEqualTo(CommunityComparator.jaccard(b, a)).isEqualTo(0.4);
        assertThat(CommunityComparator.jaccard(a, a)).isEqualTo(1.0);
        assertThat(CommunityComparator.jaccard(a, Set.of("X"))).isZero();
        assertThat(CommunityComparator.jaccard(Set.of(), Set.of())).isZero();
    }

    @Test
    void identicalCommunitiesHaveJaccardOne() {
        Scenario base = TradeNetworks.squareScenario("base");
        Scenario copy = TradeNetworks.squareScenario("copy");

        MetricResult<Map<String, Double>> result = comparator.communityDifference(base, copy, 1);

        assertThat(result.hasWarnings()).isFalse();
        assertThat(result.value()).containsOnlyKeys("A", "B", "C", "D")
                .allSatisfy((country, jaccard) -> assertThat(jaccard).isEqualTo(1.0));
    }

    @Test
    void countryWithoutCommunityIsSkippedWithWarning() {
        Scenario base = TradeNetworks.squareScenario("base");
        Scenario split = Scenario.of("split", TradeNetworks.square(),
                CommunityPartition.of(Set.of("A", "B", "C")));

        MetricResult<Map<String, Double>> result = comparator.communityDifference(base, split, 1);

        assertThat(result.value()).doesNotContainKey("D");
        assertThat(result.value().get("A")).isCloseTo(0.5, within(1e-12));
        assertThat(result.warnings()).containsExactly("D has no community in scenario 1");
    }

    @Test
    void withinCommunityDegreeZScore() {
        Map<String, Double> scores = comparator.withinCommunityDegree(roleGraph(), roleCommunities());

        assertThat(scores.get("B")).isCloseTo(Math.sqrt(2), within(1e-12));
        assertThat(scores.get("A")).isCloseTo(-1 / Math.sqrt(2), within(1e-12));
        assertThat(scores.get("C")).isCloseTo(-1 / Math.sqrt(2), within(1e-12));
        assertThat(scores.get("D")).isNaN();
    }

    @Test
    void participationCoefficient() {
        TradeGraph graph = TradeGraph.builder().country("Z").build();
        Map<String, Double> participation = comparator.participation(roleGraph(), roleCommunities());

        assertThat(participation.get("A")).isCloseTo(0.5, within(1e-12));
        assertThat(participation.get("B")).isZero();
        assertThat(participation.get("D")).isZero();
        assertThat(participation.values()).allSatisfy(p -> assertThat(p).isBetween(0.0, 1.0));
        assertThat(comparator.participation(graph, CommunityPartition.of(Set.of("Z")))).containsEntry("Z", 0.0);
    }

    @Test
    void selfLoopsDoNotCountAsNeighbours() {
        TradeGraph graph = TradeGraph.builder().flow("A", "A", 5).flow("A", "B", 1).build();

        Map<String, Double> participation =
                comparator.participation(graph, CommunityPartition.of(Set.of("A"), Set.of("B")));

        assertThat(participation.get("A")).isZero();
    }

    // A - B - C form one community, D hangs off A in its own community
    private static TradeGraph roleGraph() {
        return TradeGraph.builder()
                .flow("A", "B", 1)
                .flow("B", "C", 1)
                .flow("A", "D", 1)
                .build();
    }

    private static CommunityPartition roleCommunities() {
        return CommunityPartition.of(Set.of("A", "B", "C"), Set.of("D"));
    }
}
