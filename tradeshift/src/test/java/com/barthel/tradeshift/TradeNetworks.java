package com.barthel.tradeshift;

import com.barthel.tradeshift.domain.model.CommunityPartition;
import com.barthel.tradeshift.domain.model.Scenario;
import com.barthel.tradeshift.domain.model.TradeGraph;

import java.util.Set;

/**
 * Small trade networks shared by the tests.
 */
public final class TradeNetworks {

    private TradeNetworks() {
    }

    /**
     * Strongly connected four-country network.
     */
    public static TradeGraph square() {
        return TradeGraph.builder()
                .flow("A", "B", 10)
                .flow("B", "C", 5)
                .flow("C", "D", 8)
                .flow("D", "A", 4)
                .flow("A", "C", 2)
                .flow("C", "A", 3)
                .build();
    }

    public static CommunityPartition squareCommunities() {
        return CommunityPartition.of(Set.of("A", "B"), Set.of("C", "D"));
    }

    public static Scenario squareScenario(String label) {
        return Scenario.of(label, square(), squareCommunities());
    }

    /**
     * A -> B -> C with unit volumes.
     */
    public static TradeGraph line() {
        return TradeGraph.builder()
                .flow("A", "B", 1)
                .flow("B", "C", 1)
                .build();
    }

    /**
     * A -> B -> C -> A with unit volumes.
     */
    public static TradeGraph cycle() {
        return TradeGraph.builder()
                .flow("A", "B", 1)
                .flow("B", "C", 1)
                .flow("C", "A", 1)
                .build();
    }

    /**
     * Every country exports one unit to every other country.
     */
    public static TradeGraph complete(String... countries) {
        TradeGraph.Builder builder = TradeGraph.builder();
        for (String exporter : countries) {
            for (String importer : countries) {
                if (!exporter.equals(importer)) {
                    builder.flow(exporter, importer, 1);
                }
            }
        }
        return builder.build();
    }
}
