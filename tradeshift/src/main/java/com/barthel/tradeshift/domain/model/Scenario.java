package com.barthel.tradeshift.domain.model;

/**
 * One trade network state: the weighted graph, its trade matrix and its
 * community partition.
 *
 * @param metadata descriptive data
 * @param graph weighted directed trade network
 * @param tradeMatrix importer x exporter table consistent with the graph
 * @param communities community partition of the graph's countries
 */
public record Scenario(
        ScenarioMetadata metadata,
        TradeGraph graph,
        TradeMatrix tradeMatrix,
        CommunityPartition communities) {

    public Scenario {
        if (metadata == null || graph == null || tradeMatrix == null || communities == null) {
            throw new IllegalArgumentException("Scenario metadata, graph, trade matrix and communities are required");
        }
    }

    public static Scenario of(String label, TradeGraph graph, CommunityPartition communities) {
        return new Scenario(ScenarioMetadata.of(label), graph, TradeMatrix.fromGraph(graph), communities);
    }

    public String label() {
        return metadata.label();
    }

    /**
     * Same scenario with its communities in a different order.
     */
    public Scenario withCommunities(CommunityPartition reordered) {
        return new Scenario(metadata, graph, tradeMatrix, reordered);
    }
}
