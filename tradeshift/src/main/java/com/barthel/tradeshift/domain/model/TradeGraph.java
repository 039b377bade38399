package com.barthel.tradeshift.domain.model;

import org.jgrapht.Graph;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DefaultDirectedWeightedGraph;
import org.jgrapht.graph.DefaultWeightedEdge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Weighted directed trade network. Nodes are country identifiers, an edge
 * {@code exporter -> importer} carries the traded volume.
 * <p>
 * Instances are immutable; use {@link #builder()} to create one. Repeated flows
 * between the same pair of countries are summed.
 */
public final class TradeGraph {

    private final Graph<String, DefaultWeightedEdge> graph;
    private final List<String> countries;

    private TradeGraph(Graph<String, DefaultWeightedEdge> graph) {
        this.graph = new AsUnmodifiableGraph<>(graph);
        this.countries = Collections.unmodifiableList(new ArrayList<>(graph.vertexSet()));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Countries in insertion order.
     */
    public List<String> countries() {
        return countries;
    }

    public int size() {
        return countries.size();
    }

    public boolean contains(String country) {
        return graph.containsVertex(country);
    }

    /**
     * Volume flowing from {@code exporter} to {@code importer}, 0 if there is no such edge.
     */
    public double weight(String exporter, String importer) {
        if (!graph.containsVertex(exporter) || !graph.containsVertex(importer)) {
            return 0.0;
        }
        DefaultWeightedEdge edge = graph.getEdge(exporter, importer);
        return edge == null ? 0.0 : graph.getEdgeWeight(edge);
    }

    public double totalWeight() {
        return graph.edgeSet().stream().mapToDouble(graph::getEdgeWeight).sum();
    }

    /**
     * Read-only JGraphT view of the network.
     */
    public Graph<String, DefaultWeightedEdge> asGraph() {
        return graph;
    }

    public static final class Builder {

        private final Graph<String, DefaultWeightedEdge> graph =
                new DefaultDirectedWeightedGraph<>(DefaultWeightedEdge.class);

        private Builder() {
        }

        public Builder country(String country) {
            if (country == null || country.isBlank()) {
                throw new IllegalArgumentException("Country identifier must not be blank");
            }
            graph.addVertex(country);
            return this;
        }

        public Builder flow(String exporter, String importer, double volume) {
            if (Double.isNaN(volume) || volume < 0) {
                throw new IllegalArgumentException(
                        "Flow volume must be non-negative: " + exporter + " -> " + importer + " = " + volume);
            }
            country(exporter);
            country(importer);
            DefaultWeightedEdge edge = graph.getEdge(exporter, importer);
            if (edge == null) {
                edge = graph.addEdge(exporter, importer);
                graph.setEdgeWeight(edge, volume);
            } else {
                graph.setEdgeWeight(edge, graph.getEdgeWeight(edge) + volume);
            }
            return this;
        }

        public TradeGraph build() {
            Graph<String, DefaultWeightedEdge> copy =
                    new DefaultDirectedWeightedGraph<>(DefaultWeightedEdge.class);
            graph.vertexSet().forEach(copy::addVertex);
            for (DefaultWeightedEdge edge : graph.edgeSet()) {
                DefaultWeightedEdge copied = copy.addEdge(graph.getEdgeSource(edge), graph.getEdgeTarget(edge));
                copy.setEdgeWeight(copied, graph.getEdgeWeight(edge));
            }
            return new TradeGraph(copy);
        }
    }
}
