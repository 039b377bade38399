package com.barthel.tradeshift.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Importer-indexed, exporter-columned table of traded volumes.
 *
 * @param flows importer -> (exporter -> volume)
 */
public record TradeMatrix(Map<String, Map<String, Double>> flows) {

    public TradeMatrix {
        if (flows == null) {
            throw new IllegalArgumentException("Trade flows are required");
        }
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        flows.forEach((importer, row) -> {
            row.forEach((exporter, volume) -> {
                if (volume == null || volume.isNaN() || volume < 0) {
                    throw new IllegalArgumentException(
                            "Trade volume must be non-negative: " + exporter + " -> " + importer);
                }
            });
            copy.put(importer, Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        });
        flows = Collections.unmodifiableMap(copy);
    }

    /**
     * Derives the matrix from a trade graph; every country gets a row, even
     * those that import nothing.
     */
    public static TradeMatrix fromGraph(TradeGraph graph) {
        Map<String, Map<String, Double>> rows = new LinkedHashMap<>();
        List<String> countries = graph.countries();
        for (String importer : countries) {
            Map<String, Double> row = new LinkedHashMap<>();
            for (String exporter : countries) {
                double volume = graph.weight(exporter, importer);
                if (volume != 0.0) {
                    row.put(exporter, volume);
                }
            }
            rows.put(importer, row);
        }
        return new TradeMatrix(rows);
    }

    public List<String> importers() {
        return List.copyOf(flows.keySet());
    }

    public double totalImports(String importer) {
        return flows.getOrDefault(importer, Map.of()).values().stream()
                .mapToDouble(Double::doubleValue)
                .sum();
    }
}
