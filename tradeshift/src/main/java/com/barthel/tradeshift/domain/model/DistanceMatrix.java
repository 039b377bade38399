package com.barthel.tradeshift.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Symmetric matrix of geographic distances between countries.
 */
public final class DistanceMatrix {

    private final Map<String, Integer> index;
    private final double[][] distances;

    public DistanceMatrix(List<String> countries, double[][] distances) {
        if (distances.length != countries.size()) {
            throw new IllegalArgumentException("Distance matrix must have one row per country");
        }
        Map<String, Integer> positions = new LinkedHashMap<>();
        for (int i = 0; i < countries.size(); i++) {
            if (distances[i].length != countries.size()) {
                throw new IllegalArgumentException("Distance matrix must be square");
            }
            positions.put(countries.get(i), i);
        }
        this.index = Collections.unmodifiableMap(positions);
        this.distances = new double[distances.length][];
        for (int i = 0; i < distances.length; i++) {
            this.distances[i] = distances[i].clone();
        }
    }

    public boolean contains(String country) {
        return index.containsKey(country);
    }

    public List<String> countries() {
        return List.copyOf(index.keySet());
    }

    public double distance(String from, String to) {
        Integer i = index.get(from);
        Integer j = index.get(to);
        if (i == null || j == null) {
            throw new IllegalArgumentException("No distance known between " + from + " and " + to);
        }
        return distances[i][j];
    }
}
