package com.barthel.tradeshift.adapter.out.geo;

import com.barthel.tradeshift.application.port.out.FetchDistanceMatrixPort;
import com.barthel.tradeshift.domain.model.DistanceMatrix;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds great-circle distances between country centroids read from a CSV
 * table with the header {@code country,latitude,longitude}.
 */
@Component
@Slf4j
public class CentroidDistanceAdapter implements FetchDistanceMatrixPort {

    static final double EARTH_RADIUS_KM = 6371.0;

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final ResourceLoader resourceLoader;
    private final String location;

    public CentroidDistanceAdapter(ResourceLoader resourceLoader,
                                   @Value("${tradeshift.data.country-centroids:classpath:data/country_centroids.csv}")
                                   String location) {
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    /**
     * @return empty when the centroid table cannot be read or lacks one of the countries
     */
    @Override
    public Optional<DistanceMatrix> fetchDistanceMatrix(Collection<String> countries) {
        Map<String, double[]> centroids;
        try {
            centroids = readCentroids();
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Could not read country centroids from {}: {}", location, e.getMessage());
            return Optional.empty();
        }
        List<String> order = new ArrayList<>(countries);
        List<String> unresolved = order.stream().filter(country -> !centroids.containsKey(country)).toList();
        if (!unresolved.isEmpty()) {
            log.warn("No centroid for countries {}", unresolved);
            return Optional.empty();
        }
        int n = order.size();
        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            double[] from = centroids.get(order.get(i));
            for (int j = i + 1; j < n; j++) {
                double[] to = centroids.get(order.get(j));
                distances[i][j] = haversineKm(from[0], from[1], to[0], to[1]);
                distances[j][i] = distances[i][j];
            }
        }
        log.debug("Built distance matrix over {} countries", n);
        return Optional.of(new DistanceMatrix(order, distances));
    }

    private Map<String, double[]> readCentroids() throws IOException {
        Resource resource = resourceLoader.getResource(location);
        Map<String, double[]> centroids = new HashMap<>();
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, FORMAT)) {
            for (CSVRecord record : parser) {
                centroids.put(record.get("country"), new double[]{
                        Double.parseDouble(record.get("latitude")),
                        Double.parseDouble(record.get("longitude"))});
            }
        }
        return centroids;
    }

    /**
     * Haversine distance in kilometres.
     */
    static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return EARTH_RADIUS_KM * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }
}
