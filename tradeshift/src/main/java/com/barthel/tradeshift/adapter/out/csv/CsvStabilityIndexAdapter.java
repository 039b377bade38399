package com.barthel.tradeshift.adapter.out.csv;

import com.barthel.tradeshift.application.port.out.FetchStabilityIndexPort;
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
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the per-country stability index from a two-column CSV table with the
 * header {@code country,index}.
 */
@Component
@Slf4j
public class CsvStabilityIndexAdapter implements FetchStabilityIndexPort {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final ResourceLoader resourceLoader;
    private final String location;

    public CsvStabilityIndexAdapter(ResourceLoader resourceLoader,
                                    @Value("${tradeshift.data.stability-index:classpath:data/stability_index.csv}")
                                    String location) {
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    @Override
    public Map<String, Double> fetchStabilityIndex() {
        log.info("Reading stability index from {}", location);
        Resource resource = resourceLoader.getResource(location);
        Map<String, Double> index = new LinkedHashMap<>();
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, FORMAT)) {
            for (CSVRecord record : parser) {
                String country = record.get("country");
                String value = record.get("index");
                if (value == null || value.isEmpty()) {
                    log.warn("No stability index for {} in {}", country, location);
                    continue;
                }
                try {
                    index.put(country, Double.parseDouble(value));
                } catch (NumberFormatException e) {
                    log.warn("Invalid stability index '{}' for {} in {}", value, country, location);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read stability index from " + location, e);
        }
        log.debug("Read stability index of {} countries", index.size());
        return index;
    }
}
