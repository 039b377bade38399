package com.barthel.tradeshift.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A computed value together with the data-quality warnings raised while computing it.
 *
 * @param value the computed value, entries affected by a warning hold NaN or are absent
 * @param warnings warnings in the order they were raised
 */
public record MetricResult<T>(T value, List<String> warnings) {

    public MetricResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static <T> MetricResult<T> of(T value) {
        return new MetricResult<>(value, List.of());
    }

    public static <T> MetricResult<T> of(T value, Collection<String> warnings) {
        return new MetricResult<>(value, new ArrayList<>(warnings));
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
