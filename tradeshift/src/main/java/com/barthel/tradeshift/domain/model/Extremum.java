package com.barthel.tradeshift.domain.model;

/**
 * A country holding an extreme value of some metric.
 *
 * @param country the country, {@code null} when there was nothing to compare
 * @param value the metric value, NaN when there was nothing to compare
 */
public record Extremum(String country, double value) {

    public static final Extremum NONE = new Extremum(null, Double.NaN);

    public boolean isPresent() {
        return country != null;
    }
}
