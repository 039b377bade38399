package com.barthel.tradeshift.domain.model;

import com.barthel.tradeshift.domain.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Denominator used by the graph efficiency metric.
 */
public enum EfficiencyNormalisation {
    /** Raw efficiency. */
    NONE("none"),
    /** Efficiency over the mean of actual and ideal-flow efficiency. */
    WEAK("weak"),
    /** Efficiency over the ideal-flow efficiency. */
    STRONG("strong");

    private final String value;

    EfficiencyNormalisation(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses a configured normalisation; a missing value means {@link #NONE}.
     *
     * @throws ConfigurationException for any other unrecognised value
     */
    public static EfficiencyNormalisation fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(n -> n.value.equals(normalised))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException(
                        "Unrecognised efficiency normalisation '" + value + "', expected one of none, weak, strong"));
    }
}
