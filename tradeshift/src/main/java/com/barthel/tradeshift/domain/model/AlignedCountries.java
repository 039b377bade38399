package com.barthel.tradeshift.domain.model;

import java.util.List;

/**
 * Countries present in both the base scenario and a comparison scenario,
 * sorted lexicographically.
 *
 * @param scenarioId id of the comparison scenario (1-based, base is 0)
 * @param countries the common countries
 */
public record AlignedCountries(int scenarioId, List<String> countries) {

    public AlignedCountries {
        countries = List.copyOf(countries);
    }

    public boolean isEmpty() {
        return countries.isEmpty();
    }
}
