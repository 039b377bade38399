package com.barthel.tradeshift.domain.model;

/**
 * Descriptive data of a scenario. Only used for display and for consistency
 * checks between scenarios, never in a computation.
 *
 * @param label scenario label, e.g. "nuclear winter"
 * @param commodity traded commodity, e.g. "Wheat"
 * @param baseYear base year of the trade data
 * @param communityAlgorithm name of the community detection algorithm
 * @param communityParameters parameters passed to that algorithm, as text
 */
public record ScenarioMetadata(
        String label,
        String commodity,
        String baseYear,
        String communityAlgorithm,
        String communityParameters) {

    public ScenarioMetadata {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Scenario label must not be blank");
        }
    }

    public static ScenarioMetadata of(String label) {
        return new ScenarioMetadata(label, null, null, null, null);
    }
}
