package com.barthel.tradeshift.domain.model;

import com.barthel.tradeshift.domain.exception.ConfigurationException;

import java.util.List;

/**
 * Validated configuration of an analysis run.
 *
 * @param normalisation denominator of the efficiency metric
 * @param gamma distance decay exponent of the node stability index
 * @param randomAttackSampleSize number of random attack trials, at least 2
 * @param anchorCountries countries whose communities are listed first, may be empty
 * @param randomSeed seed of the random attack, {@code null} for a fresh seed
 * @param roleThresholds thresholds for role classification
 */
public record AnalysisSettings(
        EfficiencyNormalisation normalisation,
        double gamma,
        int randomAttackSampleSize,
        List<String> anchorCountries,
        Long randomSeed,
        RoleThresholds roleThresholds) {

    public AnalysisSettings {
        if (normalisation == null) {
            throw new ConfigurationException("Efficiency normalisation is required");
        }
        if (Double.isNaN(gamma) || Double.isInfinite(gamma) || gamma < 0) {
            throw new ConfigurationException("Stability decay exponent gamma must be a finite value >= 0, got " + gamma);
        }
        if (randomAttackSampleSize < 2) {
            throw new ConfigurationException(
                    "Random attack sample size must be at least 2, got " + randomAttackSampleSize);
        }
        anchorCountries = anchorCountries == null ? List.of() : List.copyOf(anchorCountries);
        roleThresholds = roleThresholds == null ? RoleThresholds.DEFAULT : roleThresholds;
    }

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(EfficiencyNormalisation.WEAK, 1.0, 100, List.of(), null, RoleThresholds.DEFAULT);
    }
}
