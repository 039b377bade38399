package com.barthel.tradeshift.domain.model;

import java.util.List;

/**
 * Thresholds of the functional role cartography.
 *
 * @param hubZScore within-community degree z-score from which a country is a hub
 * @param participation five ascending participation coefficient boundaries
 */
public record RoleThresholds(double hubZScore, List<Double> participation) {

    public static final RoleThresholds DEFAULT = new RoleThresholds(1.0, List.of(0.05, 0.3, 0.62, 0.75, 0.8));

    public RoleThresholds {
        if (participation == null || participation.size() != 5) {
            throw new IllegalArgumentException("Exactly five participation thresholds are required");
        }
        for (int i = 1; i < participation.size(); i++) {
            if (participation.get(i) < participation.get(i - 1)) {
                throw new IllegalArgumentException("Participation thresholds must be ascending");
            }
        }
        participation = List.copyOf(participation);
    }
}
