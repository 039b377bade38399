package com.barthel.tradeshift.domain.model;

import java.util.List;

/**
 * Aggregate of repeated random attacks.
 *
 * @param meanThreshold mean collapse threshold over the trials
 * @param standardError standard error of the mean threshold
 * @param trials every trial's curve, for plotting a confidence band
 */
public record RandomAttackResult(double meanThreshold, double standardError, List<AttackCurve> trials) {

    public RandomAttackResult {
        trials = List.copyOf(trials);
    }
}
