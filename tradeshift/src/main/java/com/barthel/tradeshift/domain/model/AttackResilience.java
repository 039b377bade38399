package com.barthel.tradeshift.domain.model;

/**
 * Attack vulnerability of a scenario under the three removal strategies.
 *
 * @param export removal by decreasing out-degree centrality
 * @param entropic removal by decreasing entropic out-degree
 * @param random removal in random order, repeated
 */
public record AttackResilience(AttackCurve export, AttackCurve entropic, RandomAttackResult random) {
}
