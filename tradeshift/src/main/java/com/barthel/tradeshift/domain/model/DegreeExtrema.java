package com.barthel.tradeshift.domain.model;

/**
 * Smallest and largest in/out-degree centrality within a scenario or one of its communities.
 *
 * @param id scenario id for global extrema, community id for per-community extrema
 * @param minIn smallest in-degree centrality
 * @param maxIn largest in-degree centrality
 * @param minOut smallest out-degree centrality
 * @param maxOut largest out-degree centrality
 */
public record DegreeExtrema(int id, Extremum minIn, Extremum maxIn, Extremum minOut, Extremum maxOut) {
}
