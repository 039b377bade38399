package com.barthel.tradeshift.domain.graph;

/**
 * Direction of trade flow relative to a country.
 */
public enum FlowDirection {
    /** Imports, i.e. incoming edges. */
    IN,
    /** Exports, i.e. outgoing edges. */
    OUT
}
