package com.barthel.tradeshift.application.port.out;

import java.util.Map;

/**
 * Port for obtaining the per-country stability (governance/risk) score.
 */
public interface FetchStabilityIndexPort {
    /**
     * Fetch the stability score of every known country.
     *
     * @return country identifier to score; countries without a score are absent
     */
    Map<String, Double> fetchStabilityIndex();
}
