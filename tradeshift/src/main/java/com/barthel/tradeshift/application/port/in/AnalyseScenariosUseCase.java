package com.barthel.tradeshift.application.port.in;

import com.barthel.tradeshift.domain.model.Scenario;
import com.barthel.tradeshift.domain.model.ScenarioAnalysis;

import java.util.List;

/**
 * Use case for comparing trade network scenarios against a base scenario.
 */
public interface AnalyseScenariosUseCase {
    /**
     * Computes every structural, centrality, community, stability and
     * resilience metric of the given scenarios.
     *
     * @param base the reference scenario, id 0
     * @param comparisons the scenarios compared against the base, ids 1..n in order
     * @return the metrics of the run
     */
    ScenarioAnalysis analyse(Scenario base, List<Scenario> comparisons);
}
