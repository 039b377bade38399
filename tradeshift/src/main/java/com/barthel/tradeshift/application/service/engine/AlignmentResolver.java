package com.barthel.tradeshift.application.service.engine;

import com.barthel.tradeshift.domain.model.AlignedCountries;
import com.barthel.tradeshift.domain.model.Scenario;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Finds the countries shared by the base scenario and each comparison scenario.
 * Shape-sensitive comparisons use these sets so both matrices have equal dimensions.
 */
@Component
@Slf4j
public class AlignmentResolver {

    /**
     * @return one entry per comparison scenario, with id 1 for the first comparison
     */
    public List<AlignedCountries> resolve(Scenario base, List<Scenario> comparisons) {
        List<AlignedCountries> aligned = new ArrayList<>(comparisons.size());
        for (int i = 0; i < comparisons.size(); i++) {
            aligned.add(resolve(base, comparisons.get(i), i + 1));
        }
        return aligned;
    }

    public AlignedCountries resolve(Scenario base, Scenario comparison, int scenarioId) {
        TreeSet<String> common = new TreeSet<>(comparison.graph().countries());
        common.retainAll(base.graph().countries());
        log.debug("Scenario {} shares {} of {} countries with the base scenario",
                scenarioId, common.size(), comparison.graph().size());
        return new AlignedCountries(scenarioId, new ArrayList<>(common));
    }
}
