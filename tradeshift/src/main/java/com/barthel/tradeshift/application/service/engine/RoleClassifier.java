package com.barthel.tradeshift.application.service.engine;

import com.barthel.tradeshift.domain.model.NodeRole;
import com.barthel.tradeshift.domain.model.RoleThresholds;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps (within-community z-score, participation coefficient) pairs to functional roles.
 */
@Component
public class RoleClassifier {

    public NodeRole classify(double zScore, double participation, RoleThresholds thresholds) {
        if (Double.isNaN(zScore) || Double.isNaN(participation)) {
            return NodeRole.UNDEFINED;
        }
        List<Double> p = thresholds.participation();
        if (zScore < thresholds.hubZScore()) {
            if (participation <= p.get(0)) {
                return NodeRole.ULTRA_PERIPHERAL;
            }
            if (participation <= p.get(2)) {
                return NodeRole.PERIPHERAL;
            }
            if (participation <= p.get(4)) {
                return NodeRole.NON_HUB_CONNECTOR;
            }
            return NodeRole.NON_HUB_KINLESS;
        }
        if (participation <= p.get(1)) {
            return NodeRole.PROVINCIAL_HUB;
        }
        if (participation <= p.get(3)) {
            return NodeRole.CONNECTOR_HUB;
        }
        return NodeRole.KINLESS_HUB;
    }

    /**
     * Roles of every country that has a participation coefficient; countries
     * without a z-score are {@link NodeRole#UNDEFINED}.
     */
    public Map<String, NodeRole> classify(
            Map<String, Double> zScores, Map<String, Double> participation, RoleThresholds thresholds) {
        Map<String, NodeRole> roles = new LinkedHashMap<>();
        participation.forEach((country, p) ->
                roles.put(country, classify(zScores.getOrDefault(country, Double.NaN), p, thresholds)));
        return roles;
    }
}
