package com.barthel.tradeshift.application.service.engine;

import com.barthel.tradeshift.domain.model.NodeRole;
import com.barthel.tradeshift.domain.model.RoleThresholds;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RoleClassifierTest {

    private final RoleClassifier classifier = new RoleClassifier();

    @ParameterizedTest
    @CsvSource({
            "0.0, 0.00, ULTRA_PERIPHERAL",
            "0.0, 0.20, PERIPHERAL",
            "0.5, 0.70, NON_HUB_CONNECTOR",
            "0.5, 0.90, NON_HUB_KINLESS",
            "2.0, 0.10, PROVINCIAL_HUB",
            "2.0, 0.70, CONNECTOR_HUB",
            "1.0, 0.76, KINLESS_HUB"
    })
    void classifiesByDefaultThresholds(double zScore, double participation, NodeRole expected) {
        assertThat(classifier.classify(zScore, participation, RoleThresholds.DEFAULT)).isEqualTo(expected);
    }

    @Test
    void undefinedZScoreHasNoRole() {
        assertThat(classifier.classify(Double.NaN, 0.5, RoleThresholds.DEFAULT)).isEqualTo(NodeRole.UNDEFINED);
    }

    @Test
    void classifiesEveryCountryWithParticipation() {
        Map<String, NodeRole> roles = classifier.classify(
                Map.of("A", 2.0), Map.of("A", 0.0, "B", 0.0), RoleThresholds.DEFAULT);

        assertThat(roles).containsEntry("A", NodeRole.PROVINCIAL_HUB).containsEntry("B", NodeRole.UNDEFINED);
        assertThat(roles.get("A").isHub()).isTrue();
        assertThat(roles.get("A").code()).isEqualTo("R5");
    }
}
