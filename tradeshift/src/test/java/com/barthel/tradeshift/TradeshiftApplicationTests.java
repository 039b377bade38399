package com.barthel.tradeshift;

import com.barthel.tradeshift.application.port.in.AnalyseScenariosUseCase;
import com.barthel.tradeshift.application.port.out.FetchDistanceMatrixPort;
import com.barthel.tradeshift.domain.model.AnalysisSettings;
import com.barthel.tradeshift.domain.model.EfficiencyNormalisation;
import com.barthel.tradeshift.domain.model.ScenarioAnalysis;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = {
        "tradeshift.analysis.random-attack-sample-size=2",
        "tradeshift.analysis.random-seed=5",
        "tradeshift.data.stability-index=classpath:fixtures/stability_index.csv"
})
class TradeshiftApplicationTests {

    @MockBean
    private FetchDistanceMatrixPort fetchDistanceMatrixPort;

    @Autowired
    private AnalysisSettings settings;

    @Autowired
    private AnalyseScenariosUseCase analyseScenariosUseCase;

    @Test
    void contextLoads() {
        assertThat(settings.normalisation()).isEqualTo(EfficiencyNormalisation.WEAK);
        assertThat(settings.randomAttackSampleSize()).isEqualTo(2);
        assertThat(settings.randomSeed()).isEqualTo(5L);
        assertThat(settings.anchorCountries()).isEmpty();
    }

    @Test
    void analysesScenariosThroughTheUseCase() {
        when(fetchDistanceMatrixPort.fetchDistanceMatrix(any())).thenReturn(Optional.empty());

        ScenarioAnalysis analysis = analyseScenariosUseCase.analyse(
                TradeNetworks.squareScenario("base"), List.of(TradeNetworks.squareScenario("copy")));

        assertThat(analysis.scenarioCount()).isEqualTo(2);
        assertThat(analysis.getStability()).isEmpty();
    }
}
