package com.barthel.tradeshift.config;

import com.barthel.tradeshift.domain.model.AnalysisSettings;
import com.barthel.tradeshift.domain.model.EfficiencyNormalisation;
import com.barthel.tradeshift.domain.model.RoleThresholds;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Binds the {@code tradeshift.analysis} properties.
 */
@Configuration
@Slf4j
public class AnalysisConfig {

    @Bean
    public AnalysisSettings analysisSettings(
            @Value("${tradeshift.analysis.normalisation:weak}") String normalisation,
            @Value("${tradeshift.analysis.gamma:1.0}") double gamma,
            @Value("${tradeshift.analysis.random-attack-sample-size:100}") int randomAttackSampleSize,
            @Value("${tradeshift.analysis.anchor-countries:}") List<String> anchorCountries,
            @Value("${tradeshift.analysis.random-seed:#{null}}") Long randomSeed,
            @Value("${tradeshift.analysis.roles.hub-z-score:1.0}") double hubZScore,
            @Value("${tradeshift.analysis.roles.participation:0.05,0.3,0.62,0.75,0.8}") List<Double> participation) {
        AnalysisSettings settings = new AnalysisSettings(
                EfficiencyNormalisation.fromValue(normalisation),
                gamma,
                randomAttackSampleSize,
                anchorCountries.stream().map(String::trim).filter(country -> !country.isEmpty()).toList(),
                randomSeed,
                new RoleThresholds(hubZScore, participation));
        log.info("Analysis settings: {}", settings);
        return settings;
    }

    @Bean
    public RandomGenerator randomGenerator(AnalysisSettings settings) {
        return settings.randomSeed() == null
                ? new MersenneTwister()
                : new MersenneTwister(settings.randomSeed());
    }
}
