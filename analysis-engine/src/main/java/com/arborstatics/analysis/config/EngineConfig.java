package com.arborstatics.analysis.config;

import com.arborstatics.common.catalogue.SpeciesCatalogue;
import com.arborstatics.common.catalogue.WindCatalogue;
import com.arborstatics.common.threshold.SolverSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AssessmentProperties.class)
public class EngineConfig {

    @Bean
    public SpeciesCatalogue speciesCatalogue(ObjectMapper objectMapper, AssessmentProperties properties) {
        return SpeciesCatalogue.load(objectMapper, properties.getCatalogue().getSpecies());
    }

    @Bean
    public WindCatalogue windCatalogue(ObjectMapper objectMapper, AssessmentProperties properties) {
        return WindCatalogue.load(objectMapper, properties.getCatalogue().getWind());
    }

    @Bean
    public SolverSettings solverSettings(AssessmentProperties properties) {
        return properties.getSolver().toSettings();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
