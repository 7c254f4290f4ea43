package com.marketruns.dataset.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.marketruns.common.builder.BuildOptions;
import com.marketruns.common.builder.ExperimentBuilder;
import com.marketruns.common.flatten.FlatTableCsvWriter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DatasetConfig {

    @Bean
    public BuildOptions buildOptions(DatasetProperties properties) {
        return BuildOptions.defaults()
            .withExperimentName(properties.getExperimentName())
            .withSegmentPattern(properties.getSegmentPattern())
            .withChannelsPerRound(properties.getChannelsPerRound())
            .withFallbackWarningRatio(properties.getFallbackWarningRatio());
    }

    @Bean
    public ExperimentBuilder experimentBuilder(BuildOptions buildOptions) {
        return new ExperimentBuilder(buildOptions);
    }

    @Bean
    public FlatTableCsvWriter flatTableCsvWriter() {
        return new FlatTableCsvWriter();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
