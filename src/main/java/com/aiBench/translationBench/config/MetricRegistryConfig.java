package com.aiBench.translationBench.config;

import com.aiBench.translationBench.evaluation.embedding.SharedEmbeddingModel;
import com.aiBench.translationBench.evaluation.service.MetricRegistry;
import com.aiBench.translationBench.language.service.LanguageDetector;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricRegistryConfig {

    @Bean
    public MetricRegistry metricRegistry(BenchmarkProperties properties,
                                         LanguageDetector languageDetector,
                                         SharedEmbeddingModel sharedEmbeddingModel) {
        return MetricRegistry.fromProperties(properties, languageDetector, sharedEmbeddingModel);
    }
}
