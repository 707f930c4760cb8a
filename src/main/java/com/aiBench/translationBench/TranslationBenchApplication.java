package com.aiBench.translationBench;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TranslationBenchApplication {

    public static void main(String[] args) {
        SpringApplication.run(TranslationBenchApplication.class, args);
    }
}
