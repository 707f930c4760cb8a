package com.aiBench.translationBench;

import com.aiBench.translationBench.evaluation.service.MetricRegistry;
import com.aiBench.translationBench.repository.InMemoryRunRepository;
import com.aiBench.translationBench.repository.RunRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class TranslationBenchApplicationTests {

    @Autowired
    private RunRepository runRepository;

    @Autowired
    private MetricRegistry metricRegistry;

    @Test
    void contextLoads() {
        assertInstanceOf(InMemoryRunRepository.class, runRepository);
        assertEquals(MetricRegistry.DEFAULT_WEIGHTS, metricRegistry.weights());
    }
}
