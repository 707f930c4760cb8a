package com.aiBench.translationBench.config;

import com.aiBench.translationBench.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools used by the benchmark.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    /**
     * Bounded pool that evaluates provider outputs concurrently. MDC is propagated into its threads.
     */
    @Bean(name = "evaluationExecutor", destroyMethod = "shutdown")
    public ExecutorService evaluationExecutor(BenchmarkProperties properties) {
        int parallelism = properties.getEvaluation().getParallelism();
        if (parallelism <= 0) {
            parallelism = Runtime.getRuntime().availableProcessors();
        }
        log.info("Evaluation executor initialized - parallelism: {}", parallelism);
        return MdcPropagation.wrapExecutor(
                Executors.newFixedThreadPool(parallelism, daemonThreadFactory("evaluation-")));
    }

    /**
     * Creates daemon threads named with the given prefix and a running counter.
     */
    public static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
