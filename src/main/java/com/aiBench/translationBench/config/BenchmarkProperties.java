package com.aiBench.translationBench.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Benchmark configuration bound from the {@code benchmark.*} namespace of application.yaml.
 *
 * Covers input limits, provider call settings, metric weights and thresholds,
 * the shared embedding model and the persistence store.
 */
@Data
@ConfigurationProperties(prefix = "benchmark")
public class BenchmarkProperties {

    /**
     * Maximum source text length in Unicode code points.
     */
    private int maxTextLength = 5000;

    private Provider provider = new Provider();

    /**
     * Per-metric switches keyed by the dashed metric name (e.g. "semantic-similarity").
     */
    private Map<String, MetricSettings> metrics = new LinkedHashMap<>();

    private Thresholds thresholds = new Thresholds();

    private Evaluation evaluation = new Evaluation();

    private Embedding embedding = new Embedding();

    private Persistence persistence = new Persistence();

    @Data
    public static class Provider {

        /**
         * Per-call timeout, applied to each provider independently.
         */
        private Duration timeout = Duration.ofMinutes(5);

        private String openaiBaseUrl = "https://api.openai.com/v1";
        private String openaiApiKey;
        private String deeplApiKey;
        private String deeplBaseUrl;
        private String googleApiKey;
        private String googleBaseUrl = "https://translation.googleapis.com";
        private double temperature = 0.3;

        /**
         * Providers offered to clients by the catalogue endpoint.
         */
        private List<CatalogueEntry> catalogue = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CatalogueEntry {
        private String type;
        private String name;
        private String model;
        private String baseUrl;
        private boolean enabled;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MetricSettings {
        private Boolean enabled;
        private Double weight;
    }

    @Data
    public static class Thresholds {
        private double languageConfidenceFloor = 0.8;
        private double lengthRatioMin = 0.5;
        private double lengthRatioMax = 2.0;
        private double repetitionThreshold = 0.3;
        private int maxNgramSize = 4;
        private boolean checkNumbers = true;
        private boolean checkPunctuation = true;
        private boolean checkEntities = true;
    }

    @Data
    public static class Evaluation {

        /**
         * Threads evaluating provider outputs concurrently. 0 means one per available processor.
         */
        private int parallelism = 0;
    }

    @Data
    public static class Embedding {
        private EmbeddingMode mode = EmbeddingMode.IN_PROCESS;

        /**
         * ONNX export of the in-process multilingual sentence encoder.
         */
        private String modelUrl = MULTILINGUAL_MINILM + "/onnx/model.onnx";
        private String tokenizerUrl = MULTILINGUAL_MINILM + "/tokenizer.json";

        /**
         * Directory holding the downloaded in-process model files.
         */
        private String cacheDir = System.getProperty("user.home") + "/.cache/translation-bench/paraphrase-multilingual-MiniLM-L12-v2";

        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String modelName = "text-embedding-3-small";
        private Duration timeout = Duration.ofSeconds(60);
    }

    private static final String MULTILINGUAL_MINILM =
            "https://huggingface.co/sentence-transformers/paraphrase-multilingual-MiniLM-L12-v2/resolve/main";

    public enum EmbeddingMode {
        IN_PROCESS,
        OPENAI
    }

    @Data
    public static class Persistence {

        /**
         * "memory" or "mongo".
         */
        private String store = "memory";
    }
}
