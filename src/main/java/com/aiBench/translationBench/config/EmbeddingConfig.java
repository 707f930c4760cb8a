package com.aiBench.translationBench.config;

import com.aiBench.translationBench.evaluation.embedding.ModelFileCache;
import com.aiBench.translationBench.evaluation.embedding.SharedEmbeddingModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.OnnxEmbeddingModel;
import dev.langchain4j.model.embedding.onnx.PoolingMode;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Wires the process-wide sentence encoder. The model itself is only built on first use.
 *
 * In-process mode runs paraphrase-multilingual-MiniLM-L12-v2 through ONNX Runtime with mean
 * pooling; its files are downloaded into the cache directory on first use.
 */
@Slf4j
@Configuration
public class EmbeddingConfig {

    @Bean
    public SharedEmbeddingModel sharedEmbeddingModel(BenchmarkProperties properties) {
        BenchmarkProperties.Embedding embedding = properties.getEmbedding();
        log.info("Embedding model configured - mode: {}", embedding.getMode());
        return new SharedEmbeddingModel(loader(embedding));
    }

    static Supplier<EmbeddingModel> loader(BenchmarkProperties.Embedding embedding) {
        if (embedding.getMode() == BenchmarkProperties.EmbeddingMode.OPENAI) {
            if (embedding.getApiKey() == null || embedding.getApiKey().isBlank()) {
                throw new IllegalStateException(
                        "Embedding API key is not configured. Set benchmark.embedding.api-key in application.yaml");
            }
            return () -> OpenAiEmbeddingModel.builder()
                    .baseUrl(embedding.getBaseUrl())
                    .apiKey(embedding.getApiKey())
                    .modelName(embedding.getModelName())
                    .timeout(embedding.getTimeout())
                    .build();
        }
        ModelFileCache files = modelFileCache(embedding);
        return () -> new OnnxEmbeddingModel(
                files.resolve(embedding.getModelUrl()).toString(),
                files.resolve(embedding.getTokenizerUrl()).toString(),
                PoolingMode.MEAN);
    }

    static ModelFileCache modelFileCache(BenchmarkProperties.Embedding embedding) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(embedding.getTimeout());
        requestFactory.setReadTimeout(embedding.getTimeout());
        RestClient restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .build();
        return new ModelFileCache(restClient, Path.of(embedding.getCacheDir()));
    }
}
