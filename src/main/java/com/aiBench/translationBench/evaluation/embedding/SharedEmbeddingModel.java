package com.aiBench.translationBench.evaluation.embedding;

import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Process-wide sentence encoder, loaded on first use and shared by every run.
 *
 * Loading is guarded so that concurrent first calls build the model exactly once;
 * afterwards the model is only read.
 */
@Slf4j
public class SharedEmbeddingModel implements TextEmbedder {

    private final Supplier<EmbeddingModel> loader;

    private volatile EmbeddingModel model;

    public SharedEmbeddingModel(Supplier<EmbeddingModel> loader) {
        this.loader = loader;
    }

    @Override
    public float[] embed(String text, String languageCode) {
        return model().embed(text).content().vector();
    }

    public boolean isLoaded() {
        return model != null;
    }

    private EmbeddingModel model() {
        EmbeddingModel current = model;
        if (current == null) {
            synchronized (this) {
                current = model;
                if (current == null) {
                    long start = System.currentTimeMillis();
                    current = loader.get();
                    if (current == null) {
                        throw new IllegalStateException("Embedding model loader returned null");
                    }
                    model = current;
                    log.info("Embedding model loaded - type: {}, latency: {}ms",
                            current.getClass().getSimpleName(), System.currentTimeMillis() - start);
                }
            }
        }
        return current;
    }
}
