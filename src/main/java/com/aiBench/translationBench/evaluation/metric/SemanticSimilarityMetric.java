package com.aiBench.translationBench.evaluation.metric;

import com.aiBench.translationBench.evaluation.embedding.TextEmbedder;
import com.aiBench.translationBench.evaluation.embedding.VectorSimilarity;
import com.aiBench.translationBench.evaluation.model.EvaluationInput;
import com.aiBench.translationBench.evaluation.model.MetricScore;

/**
 * Cross-lingual meaning preservation: cosine similarity between the source and
 * translation embeddings, negative values clamped to 0, scaled to [0,100].
 */
public class SemanticSimilarityMetric implements QualityMetric {

    private final TextEmbedder embedder;

    public SemanticSimilarityMetric(TextEmbedder embedder) {
        this.embedder = embedder;
    }

    @Override
    public String getName() {
        return MetricNames.SEMANTIC_SIMILARITY;
    }

    @Override
    public MetricScore evaluate(EvaluationInput input) {
        String translated = input.getTranslatedText();
        if (translated == null || translated.isBlank()) {
            return MetricScore.builder().score(0.0).warning("Empty translation").build();
        }
        float[] sourceVector = embedder.embed(input.getSourceText(), input.getSourceLang());
        float[] translatedVector = embedder.embed(translated, input.getTargetLang());
        double cosine = VectorSimilarity.cosine(sourceVector, translatedVector);
        return MetricScore.builder()
                .score(VectorSimilarity.toScore(cosine))
                .detail("cosine_similarity", cosine)
                .build();
    }
}
