package com.aiBench.translationBench.evaluation.metric;

import com.aiBench.translationBench.evaluation.embedding.TextEmbedder;
import com.aiBench.translationBench.evaluation.embedding.VectorSimilarity;
import com.aiBench.translationBench.evaluation.model.EvaluationInput;
import com.aiBench.translationBench.evaluation.model.MetricScore;

/**
 * Embedding cosine between the translation and the reference, both in the target language.
 */
public class ReferenceSimilarityMetric extends ReferenceBasedMetric {

    private final TextEmbedder embedder;

    public ReferenceSimilarityMetric(TextEmbedder embedder) {
        this.embedder = embedder;
    }

    @Override
    public String getName() {
        return MetricNames.REFERENCE_SIMILARITY;
    }

    @Override
    public MetricScore evaluate(EvaluationInput input) {
        String translated = input.getTranslatedText();
        if (translated == null || translated.isBlank()) {
            return MetricScore.builder().score(0.0).warning("Empty translation").build();
        }
        float[] translatedVector = embedder.embed(translated, input.getTargetLang());
        float[] referenceVector = embedder.embed(input.getReferenceTranslation(), input.getTargetLang());
        double cosine = VectorSimilarity.cosine(translatedVector, referenceVector);
        return MetricScore.builder()
                .score(VectorSimilarity.toScore(cosine))
                .detail("cosine_similarity", cosine)
                .build();
    }
}
