package com.aiBench.translationBench.evaluation.model;

import lombok.Builder;
import lombok.Value;

/**
 * The texts one metric evaluation looks at: the source, one provider's translation,
 * the requested languages and an optional gold reference.
 */
@Value
@Builder
public class EvaluationInput {

    String sourceText;

    String translatedText;

    String targetLang;

    /**
     * Declared source language, or null when the request asked for auto-detection.
     */
    String sourceLang;

    String referenceTranslation;

    public boolean hasReference() {
        return referenceTranslation != null && !referenceTranslation.isBlank();
    }
}
