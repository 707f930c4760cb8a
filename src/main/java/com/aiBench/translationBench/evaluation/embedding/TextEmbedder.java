package com.aiBench.translationBench.evaluation.embedding;

/**
 * Read-only access to the shared sentence encoder.
 */
public interface TextEmbedder {

    /**
     * @param text         text to encode
     * @param languageCode language of the text, or null if unknown
     * @return the embedding vector
     */
    float[] embed(String text, String languageCode);
}
