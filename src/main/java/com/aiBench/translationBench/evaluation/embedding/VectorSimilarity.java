package com.aiBench.translationBench.evaluation.embedding;

public final class VectorSimilarity {

    private VectorSimilarity() {
    }

    /**
     * Cosine similarity of two vectors of equal dimension. A zero vector has similarity 0.
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            throw new IllegalArgumentException("Embedding dimensions do not match");
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, dot / Math.sqrt(normA * normB)));
    }

    /**
     * Maps a cosine similarity onto [0,100], clamping negative similarity to 0.
     */
    public static double toScore(double cosine) {
        return Math.max(0.0, cosine) * 100.0;
    }
}
