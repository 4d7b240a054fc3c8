package com.phillippitts.callqa.service.similarity;

/**
 * Cosine similarity over embedding vectors.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * Cosine similarity in [-1,1].
     *
     * @return 0.0 if either vector is null, empty, of mismatched length or has zero magnitude
     */
    public static double cosine(float[] v1, float[] v2) {
        if (v1 == null || v2 == null || v1.length == 0 || v1.length != v2.length) {
            return 0.0;
        }
        double dot = 0.0;
        double norm1 = 0.0;
        double norm2 = 0.0;
        for (int i = 0; i < v1.length; i++) {
            dot += (double) v1[i] * v2[i];
            norm1 += (double) v1[i] * v1[i];
            norm2 += (double) v2[i] * v2[i];
        }
        if (norm1 == 0.0 || norm2 == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(norm1) * Math.sqrt(norm2));
    }

    /**
     * Cosine similarity clamped to [0,1] for use as a similarity signal.
     */
    public static double clamped(float[] v1, float[] v2) {
        return Math.max(0.0, Math.min(1.0, cosine(v1, v2)));
    }
}
