package fr.lapetina.llm.gateway.infrastructure.cache;

/**
 * Vector helpers for similarity matching.
 */
final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity in [-1, 1]; 0 for mismatched lengths or zero vectors.
     */
    static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
