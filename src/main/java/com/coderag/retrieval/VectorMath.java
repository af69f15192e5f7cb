package com.coderag.retrieval;

/**
 * VectorMath - Utilities for vector similarity calculations
 * Used for exact nearest-neighbour ranking in the local index
 */
public final class VectorMath {

    /**
     * Calculate cosine similarity between two vectors
     * Returns value between -1 and 1, where 1 is identical, 0 is orthogonal.
     * A zero vector on either side yields 0, never NaN.
     *
     * @param a First vector
     * @param b Second vector
     * @return Cosine similarity score
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                "Vector dimensions must match: " + a.length + " vs " + b.length);
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

        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        // rounding can push |similarity| a hair past 1
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    /**
     * Euclidean (L2) norm of a vector
     */
    public static double norm(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    /**
     * Normalize a vector to unit length (L2 normalization)
     *
     * @param vector Input vector
     * @return Normalized vector, or a copy of the input if it is the zero vector
     */
    public static float[] normalize(float[] vector) {
        double norm = norm(vector);

        if (norm == 0.0) {
            return vector.clone();
        }

        float[] normalized = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            normalized[i] = (float) (vector[i] / norm);
        }
        return normalized;
    }

    private VectorMath() {}
}
