package com.coderag.embedding;

import com.coderag.retrieval.VectorMath;

/**
 * MockEmbeddingsClient - Deterministic, dependency-free embeddings
 * Same text always yields the same unit vector, so indexing and retrieval can be
 * exercised offline. Also the last-resort fallback of every other backend.
 */
public class MockEmbeddingsClient implements EmbeddingsClient {

    private static final long MODULUS = 2147483647L;
    private static final long MULTIPLIER = 16807L;

    private final int dims;

    public MockEmbeddingsClient(int dims) {
        if (dims <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dims = dims;
    }

    @Override
    public float[] embed(String text) {
        long hash = hashString(text);
        float[] vector = new float[dims];

        for (int i = 0; i < dims; i++) {
            long seed = ((hash + i) * MULTIPLIER) % MODULUS;
            vector[i] = (float) (((double) seed / MODULUS) * 2.0 - 1.0);
        }

        return VectorMath.normalize(vector);
    }

    @Override
    public int dimensions() {
        return dims;
    }

    @Override
    public String name() {
        return "MOCK";
    }

    /**
     * Rolling hash {@code h = h*31 + c} over UTF-16 code units, wrapped to 32 bits,
     * absolute value taken in 64 bits so {@code Integer.MIN_VALUE} stays positive.
     */
    static long hashString(String text) {
        int hash = 0;
        for (int i = 0; i < text.length(); i++) {
            hash = 31 * hash + text.charAt(i);
        }
        return Math.abs((long) hash);
    }
}
