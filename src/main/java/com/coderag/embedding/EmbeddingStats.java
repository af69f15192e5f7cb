package com.coderag.embedding;

import java.util.Locale;

/**
 * EmbeddingStats - Point-in-time usage and cost snapshot of an {@link EmbeddingGateway}
 */
public class EmbeddingStats {
    public final String provider;
    public final String model;
    /** Backend actually serving requests, e.g. "LOCAL(MOCK)" after a startup fallback. */
    public final String backend;
    public final long tokensUsed;
    public final double costEstimate;
    public final long queriesProcessed;
    public final long fallbackEmbeddings;

    public EmbeddingStats(String provider, String model, String backend, long tokensUsed, double costEstimate,
                          long queriesProcessed, long fallbackEmbeddings) {
        this.provider = provider;
        this.model = model;
        this.backend = backend;
        this.tokensUsed = tokensUsed;
        this.costEstimate = costEstimate;
        this.queriesProcessed = queriesProcessed;
        this.fallbackEmbeddings = fallbackEmbeddings;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "EmbeddingStats{provider='%s', model='%s', backend='%s', tokens=%d, cost=$%.4f, queries=%d, fallbacks=%d}",
            provider, model, backend, tokensUsed, costEstimate, queriesProcessed, fallbackEmbeddings);
    }
}
