package com.coderag.agent;

import com.coderag.embedding.EmbeddingStats;
import com.coderag.retrieval.IndexStats;

/**
 * RagStats - Process-lifetime retrieval statistics of a {@link RagAgent}
 */
public final class RagStats {
    public final boolean enabled;
    public final long queriesProcessed;
    public final long successfulRetrievals;
    public final long failedRetrievals;
    public final long averageLatencyMs;
    public final IndexStats vectorStoreStats;
    public final EmbeddingStats embedderStats;

    public RagStats(boolean enabled, long queriesProcessed, long successfulRetrievals, long failedRetrievals,
                    long averageLatencyMs, IndexStats vectorStoreStats, EmbeddingStats embedderStats) {
        this.enabled = enabled;
        this.queriesProcessed = queriesProcessed;
        this.successfulRetrievals = successfulRetrievals;
        this.failedRetrievals = failedRetrievals;
        this.averageLatencyMs = averageLatencyMs;
        this.vectorStoreStats = vectorStoreStats;
        this.embedderStats = embedderStats;
    }

    @Override
    public String toString() {
        return String.format("RagStats{enabled=%s, queries=%d, ok=%d, failed=%d, avgLatency=%dms}",
            enabled, queriesProcessed, successfulRetrievals, failedRetrievals, averageLatencyMs);
    }
}
