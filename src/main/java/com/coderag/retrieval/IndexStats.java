package com.coderag.retrieval;

/**
 * IndexStats - Snapshot of a {@link VectorIndex}.
 * {@code averageScore} is the mean score of the most recent retrieval that returned matches.
 */
public final class IndexStats {
    public final String provider;
    public final boolean initialized;
    public final int totalDocuments;
    public final String lastIndexed;
    public final long retrievals;
    public final double averageScore;
    public final int dimension;

    public IndexStats(String provider, boolean initialized, int totalDocuments, String lastIndexed,
                      long retrievals, double averageScore, int dimension) {
        this.provider = provider;
        this.initialized = initialized;
        this.totalDocuments = totalDocuments;
        this.lastIndexed = lastIndexed;
        this.retrievals = retrievals;
        this.averageScore = averageScore;
        this.dimension = dimension;
    }

    @Override
    public String toString() {
        return String.format("IndexStats{provider='%s', documents=%d, retrievals=%d, avgScore=%.3f, lastIndexed=%s}",
            provider, totalDocuments, retrievals, averageScore, lastIndexed);
    }
}
