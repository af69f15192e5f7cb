package com.coderag.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;
import java.util.TreeMap;

/**
 * Manifest - Summary of one completed indexing run, saved as {@code manifest.json}.
 * A new run overwrites the previous manifest.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Manifest {
    public String timestamp;
    public String rootDirectory;
    public Statistics statistics = new Statistics();
    public Map<String, Integer> fileBreakdown = new TreeMap<>();
    public IndexSnapshot vectorStoreStats = new IndexSnapshot();
    public boolean indexReadyForRetrieval;

    public Manifest() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Statistics {
        public int documentsLoaded;
        public int chunksCreated;
        public long averageChunkSize;      // characters
        public String embeddingProvider;
        public String embeddingModel;
        public String embeddingBackend;    // backend that produced the vectors
        public long fallbackEmbeddings;
        public int vectorDimension;
        public String vectorStoreProvider;
        public long totalTokensUsed;
        public String estimatedCost;

        public Statistics() {}
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexSnapshot {
        public String provider;
        public boolean initialized;
        public int totalDocuments;
        public String lastIndexed;
        public long retrievals;
        public double averageScore;

        public IndexSnapshot() {}
    }
}
