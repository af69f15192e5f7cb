package com.coderag.pipeline;

import com.coderag.embedding.EmbeddingGateway;
import com.coderag.errors.RagException;
import com.coderag.retrieval.IndexStats;
import com.coderag.retrieval.RetrievalResult;
import com.coderag.retrieval.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * VerificationTool - Diagnostic run against an existing index: read the manifest,
 * reconnect, issue canned queries and print what comes back. Makes no assertions.
 */
public class VerificationTool {

    private static final Logger log = LoggerFactory.getLogger(VerificationTool.class);

    public static final List<String> DEFAULT_QUERIES = List.of(
        "How do agents coordinate?",
        "What is data validation?",
        "Testing and compliance checks",
        "Error recovery and monitoring"
    );

    static final int TOP_K = 3;
    static final double THRESHOLD = 0.3;
    private static final int PREVIEW_CHARS = 100;

    private final ManifestStore manifestStore;
    private final EmbeddingGateway embeddings;
    private final VectorIndex vectorIndex;
    private final List<String> queries;
    private final PrintStream out;

    public VerificationTool(ManifestStore manifestStore, EmbeddingGateway embeddings, VectorIndex vectorIndex,
                            List<String> queries, PrintStream out) {
        this.manifestStore = manifestStore;
        this.embeddings = embeddings;
        this.vectorIndex = vectorIndex;
        this.queries = List.copyOf(queries);
        this.out = out;
    }

    /**
     * @throws com.coderag.errors.ManifestMissingException if no index was ever built
     * @throws RagException if the index cannot be loaded or a query fails
     */
    public Report verify() throws RagException {
        Manifest manifest = manifestStore.read();

        out.println("📋 Index Information:");
        out.println("   Created: " + manifest.timestamp);
        out.println("   Documents: " + manifest.statistics.documentsLoaded);
        out.println("   Chunks: " + manifest.statistics.chunksCreated);
        out.println("   Provider: " + manifest.statistics.vectorStoreProvider);
        out.println("   Embedding Model: " + manifest.statistics.embeddingModel);
        if (manifest.statistics.embeddingBackend != null) {
            out.println("   Embedding Backend: " + manifest.statistics.embeddingBackend);
        }
        out.println("   Vector Dimension: " + manifest.statistics.vectorDimension);

        if (manifest.statistics.vectorDimension != 0 && manifest.statistics.vectorDimension != embeddings.getDimension()) {
            log.warn("⚠️  Index was built with dimension {} but the active embedding backend produces {}",
                manifest.statistics.vectorDimension, embeddings.getDimension());
        }

        String activeBackend = embeddings.getBackendName();
        if (manifest.statistics.embeddingBackend != null && !manifest.statistics.embeddingBackend.equals(activeBackend)) {
            log.warn("⚠️  Index vectors came from the {} embedding backend but {} is active now; scores will not be comparable",
                manifest.statistics.embeddingBackend, activeBackend);
        }

        vectorIndex.initialize();
        out.println();
        out.println("✅ Vector store connected");
        out.println("   Total documents indexed: " + vectorIndex.getStats().totalDocuments);

        out.println();
        out.println("🧪 Testing Retrieval...");
        out.println("─".repeat(40));

        Map<String, List<RetrievalResult>> results = new LinkedHashMap<>();
        for (String query : queries) {
            float[] embedding = embeddings.embed(query);
            List<RetrievalResult> matches = vectorIndex.retrieve(embedding, TOP_K, THRESHOLD);
            results.put(query, matches);
            printMatches(query, matches);
        }

        IndexStats stats = vectorIndex.getStats();
        out.println();
        out.println("📊 Verification Stats:");
        out.println("   Retrievals: " + stats.retrievals);
        out.println(String.format(Locale.ROOT, "   Average score: %.1f%%", stats.averageScore * 100));
        out.println();
        out.println("✅ Index Verification Complete!");

        return new Report(manifest, results, stats);
    }

    private void printMatches(String query, List<RetrievalResult> matches) {
        out.println();
        out.println("📌 Query: \"" + query + "\"");
        out.println("   Results: " + matches.size() + " matches");

        for (int i = 0; i < matches.size(); i++) {
            RetrievalResult match = matches.get(i);
            out.println();
            out.println("   [" + (i + 1) + "] " + match.source
                + (match.chunkIndex > 0 ? " (chunk " + match.chunkIndex + ")" : ""));
            out.println(String.format(Locale.ROOT, "       Score: %.1f%%", match.score * 100));
            out.println("       Preview: " + match.preview(PREVIEW_CHARS).replace('\n', ' ') + "...");
        }
    }

    /**
     * Report - What a verification run saw, for callers that want more than console output
     */
    public static final class Report {
        public final Manifest manifest;
        public final Map<String, List<RetrievalResult>> results;
        public final IndexStats stats;

        Report(Manifest manifest, Map<String, List<RetrievalResult>> results, IndexStats stats) {
            this.manifest = manifest;
            this.results = results;
            this.stats = stats;
        }
    }
}
