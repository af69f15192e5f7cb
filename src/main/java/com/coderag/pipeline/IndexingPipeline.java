package com.coderag.pipeline;

import com.coderag.config.RagConfig;
import com.coderag.embedding.EmbeddingGateway;
import com.coderag.embedding.EmbeddingStats;
import com.coderag.errors.RagException;
import com.coderag.loader.Chunk;
import com.coderag.loader.Document;
import com.coderag.loader.DocumentLoader;
import com.coderag.retrieval.IndexStats;
import com.coderag.retrieval.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * IndexingPipeline - One full, non-resumable rebuild: load, chunk, embed, store, then
 * write the manifest. Any failure aborts the run; entries the local index persisted
 * before the failure are left in place.
 */
public class IndexingPipeline {

    private static final Logger log = LoggerFactory.getLogger(IndexingPipeline.class);

    private final DocumentLoader loader;
    private final EmbeddingGateway embeddings;
    private final VectorIndex vectorIndex;
    private final ManifestStore manifestStore;

    public IndexingPipeline(RagConfig config, EmbeddingGateway embeddings, VectorIndex vectorIndex) {
        this(new DocumentLoader(config), embeddings, vectorIndex, new ManifestStore(config.manifestFile()));
    }

    public IndexingPipeline(DocumentLoader loader, EmbeddingGateway embeddings, VectorIndex vectorIndex,
                            ManifestStore manifestStore) {
        this.loader = loader;
        this.embeddings = embeddings;
        this.vectorIndex = vectorIndex;
        this.manifestStore = manifestStore;
    }

    public Manifest run() throws RagException {
        log.info("📝 Step 1: Loading Documents");
        List<Document> documents = loader.loadCodebase();
        List<Chunk> chunks = loader.chunkDocuments(documents);

        log.info("🔢 Step 2: Generating Embeddings");
        List<String> texts = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            texts.add(chunk.content);
        }
        List<float[]> vectors = embeddings.embedBatch(texts);

        EmbeddingStats embeddingStats = embeddings.getStats();
        int dimension = vectors.isEmpty() ? 0 : vectors.get(0).length;
        log.info("📊 Embedding Stats: provider={} via {}, model={}, dimensions={}, tokens={}, cost=${}",
            embeddingStats.provider, embeddingStats.backend, embeddingStats.model, dimension, embeddingStats.tokensUsed,
            String.format(Locale.ROOT, "%.4f", embeddingStats.costEstimate));

        log.info("💾 Step 3: Storing Embeddings");
        vectorIndex.initialize();
        // re-index replaces the previous generation wholesale
        vectorIndex.clear();
        vectorIndex.store(chunks, vectors);

        log.info("📋 Step 4: Generating Index Manifest");
        Manifest manifest = buildManifest(documents, chunks, dimension, embeddingStats, vectorIndex.getStats());
        manifestStore.write(manifest);
        log.info("✅ Index manifest saved to {}", manifestStore.getManifestPath());

        return manifest;
    }

    Manifest buildManifest(List<Document> documents, List<Chunk> chunks, int dimension,
                           EmbeddingStats embeddingStats, IndexStats indexStats) {
        Manifest manifest = new Manifest();
        manifest.timestamp = Instant.now().toString();
        manifest.rootDirectory = loader.getRootDir().toString();

        Manifest.Statistics statistics = manifest.statistics;
        statistics.documentsLoaded = documents.size();
        statistics.chunksCreated = chunks.size();
        long totalChars = 0;
        for (Chunk chunk : chunks) {
            totalChars += chunk.content.length();
        }
        statistics.averageChunkSize = chunks.isEmpty() ? 0 : Math.round((double) totalChars / chunks.size());
        statistics.embeddingProvider = embeddingStats.provider;
        statistics.embeddingModel = embeddingStats.model;
        statistics.embeddingBackend = embeddingStats.backend;
        statistics.fallbackEmbeddings = embeddingStats.fallbackEmbeddings;
        statistics.vectorDimension = dimension;
        statistics.vectorStoreProvider = indexStats.provider;
        statistics.totalTokensUsed = embeddingStats.tokensUsed;
        statistics.estimatedCost = String.format(Locale.ROOT, "$%.4f", embeddingStats.costEstimate);

        Map<String, Integer> breakdown = new TreeMap<>();
        for (Document document : documents) {
            breakdown.merge(document.type, 1, Integer::sum);
        }
        manifest.fileBreakdown = breakdown;

        Manifest.IndexSnapshot snapshot = manifest.vectorStoreStats;
        snapshot.provider = indexStats.provider;
        snapshot.initialized = indexStats.initialized;
        snapshot.totalDocuments = indexStats.totalDocuments;
        snapshot.lastIndexed = indexStats.lastIndexed;
        snapshot.retrievals = indexStats.retrievals;
        snapshot.averageScore = indexStats.averageScore;

        manifest.indexReadyForRetrieval = true;
        return manifest;
    }
}
