package com.coderag.retrieval;

import com.coderag.config.RagConfig;
import com.coderag.errors.BackendInitException;
import com.coderag.errors.DimensionMismatchException;
import com.coderag.errors.RagException;
import com.coderag.loader.Chunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * VectorIndex - Stores chunk vectors and answers top-K similarity queries.
 *
 * <p>When a remote index is configured it is tried first; any failure to connect falls
 * back to the local file index without surfacing an error. After initialization, store
 * and retrieve failures of the active backend propagate to the caller.
 */
public class VectorIndex implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(VectorIndex.class);

    private final IndexBackend remote;          // null when only the local index is configured
    private final LocalIndexBackend local;
    private final int defaultTopK;
    private final double defaultThreshold;

    private volatile IndexBackend active;
    private volatile boolean initialized;
    private volatile int totalDocuments;
    private volatile String lastIndexed;
    private volatile double averageScore;
    private final AtomicLong retrievals = new AtomicLong();

    public VectorIndex(RagConfig config) {
        this(config.usesPinecone()
                ? new PineconeIndexBackend(config.pineconeApiKey, config.pineconeIndex, config.pineconeHost,
                    config.pineconeControlUrl, config.previewLength, config.embeddingTimeoutMs)
                : null,
            new LocalIndexBackend(config.indexFile()),
            config.topK, config.scoreThreshold);
    }

    public VectorIndex(IndexBackend remote, LocalIndexBackend local, int defaultTopK, double defaultThreshold) {
        this.remote = remote;
        this.local = local;
        this.defaultTopK = defaultTopK;
        this.defaultThreshold = defaultThreshold;
    }

    /**
     * Connect to the remote index if configured, otherwise (or on failure) load the local one.
     * Only local persistence errors are raised.
     */
    public synchronized void initialize() throws RagException {
        if (initialized) {
            return;
        }
        log.info("📊 Initializing RAG vector index ({})...", remote != null ? remote.name() : local.name());

        IndexBackend chosen = local;
        int existing = -1;
        if (remote != null) {
            try {
                existing = remote.open();
                chosen = remote;
            } catch (BackendInitException | RuntimeException e) {
                log.warn("⚠️  {} initialization failed, falling back to local storage", remote.name());
                log.warn("   Error: {}", e.getMessage());
            }
        }
        if (chosen == local) {
            existing = local.open();
            lastIndexed = local.getLastIndexed();
        }

        active = chosen;
        totalDocuments = existing;
        initialized = true;
        log.info("✅ RAG vector index ready");
    }

    /**
     * Write one entry per (chunk, embedding) pair. All embeddings must share one dimension,
     * matching whatever the index already holds.
     */
    public synchronized void store(List<Chunk> chunks, List<float[]> embeddings) throws RagException {
        if (chunks.size() != embeddings.size()) {
            throw new IllegalArgumentException(
                "Got " + chunks.size() + " chunks but " + embeddings.size() + " embeddings");
        }
        initialize();

        int expected = active.dimension();
        List<IndexEntry> entries = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            float[] embedding = embeddings.get(i);
            if (expected == 0) {
                expected = embedding.length;
            } else if (embedding.length != expected) {
                throw new DimensionMismatchException(expected, embedding.length);
            }

            Chunk chunk = chunks.get(i);
            entries.add(new IndexEntry(IdSanitizer.sanitize(chunk.id), embedding.clone(),
                chunk.source, chunk.type, chunk.chunkIndex, chunk.content));
        }

        log.info("📝 Storing {} embeddings...", entries.size());
        active.upsert(entries);

        totalDocuments = active == local ? local.size() : entries.size();
        lastIndexed = Instant.now().toString();
        log.info("✅ Embeddings stored successfully");
    }

    public List<RetrievalResult> retrieve(float[] queryVector) throws RagException {
        return retrieve(queryVector, 0, null);
    }

    /**
     * @param topK      maximum results; values {@code <= 0} use the configured default
     * @param threshold minimum score; {@code null} uses the configured default
     */
    public List<RetrievalResult> retrieve(float[] queryVector, int topK, Double threshold) throws RagException {
        initialize();

        int k = topK > 0 ? topK : defaultTopK;
        double minScore = threshold != null ? threshold : defaultThreshold;

        int expected = active.dimension();
        if (expected != 0 && queryVector.length != expected) {
            throw new DimensionMismatchException(expected, queryVector.length);
        }

        List<RetrievalResult> results = active.query(queryVector, k, minScore);
        recordRetrieval(results);
        return results;
    }

    private void recordRetrieval(List<RetrievalResult> results) {
        retrievals.incrementAndGet();
        if (!results.isEmpty()) {
            double sum = 0.0;
            for (RetrievalResult result : results) {
                sum += result.score;
            }
            averageScore = sum / results.size();
        }
    }

    /**
     * Remove every entry from the active backend.
     */
    public synchronized void clear() throws RagException {
        initialize();
        active.clear();
        totalDocuments = 0;
        log.info("✅ Index cleared");
    }

    public IndexStats getStats() {
        IndexBackend backend = active;
        String provider = backend != null ? backend.name() : (remote != null ? remote.name() : local.name());
        return new IndexStats(provider, initialized, Math.max(totalDocuments, 0), lastIndexed,
            retrievals.get(), averageScore, backend != null ? backend.dimension() : 0);
    }

    /**
     * @return name of the backend serving requests, or of the configured one before initialization
     */
    public String getProvider() {
        return getStats().provider;
    }

    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public void close() throws IOException {
        if (remote instanceof Closeable) {
            ((Closeable) remote).close();
        }
    }
}
