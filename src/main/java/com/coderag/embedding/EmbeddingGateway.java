package com.coderag.embedding;

import com.coderag.config.RagConfig;
import com.coderag.errors.BackendInitException;
import com.coderag.errors.DimensionMismatchException;
import com.coderag.errors.RagException;
import com.coderag.errors.RemoteBackendException;
import com.coderag.retrieval.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * EmbeddingGateway - Single entry point for turning text into vectors.
 *
 * <p>Dispatches to the configured backend, keeps usage and cost accounting, enforces the
 * configured dimension, and downgrades remote failures to the deterministic mock backend
 * when fallback is enabled.
 */
public class EmbeddingGateway implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingGateway.class);

    /** USD per one million tokens (text-embedding-3-small list price). */
    public static final double PRICE_PER_MILLION_TOKENS = 0.02;

    private final EmbeddingProvider provider;
    private final String model;
    private final int dimension;
    private final int batchSize;
    private final boolean fallbackEnabled;
    private final EmbeddingsClient primary;
    private final MockEmbeddingsClient mock;
    private boolean startupFallback;

    private final AtomicLong tokensUsed = new AtomicLong();
    private final AtomicLong queriesProcessed = new AtomicLong();
    private final AtomicLong fallbackEmbeddings = new AtomicLong();
    private final AtomicBoolean fallbackWarned = new AtomicBoolean();

    public EmbeddingGateway(RagConfig config) throws BackendInitException {
        this.provider = config.embeddingProvider;
        this.model = config.embeddingModel;
        this.dimension = config.dimension;
        this.batchSize = config.batchSize;
        this.fallbackEnabled = config.embeddingFallback;
        this.mock = new MockEmbeddingsClient(dimension);
        this.primary = createClient(config);

        log.info("🧠 Using embedding provider: {} ({} dimensions, model {})", primary.name(), dimension, model);
    }

    /**
     * Wire an explicit backend, e.g. a stub in tests or a custom in-process model.
     */
    public EmbeddingGateway(EmbeddingProvider provider, String model, int dimension, int batchSize,
                            boolean fallbackEnabled, EmbeddingsClient primary) {
        this.provider = provider;
        this.model = model;
        this.dimension = dimension;
        this.batchSize = batchSize;
        this.fallbackEnabled = fallbackEnabled;
        this.mock = new MockEmbeddingsClient(dimension);
        this.primary = primary;
    }

    private EmbeddingsClient createClient(RagConfig config) throws BackendInitException {
        switch (provider) {
            case OPENAI:
                try {
                    return new OpenAiEmbeddingsClient(config.openAiApiKey, config.openAiBaseUrl, model,
                        dimension, config.embeddingTimeoutMs, this::recordTokens);
                } catch (BackendInitException e) {
                    if (!fallbackEnabled) {
                        throw e;
                    }
                    log.warn("⚠️  OpenAI embeddings unavailable ({}), falling back to mock embeddings", e.getMessage());
                    startupFallback = true;
                    return mock;
                }
            case LOCAL:
                return new LocalEmbeddingsClient(dimension);
            case MOCK:
            default:
                return mock;
        }
    }

    /**
     * Embed a single text with the active backend.
     */
    public float[] embed(String text) throws RagException {
        queriesProcessed.incrementAndGet();

        float[] vector;
        boolean fromMock = primary == mock;
        if (startupFallback) {
            fallbackEmbeddings.incrementAndGet();
        }
        try {
            vector = primary.embed(text);
        } catch (RemoteBackendException e) {
            if (!fallbackEnabled) {
                throw e;
            }
            fallbackEmbeddings.incrementAndGet();
            if (fallbackWarned.compareAndSet(false, true)) {
                log.warn("⚠️  {} embedding failed, using mock embeddings instead: {}", primary.name(), e.getMessage());
            } else {
                log.debug("{} embedding failed again, mock fallback: {}", primary.name(), e.getMessage());
            }
            vector = mock.embed(text);
            fromMock = true;
        }

        if (vector.length != dimension) {
            throw new DimensionMismatchException(dimension, vector.length);
        }
        // mock vectors are already unit length
        return provider == EmbeddingProvider.OPENAI && !fromMock ? VectorMath.normalize(vector) : vector;
    }

    /**
     * Embed many texts in order, sequentially, in groups of {@code batchSize}.
     */
    public List<float[]> embedBatch(List<String> texts) throws RagException {
        List<float[]> embeddings = new ArrayList<>(texts.size());
        int totalBatches = (texts.size() + batchSize - 1) / batchSize;

        for (int start = 0; start < texts.size(); start += batchSize) {
            int end = Math.min(start + batchSize, texts.size());
            for (String text : texts.subList(start, end)) {
                embeddings.add(embed(text));
            }
            log.info("  ✓ Embedded batch {}/{}", start / batchSize + 1, totalBatches);
        }

        return embeddings;
    }

    void recordTokens(long tokens) {
        tokensUsed.addAndGet(tokens);
    }

    public EmbeddingStats getStats() {
        long tokens = tokensUsed.get();
        return new EmbeddingStats(provider.id(), model, getBackendName(), tokens,
            tokens / 1_000_000.0 * PRICE_PER_MILLION_TOKENS,
            queriesProcessed.get(), fallbackEmbeddings.get());
    }

    public EmbeddingProvider getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    /**
     * Name of the backend actually producing vectors. Differs from the configured provider
     * when the remote backend could not start and the mock took over.
     */
    public String getBackendName() {
        return primary.name();
    }

    public boolean isStartupFallback() {
        return startupFallback;
    }

    public int getDimension() {
        return dimension;
    }

    @Override
    public void close() throws IOException {
        if (primary instanceof Closeable) {
            ((Closeable) primary).close();
        }
    }
}
