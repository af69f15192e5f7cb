package com.coderag.embedding;

import com.coderag.errors.DimensionMismatchException;
import com.coderag.errors.RagException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * LocalEmbeddingsClient - In-process embeddings (quantized all-MiniLM-L6-v2 via ONNX).
 *
 * <p>The model is created on first use. Exactly one initialization attempt runs; callers
 * arriving while it is in flight wait on the same future. If it fails, the client switches
 * to {@link MockEmbeddingsClient} for the rest of the process and never retries.
 */
public class LocalEmbeddingsClient implements EmbeddingsClient {

    private static final Logger log = LoggerFactory.getLogger(LocalEmbeddingsClient.class);

    private final Supplier<EmbeddingModel> modelFactory;
    private final MockEmbeddingsClient fallback;
    private final int dims;
    private final AtomicReference<CompletableFuture<EmbeddingModel>> model = new AtomicReference<>();

    public LocalEmbeddingsClient(int dims) {
        this(dims, AllMiniLmL6V2QuantizedEmbeddingModel::new);
    }

    public LocalEmbeddingsClient(int dims, Supplier<EmbeddingModel> modelFactory) {
        this.dims = dims;
        this.modelFactory = modelFactory;
        this.fallback = new MockEmbeddingsClient(dims);
    }

    @Override
    public float[] embed(String text) throws RagException {
        EmbeddingModel embeddingModel = awaitModel();
        if (embeddingModel == null) {
            return fallback.embed(text);
        }

        float[] vector;
        try {
            vector = embeddingModel.embed(text).content().vector();
        } catch (RuntimeException e) {
            throw new RagException("Local embedding model failed: " + e.getMessage(), e);
        }
        if (vector.length != dims) {
            throw new DimensionMismatchException(dims, vector.length);
        }
        return vector;
    }

    /**
     * @return true once initialization has failed and the mock backend is serving requests
     */
    public boolean isFallbackActive() {
        CompletableFuture<EmbeddingModel> future = model.get();
        return future != null && future.isDone() && future.join() == null;
    }

    private EmbeddingModel awaitModel() {
        CompletableFuture<EmbeddingModel> existing = model.get();
        if (existing != null) {
            return existing.join();
        }

        CompletableFuture<EmbeddingModel> created = new CompletableFuture<>();
        if (!model.compareAndSet(null, created)) {
            return model.get().join();
        }

        try {
            log.info("🧠 Loading local embedding model...");
            EmbeddingModel loaded = modelFactory.get();
            log.info("✅ Local embedding model ready");
            created.complete(loaded);
        } catch (RuntimeException | LinkageError e) {
            log.warn("⚠️  Local embedding model unavailable, using mock embeddings from now on: {}", e.toString());
            created.complete(null);
        }
        return created.join();
    }

    @Override
    public int dimensions() {
        return dims;
    }

    @Override
    public String name() {
        return isFallbackActive() ? "LOCAL(MOCK)" : "LOCAL";
    }
}
