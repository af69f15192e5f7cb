package com.coderag.agent;

import com.coderag.embedding.EmbeddingGateway;
import com.coderag.errors.RagException;
import com.coderag.retrieval.RetrievalResult;
import com.coderag.retrieval.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * RagAgent - Wraps a base {@link DecisionAgent} and enriches its answers with codebase
 * context pulled from the vector index.
 *
 * <p>Retrieval problems never reach the caller: the base decision is always returned,
 * with or without context. Only failures of the base agent itself propagate.
 */
public class RagAgent implements DecisionAgent {

    private static final Logger log = LoggerFactory.getLogger(RagAgent.class);

    public static final int DEFAULT_TOP_K = 5;
    public static final double DEFAULT_THRESHOLD = 0.5;
    static final int PREVIEW_CHARS = 200;
    static final String CONTEXT_SUFFIX = " [Based on analysis of relevant codebase context]";

    private final DecisionAgent baseAgent;
    private final EmbeddingGateway embeddings;
    private final VectorIndex vectorIndex;
    private final int topK;
    private final double threshold;
    private volatile boolean enabled;

    private final AtomicLong queriesWithRag = new AtomicLong();
    private final AtomicLong successfulRetrievals = new AtomicLong();
    private final AtomicLong failedRetrievals = new AtomicLong();
    private final AtomicLong latencyTotalMs = new AtomicLong();
    private final AtomicLong latencySamples = new AtomicLong();

    public RagAgent(DecisionAgent baseAgent, EmbeddingGateway embeddings, VectorIndex vectorIndex, boolean enabled) {
        this(baseAgent, embeddings, vectorIndex, enabled, DEFAULT_TOP_K, DEFAULT_THRESHOLD);
    }

    public RagAgent(DecisionAgent baseAgent, EmbeddingGateway embeddings, VectorIndex vectorIndex,
                    boolean enabled, int topK, double threshold) {
        this.baseAgent = baseAgent;
        this.embeddings = embeddings;
        this.vectorIndex = vectorIndex;
        this.enabled = enabled;
        this.topK = topK;
        this.threshold = threshold;
    }

    /**
     * Connect the vector index. If that fails, augmentation is switched off for the
     * lifetime of this agent and decisions pass straight through.
     */
    public void initialize() {
        if (!enabled) {
            log.info("ℹ️  RAG disabled, decisions will not be augmented");
            return;
        }
        try {
            vectorIndex.initialize();
            log.info("✅ RAG agent ready (index: {}, documents: {})",
                vectorIndex.getProvider(), vectorIndex.getStats().totalDocuments);
        } catch (RagException | RuntimeException e) {
            log.warn("⚠️  RAG initialization failed, continuing without retrieval: {}", e.getMessage());
            enabled = false;
        }
    }

    @Override
    public Decision decide(String query) throws Exception {
        long started = System.currentTimeMillis();
        Decision decision = baseAgent.decide(query);

        if (!enabled) {
            failedRetrievals.incrementAndGet();
            return decision.withRagOutcome(false, recordLatency(started));
        }

        List<ContextSnippet> context = retrieveContext(query);
        if (context.isEmpty()) {
            return decision.withRagOutcome(false, recordLatency(started));
        }

        return decision
            .withContext(decision.decision + CONTEXT_SUFFIX, context)
            .withRagOutcome(true, recordLatency(started));
    }

    /**
     * @return snippets for the best matches; empty when nothing matched or retrieval failed
     */
    List<ContextSnippet> retrieveContext(String query) {
        try {
            float[] queryVector = embeddings.embed(query);
            List<RetrievalResult> matches = vectorIndex.retrieve(queryVector, topK, threshold);
            queriesWithRag.incrementAndGet();

            if (matches.isEmpty()) {
                failedRetrievals.incrementAndGet();
                log.debug("No codebase context above {} for query: {}", threshold, query);
                return Collections.emptyList();
            }

            successfulRetrievals.incrementAndGet();
            List<ContextSnippet> snippets = new ArrayList<>(matches.size());
            for (RetrievalResult match : matches) {
                snippets.add(new ContextSnippet(match.source,
                    String.format(Locale.ROOT, "%.1f%%", match.score * 100),
                    match.preview(PREVIEW_CHARS)));
            }
            log.debug("Retrieved {} context snippets for query: {}", snippets.size(), query);
            return snippets;
        } catch (RagException | RuntimeException e) {
            failedRetrievals.incrementAndGet();
            log.warn("⚠️  Context retrieval failed, answering without it: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    private long recordLatency(long started) {
        long latency = System.currentTimeMillis() - started;
        latencyTotalMs.addAndGet(latency);
        latencySamples.incrementAndGet();
        return latency;
    }

    public RagStats getStats() {
        long samples = latencySamples.get();
        return new RagStats(
            enabled,
            queriesWithRag.get(),
            successfulRetrievals.get(),
            failedRetrievals.get(),
            samples == 0 ? 0 : Math.round((double) latencyTotalMs.get() / samples),
            vectorIndex.getStats(),
            embeddings.getStats());
    }

    public boolean isEnabled() {
        return enabled;
    }
}
