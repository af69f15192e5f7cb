package com.coderag.agent;

import com.coderag.embedding.EmbeddingGateway;
import com.coderag.embedding.EmbeddingProvider;
import com.coderag.embedding.EmbeddingsClient;
import com.coderag.embedding.MockEmbeddingsClient;
import com.coderag.errors.PersistenceException;
import com.coderag.errors.RemoteBackendException;
import com.coderag.loader.Chunk;
import com.coderag.retrieval.LocalIndexBackend;
import com.coderag.retrieval.VectorIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RagAgentTest {

    private static final String ROUTER_CODE = "public class Router { void route(Message m) { dispatch(m); } }";

    @TempDir
    Path tmp;

    private EmbeddingGateway gateway;
    private VectorIndex vectorIndex;
    private DecisionAgent baseAgent;

    @BeforeEach
    void setUp() throws Exception {
        gateway = new EmbeddingGateway(EmbeddingProvider.MOCK, "mock-hash-v1", 64, 10, true, new MockEmbeddingsClient(64));
        vectorIndex = new VectorIndex(null, new LocalIndexBackend(tmp.resolve("index.json")), 5, 0.5);
        vectorIndex.store(
            List.of(new Chunk("/repo/src/Router.java#chunk0", "src/Router.java", ".java", 0, ROUTER_CODE, 1, 1)),
            List.of(gateway.embed(ROUTER_CODE)));
        baseAgent = query -> Decision.of("APPROVE", Map.of("confidence", 0.8));
    }

    @Test
    @DisplayName("Matching context is attached and marked in the decision text")
    void augmentsDecision() throws Exception {
        RagAgent agent = new RagAgent(baseAgent, gateway, vectorIndex, true);
        agent.initialize();

        Decision decision = agent.decide(ROUTER_CODE);

        assertThat(decision.ragEnhanced).isTrue();
        assertThat(decision.decision).isEqualTo("APPROVE [Based on analysis of relevant codebase context]");
        assertThat(decision.details).containsEntry("confidence", 0.8);
        assertThat(decision.ragContext).hasSize(1);
        ContextSnippet snippet = decision.ragContext.get(0);
        assertThat(snippet.source).isEqualTo("src/Router.java");
        assertThat(snippet.relevance).isEqualTo("100.0%");
        assertThat(snippet.preview).isEqualTo(ROUTER_CODE);
        assertThat(decision.latencyMs).isGreaterThanOrEqualTo(0);

        RagStats stats = agent.getStats();
        assertThat(stats.queriesProcessed).isEqualTo(1);
        assertThat(stats.successfulRetrievals).isEqualTo(1);
        assertThat(stats.failedRetrievals).isZero();
        assertThat(stats.vectorStoreStats.retrievals).isEqualTo(1);
        assertThat(stats.embedderStats.provider).isEqualTo("mock");
    }

    @Test
    void previewIsCappedAt200Characters() throws Exception {
        String longCode = "x".repeat(500);
        vectorIndex.store(
            List.of(new Chunk("/repo/src/Long.java#chunk0", "src/Long.java", ".java", 0, longCode, 1, 1)),
            List.of(gateway.embed(longCode)));
        RagAgent agent = new RagAgent(baseAgent, gateway, vectorIndex, true);

        Decision decision = agent.decide(longCode);

        assertThat(decision.ragContext.get(0).preview).hasSize(200);
    }

    @Test
    @DisplayName("No match above the threshold leaves the answer unchanged and counts a failed retrieval")
    void noMatches() throws Exception {
        float[] stored = gateway.embed(ROUTER_CODE);
        float[] opposite = new float[stored.length];
        for (int i = 0; i < stored.length; i++) {
            opposite[i] = -stored[i];
        }
        EmbeddingsClient backend = mock(EmbeddingsClient.class);
        when(backend.name()).thenReturn("STUB");
        when(backend.embed(anyString())).thenReturn(opposite);
        EmbeddingGateway opposing = new EmbeddingGateway(EmbeddingProvider.LOCAL, "stub", 64, 10, true, backend);
        RagAgent agent = new RagAgent(baseAgent, opposing, vectorIndex, true);

        Decision decision = agent.decide("completely different words");

        assertThat(decision.ragEnhanced).isFalse();
        assertThat(decision.decision).isEqualTo("APPROVE");
        assertThat(decision.ragContext).isEmpty();
        assertThat(agent.getStats().failedRetrievals).isEqualTo(1);
        assertThat(agent.getStats().queriesProcessed).isEqualTo(1);
    }

    @Test
    @DisplayName("Retrieval failures never reach the caller")
    void retrievalFailureIsContained() throws Exception {
        EmbeddingGateway failing = mock(EmbeddingGateway.class);
        when(failing.embed(anyString())).thenThrow(new RemoteBackendException("HTTP 401", 401));
        RagAgent agent = new RagAgent(baseAgent, failing, vectorIndex, true);

        Decision decision = agent.decide("anything");

        assertThat(decision.decision).isEqualTo("APPROVE");
        assertThat(decision.ragEnhanced).isFalse();
        RagStats stats = agent.getStats();
        assertThat(stats.failedRetrievals).isEqualTo(1);
        assertThat(stats.queriesProcessed).isZero();
    }

    @Test
    void disabledAgentPassesThrough() throws Exception {
        EmbeddingGateway unused = mock(EmbeddingGateway.class);
        RagAgent agent = new RagAgent(baseAgent, unused, vectorIndex, false);
        agent.initialize();

        Decision decision = agent.decide(ROUTER_CODE);

        assertThat(decision.decision).isEqualTo("APPROVE");
        assertThat(decision.ragEnhanced).isFalse();
        assertThat(agent.getStats().enabled).isFalse();
        assertThat(agent.getStats().failedRetrievals).isEqualTo(1);
        verify(unused, never()).embed(anyString());
    }

    @Test
    @DisplayName("A failed index initialization switches augmentation off")
    void initFailureDisables() throws Exception {
        VectorIndex broken = mock(VectorIndex.class);
        doThrow(new PersistenceException("disk full", null)).when(broken).initialize();
        RagAgent agent = new RagAgent(baseAgent, gateway, broken, true);

        agent.initialize();

        assertThat(agent.isEnabled()).isFalse();
        assertThat(agent.decide("q").decision).isEqualTo("APPROVE");
    }

    @Test
    void baseAgentFailuresPropagate() {
        DecisionAgent exploding = query -> {
            throw new IllegalStateException("model offline");
        };
        RagAgent agent = new RagAgent(exploding, gateway, vectorIndex, true);

        assertThatThrownBy(() -> agent.decide("q")).hasMessage("model offline");
    }

    @Test
    void averageLatencyIsTracked() throws Exception {
        DecisionAgent slow = query -> {
            Thread.sleep(20);
            return Decision.of("OK");
        };
        RagAgent agent = new RagAgent(slow, gateway, vectorIndex, true);

        agent.decide("one");
        agent.decide("two");

        assertThat(agent.getStats().averageLatencyMs).isGreaterThanOrEqualTo(20);
    }

    @Test
    void passThroughAgentEchoesQuery() {
        assertThat(new PassThroughAgent().decide("where is routing?").decision).contains("where is routing?");
    }
}
