package com.coderag.pipeline;

import com.coderag.config.RagConfig;
import com.coderag.embedding.EmbeddingGateway;
import com.coderag.embedding.EmbeddingProvider;
import com.coderag.embedding.MockEmbeddingsClient;
import com.coderag.loader.DocumentLoader;
import com.coderag.retrieval.LocalIndexBackend;
import com.coderag.retrieval.RetrievalResult;
import com.coderag.retrieval.VectorIndex;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class IndexingPipelineTest {

    @TempDir
    Path repo;

    @TempDir
    Path indexDir;

    private EmbeddingGateway gateway;
    private VectorIndex vectorIndex;
    private ManifestStore manifestStore;
    private IndexingPipeline pipeline;

    @BeforeEach
    void setUp() {
        gateway = new EmbeddingGateway(EmbeddingProvider.MOCK, "mock-hash-v1", 32, 4, true, new MockEmbeddingsClient(32));
        vectorIndex = new VectorIndex(null, new LocalIndexBackend(indexDir.resolve("index.json")), 5, 0.5);
        manifestStore = new ManifestStore(indexDir.resolve("manifest.json"));
        DocumentLoader loader = new DocumentLoader(repo, List.of(".java", ".md"), List.of("target"), 10, 2, 100_000, 10);
        pipeline = new IndexingPipeline(loader, gateway, vectorIndex, manifestStore);
    }

    private void writeRepo() throws Exception {
        Files.createDirectories(repo.resolve("src"));
        Files.writeString(repo.resolve("src/Router.java"),
            IntStream.rangeClosed(1, 25).mapToObj(i -> "// route step " + i).collect(Collectors.joining("\n")));
        Files.writeString(repo.resolve("src/Parser.java"), "class Parser {\n  void parse() {}\n}");
        Files.writeString(repo.resolve("README.md"), "# Project\nIndexes code.");
        Files.writeString(repo.resolve("notes.txt"), "ignored");
    }

    @Test
    @DisplayName("A run indexes every chunk and writes a complete manifest")
    void fullRun() throws Exception {
        writeRepo();

        Manifest manifest = pipeline.run();

        assertThat(manifest.statistics.documentsLoaded).isEqualTo(3);
        // 25 lines at chunk 10 / overlap 2 give 3 chunks, the other files 1 each
        assertThat(manifest.statistics.chunksCreated).isEqualTo(5);
        assertThat(manifest.statistics.averageChunkSize).isPositive();
        assertThat(manifest.statistics.embeddingProvider).isEqualTo("mock");
        assertThat(manifest.statistics.embeddingModel).isEqualTo("mock-hash-v1");
        assertThat(manifest.statistics.embeddingBackend).isEqualTo("MOCK");
        assertThat(manifest.statistics.fallbackEmbeddings).isZero();
        assertThat(manifest.statistics.vectorDimension).isEqualTo(32);
        assertThat(manifest.statistics.vectorStoreProvider).isEqualTo("local-file");
        assertThat(manifest.statistics.totalTokensUsed).isZero();
        assertThat(manifest.statistics.estimatedCost).isEqualTo("$0.0000");
        assertThat(manifest.fileBreakdown).containsEntry(".java", 2).containsEntry(".md", 1).hasSize(2);
        assertThat(manifest.rootDirectory).isEqualTo(repo.toAbsolutePath().normalize().toString());
        assertThat(manifest.vectorStoreStats.totalDocuments).isEqualTo(5);
        assertThat(manifest.indexReadyForRetrieval).isTrue();
        assertThat(manifest.timestamp).isNotBlank();

        JsonNode written = new ObjectMapper().readTree(indexDir.resolve("manifest.json").toFile());
        assertThat(written.get("statistics").get("chunksCreated").asInt()).isEqualTo(5);
        assertThat(written.get("fileBreakdown").get(".java").asInt()).isEqualTo(2);
        assertThat(written.get("indexReadyForRetrieval").asBoolean()).isTrue();
        assertThat(manifestStore.read().statistics.documentsLoaded).isEqualTo(3);
    }

    @Test
    @DisplayName("Indexed chunks are retrievable by their own text")
    void indexedContentIsRetrievable() throws Exception {
        writeRepo();
        pipeline.run();

        List<RetrievalResult> results = vectorIndex.retrieve(
            gateway.embed("class Parser {\n  void parse() {}\n}"), 1, 0.9);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).source).isEqualTo("src/Parser.java");
    }

    @Test
    @DisplayName("Re-indexing replaces the previous generation instead of adding to it")
    void reindexReplaces() throws Exception {
        writeRepo();
        pipeline.run();
        Files.delete(repo.resolve("src/Router.java"));

        Manifest second = pipeline.run();

        assertThat(second.statistics.chunksCreated).isEqualTo(2);
        assertThat(vectorIndex.getStats().totalDocuments).isEqualTo(2);
    }

    @Test
    void emptyRepository() throws Exception {
        Manifest manifest = pipeline.run();

        assertThat(manifest.statistics.documentsLoaded).isZero();
        assertThat(manifest.statistics.chunksCreated).isZero();
        assertThat(manifest.statistics.averageChunkSize).isZero();
        assertThat(manifest.statistics.vectorDimension).isZero();
        assertThat(manifest.fileBreakdown).isEmpty();
        assertThat(indexDir.resolve("manifest.json")).exists();
    }

    @Test
    @DisplayName("A remote embedder that never started is recorded as the mock backend in the manifest")
    void manifestRecordsStartupFallback() throws Exception {
        writeRepo();
        RagConfig config = RagConfig.fromMap(Map.of("EMBEDDING_PROVIDER", "openai", "EMBEDDING_DIMENSION", "32"));

        try (EmbeddingGateway degraded = new EmbeddingGateway(config)) {
            DocumentLoader loader = new DocumentLoader(repo, List.of(".java", ".md"), List.of("target"), 10, 2, 100_000, 10);
            Manifest manifest = new IndexingPipeline(loader, degraded, vectorIndex, manifestStore).run();

            assertThat(manifest.statistics.embeddingProvider).isEqualTo("openai");
            assertThat(manifest.statistics.embeddingBackend).isEqualTo("MOCK");
            assertThat(manifest.statistics.fallbackEmbeddings).isEqualTo(5);
            assertThat(manifestStore.read().statistics.embeddingBackend).isEqualTo("MOCK");
        }
    }
}
