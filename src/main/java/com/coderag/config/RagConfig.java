package com.coderag.config;

import com.coderag.embedding.EmbeddingProvider;
import io.github.cdimascio.dotenv.Dotenv;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * RagConfig - Environment-style configuration for chunking, embedding, indexing and retrieval.
 * Values come from a .env file (when present) layered over the process environment.
 */
public class RagConfig {

    public static final String LOCAL_FILE_INDEX = "local-file";
    public static final String PINECONE_INDEX = "pinecone";

    // Embedding
    public final EmbeddingProvider embeddingProvider;
    public final String embeddingModel;
    public final int dimension;
    public final int batchSize;
    public final boolean embeddingFallback;
    public final long embeddingTimeoutMs;
    public final String openAiApiKey;
    public final String openAiBaseUrl;

    // Vector index
    public final String indexProvider;     // local-file | pinecone
    public final String pineconeApiKey;
    public final String pineconeIndex;
    public final String pineconeHost;
    public final String pineconeControlUrl;
    public final Path indexDir;
    public final int topK;
    public final double scoreThreshold;
    public final int previewLength;
    public final boolean ragEnabled;

    // Loading and chunking
    public final Path rootDir;
    public final List<String> extensions;
    public final List<String> ignorePatterns;
    public final int chunkSize;
    public final int overlapSize;
    public final long maxFileSize;
    public final int maxDepth;

    private RagConfig(Function<String, String> env) {
        this.embeddingProvider = EmbeddingProvider.fromName(get(env, "EMBEDDING_PROVIDER", "mock"));
        this.embeddingModel = get(env, "EMBEDDING_MODEL", embeddingProvider.defaultModel());
        this.dimension = positive("EMBEDDING_DIMENSION",
            get(env, "EMBEDDING_DIMENSION", String.valueOf(embeddingProvider.defaultDimension())));
        this.batchSize = positive("EMBEDDING_BATCH_SIZE", get(env, "EMBEDDING_BATCH_SIZE", "10"));
        this.embeddingFallback = Boolean.parseBoolean(get(env, "EMBEDDING_FALLBACK", "true"));
        this.embeddingTimeoutMs = positive("EMBEDDING_TIMEOUT_MS", get(env, "EMBEDDING_TIMEOUT_MS", "30000"));
        this.openAiApiKey = get(env, "OPENAI_API_KEY", "");
        this.openAiBaseUrl = stripTrailingSlash(get(env, "OPENAI_BASE_URL", "https://api.openai.com"));

        this.indexProvider = normalizeIndexProvider(get(env, "RAG_PROVIDER", LOCAL_FILE_INDEX));
        this.pineconeApiKey = get(env, "PINECONE_API_KEY", "");
        this.pineconeIndex = get(env, "PINECONE_INDEX", "code-rag");
        this.pineconeHost = stripTrailingSlash(get(env, "PINECONE_HOST", ""));
        this.pineconeControlUrl = stripTrailingSlash(get(env, "PINECONE_CONTROL_URL", "https://api.pinecone.io"));
        this.indexDir = Paths.get(get(env, "RAG_INDEX_DIR", ".rag-index"));
        this.topK = positive("RAG_TOP_K", get(env, "RAG_TOP_K", "5"));
        this.scoreThreshold = parseDouble("RAG_SCORE_THRESHOLD", get(env, "RAG_SCORE_THRESHOLD", "0.5"));
        this.previewLength = positive("RAG_PREVIEW_LENGTH", get(env, "RAG_PREVIEW_LENGTH", "1000"));
        this.ragEnabled = Boolean.parseBoolean(get(env, "RAG_ENABLED", "true"));

        this.rootDir = Paths.get(get(env, "RAG_ROOT_DIR", System.getProperty("user.dir")))
            .toAbsolutePath().normalize();
        this.extensions = splitList(get(env, "RAG_EXTENSIONS", ".java,.js,.ts,.md,.json"));
        this.ignorePatterns = splitList(get(env, "RAG_IGNORE_PATTERNS",
            "node_modules,.git,coverage,build,dist,target,.env,.rag-index"));
        this.chunkSize = positive("RAG_CHUNK_SIZE", get(env, "RAG_CHUNK_SIZE", "500"));
        this.overlapSize = nonNegative("RAG_OVERLAP_SIZE", get(env, "RAG_OVERLAP_SIZE", "50"));
        this.maxFileSize = positive("RAG_MAX_FILE_SIZE", get(env, "RAG_MAX_FILE_SIZE", "1000000"));
        this.maxDepth = nonNegative("RAG_MAX_DEPTH", get(env, "RAG_MAX_DEPTH", "10"));

        if (overlapSize >= chunkSize) {
            throw new IllegalArgumentException(
                "RAG_OVERLAP_SIZE (" + overlapSize + ") must be smaller than RAG_CHUNK_SIZE (" + chunkSize + ")");
        }
    }

    /**
     * Load from .env (if any) and the process environment.
     */
    public static RagConfig fromEnv() {
        Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();
        return new RagConfig(dotenv::get);
    }

    /**
     * Build from explicit values only; keys not present fall back to defaults.
     */
    public static RagConfig fromMap(Map<String, String> values) {
        return new RagConfig(values::get);
    }

    public Path indexFile() {
        return indexDir.resolve("index.json");
    }

    public Path manifestFile() {
        return indexDir.resolve("manifest.json");
    }

    public boolean usesPinecone() {
        return PINECONE_INDEX.equals(indexProvider);
    }

    private static String get(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static String normalizeIndexProvider(String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "pinecone", "remote", "remote-cloud" -> PINECONE_INDEX;
            case "local-file", "local", "chroma", "file" -> LOCAL_FILE_INDEX;
            default -> throw new IllegalArgumentException("Unknown RAG_PROVIDER: " + raw);
        };
    }

    private static List<String> splitList(String raw) {
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toUnmodifiableList());
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static int positive(String key, String raw) {
        int value = parseInt(key, raw);
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got " + raw);
        }
        return value;
    }

    private static int nonNegative(String key, String raw) {
        int value = parseInt(key, raw);
        if (value < 0) {
            throw new IllegalArgumentException(key + " must not be negative, got " + raw);
        }
        return value;
    }

    private static int parseInt(String key, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + raw, e);
        }
    }

    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + raw, e);
        }
    }

    @Override
    public String toString() {
        return String.format(
            "RagConfig{embedding=%s/%s dim=%d, index=%s dir='%s', topK=%d, minScore=%.2f, root='%s', chunk=%d/%d}",
            embeddingProvider.id(), embeddingModel, dimension, indexProvider, indexDir, topK, scoreThreshold,
            rootDir, chunkSize, overlapSize);
    }
}
