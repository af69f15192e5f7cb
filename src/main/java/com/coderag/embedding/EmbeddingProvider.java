package com.coderag.embedding;

/**
 * EmbeddingProvider - The closed set of embedding backends the gateway can dispatch to
 */
public enum EmbeddingProvider {
    MOCK("mock", "mock-hash-v1", 1536),
    LOCAL("local", "all-minilm-l6-v2-q", 384),
    OPENAI("openai", "text-embedding-3-small", 1536);

    private final String id;
    private final String defaultModel;
    private final int defaultDimension;

    EmbeddingProvider(String id, String defaultModel, int defaultDimension) {
        this.id = id;
        this.defaultModel = defaultModel;
        this.defaultDimension = defaultDimension;
    }

    public String id() {
        return id;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public int defaultDimension() {
        return defaultDimension;
    }

    public static EmbeddingProvider fromName(String name) {
        for (EmbeddingProvider provider : values()) {
            if (provider.id.equalsIgnoreCase(name.trim())) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown EMBEDDING_PROVIDER: " + name);
    }
}
