package com.coderag.embedding;

import com.coderag.errors.RagException;

/**
 * EmbeddingsClient - One embedding backend behind the {@link EmbeddingGateway}:
 * mock, in-process model or remote API.
 */
public interface EmbeddingsClient {

    /**
     * @throws RagException if the backend cannot produce a vector; remote failures
     *                      arrive as {@link com.coderag.errors.RemoteBackendException}
     */
    float[] embed(String text) throws RagException;

    /** Length of every vector this backend returns. */
    int dimensions();

    /** Short label used in logs, e.g. "OPENAI" or "LOCAL(MOCK)". */
    String name();
}
