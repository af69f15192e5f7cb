package com.coderag.retrieval;

/**
 * IndexEntry - One stored vector with the chunk metadata needed to answer queries
 */
public final class IndexEntry {
    public final String id;
    public final float[] embedding;
    public final String source;
    public final String type;
    public final int chunkIndex;
    public final String content;

    public IndexEntry(String id, float[] embedding, String source, String type, int chunkIndex, String content) {
        this.id = id;
        this.embedding = embedding;
        this.source = source;
        this.type = type;
        this.chunkIndex = chunkIndex;
        this.content = content;
    }

    public RetrievalResult toResult(double score) {
        return new RetrievalResult(id, source, content, type, score, chunkIndex);
    }
}
