package com.coderag.retrieval;

/**
 * RetrievalResult - A ranked match returned for a query vector
 */
public final class RetrievalResult {
    public final String id;
    public final String source;
    public final String content;
    public final String type;
    public final double score;
    public final int chunkIndex;

    public RetrievalResult(String id, String source, String content, String type, double score, int chunkIndex) {
        this.id = id;
        this.source = source;
        this.content = content;
        this.type = type;
        this.score = score;
        this.chunkIndex = chunkIndex;
    }

    /**
     * First {@code maxChars} characters of the content.
     */
    public String preview(int maxChars) {
        return content.length() <= maxChars ? content : content.substring(0, maxChars);
    }

    @Override
    public String toString() {
        return String.format("RetrievalResult{source='%s', chunk=%d, score=%.3f}", source, chunkIndex, score);
    }
}
