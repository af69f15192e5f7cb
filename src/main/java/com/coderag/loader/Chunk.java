package com.coderag.loader;

/**
 * Chunk - A contiguous line window of a {@link Document}; the unit that gets embedded
 * Line numbers are 1-based and inclusive.
 */
public final class Chunk {
    public final String id;          // "{documentId}#chunk{n}"
    public final String source;
    public final String type;
    public final int chunkIndex;
    public final String content;
    public final int startLine;
    public final int endLine;

    public Chunk(String id, String source, String type, int chunkIndex, String content,
                 int startLine, int endLine) {
        this.id = id;
        this.source = source;
        this.type = type;
        this.chunkIndex = chunkIndex;
        this.content = content;
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }

    @Override
    public String toString() {
        return String.format("Chunk{source='%s', chunk=%d, lines=%d-%d}", source, chunkIndex, startLine, endLine);
    }
}
