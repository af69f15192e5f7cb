package com.coderag.loader;

/**
 * Document - One loaded source file, held only until it has been chunked
 */
public final class Document {
    public final String id;          // absolute normalized path
    public final String source;      // path relative to the index root, '/'-separated
    public final String type;        // file extension including the dot, e.g. ".java"
    public final String content;
    public final long size;          // bytes on disk
    public final boolean documentation;

    public Document(String id, String source, String type, String content, long size, boolean documentation) {
        this.id = id;
        this.source = source;
        this.type = type;
        this.content = content;
        this.size = size;
        this.documentation = documentation;
    }

    @Override
    public String toString() {
        return String.format("Document{source='%s', type='%s', size=%d}", source, type, size);
    }
}
