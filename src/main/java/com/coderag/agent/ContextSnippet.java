package com.coderag.agent;

/**
 * ContextSnippet - Compact view of one retrieved chunk attached to a decision
 */
public final class ContextSnippet {
    public final String source;
    public final String relevance;   // e.g. "87.5%"
    public final String preview;

    public ContextSnippet(String source, String relevance, String preview) {
        this.source = source;
        this.relevance = relevance;
        this.preview = preview;
    }

    @Override
    public String toString() {
        return source + " (" + relevance + ")";
    }
}
