package com.coderag.agent;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Decision - An agent's answer, optionally enriched with retrieved codebase context
 */
public final class Decision {
    public final String decision;
    public final Map<String, Object> details;
    public final List<ContextSnippet> ragContext;
    public final boolean ragEnhanced;
    public final long latencyMs;

    public Decision(String decision, Map<String, Object> details, List<ContextSnippet> ragContext,
                    boolean ragEnhanced, long latencyMs) {
        this.decision = decision;
        this.details = details == null ? Collections.emptyMap() : Map.copyOf(details);
        this.ragContext = ragContext == null ? Collections.emptyList() : List.copyOf(ragContext);
        this.ragEnhanced = ragEnhanced;
        this.latencyMs = latencyMs;
    }

    public static Decision of(String decision) {
        return new Decision(decision, null, null, false, 0L);
    }

    public static Decision of(String decision, Map<String, Object> details) {
        return new Decision(decision, details, null, false, 0L);
    }

    public Decision withContext(String augmentedDecision, List<ContextSnippet> context) {
        return new Decision(augmentedDecision, details, context, ragEnhanced, latencyMs);
    }

    public Decision withRagOutcome(boolean enhanced, long latency) {
        return new Decision(decision, details, ragContext, enhanced, latency);
    }

    public boolean hasContext() {
        return !ragContext.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("Decision{decision='%s', context=%d, ragEnhanced=%s, latency=%dms}",
            decision, ragContext.size(), ragEnhanced, latencyMs);
    }
}
