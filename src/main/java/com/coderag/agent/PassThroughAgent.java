package com.coderag.agent;

/**
 * PassThroughAgent - Minimal base agent that acknowledges the query; useful when only
 * the retrieved context is of interest (console mode, smoke checks).
 */
public class PassThroughAgent implements DecisionAgent {

    @Override
    public Decision decide(String query) {
        return Decision.of("Reviewed query: " + query);
    }
}
