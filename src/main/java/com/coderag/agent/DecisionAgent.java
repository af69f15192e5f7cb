package com.coderag.agent;

/**
 * DecisionAgent - Any caller that turns a natural-language query into a decision
 */
public interface DecisionAgent {

    Decision decide(String query) throws Exception;
}
