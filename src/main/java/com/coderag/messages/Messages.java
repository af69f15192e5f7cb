package com.coderag.messages;

import akka.actor.typed.ActorRef;
import com.coderag.agent.Decision;
import com.coderag.agent.RagStats;

import java.time.Instant;
import java.util.UUID;

/**
 * Message definitions for actor-based consumers of the retrieval layer
 */
public class Messages {

    // ========== AGENT MESSAGES ==========
    public interface AgentCommand {}

    public static class Decide implements AgentCommand {
        public final String sessionId;
        public final String query;
        public final ActorRef<DecisionReply> replyTo;
        public final Instant timestamp;

        public Decide(String sessionId, String query, ActorRef<DecisionReply> replyTo) {
            this.sessionId = sessionId != null && !sessionId.isEmpty() ? sessionId :
                UUID.randomUUID().toString().substring(0, 8);
            this.query = query;
            this.replyTo = replyTo;
            this.timestamp = Instant.now();
        }
    }

    public static class DecisionReply {
        public final String sessionId;
        public final Decision decision;     // null when the base agent failed
        public final boolean success;
        public final String errorMessage;

        public DecisionReply(String sessionId, Decision decision, boolean success, String errorMessage) {
            this.sessionId = sessionId;
            this.decision = decision;
            this.success = success;
            this.errorMessage = errorMessage;
        }

        public static DecisionReply success(String sessionId, Decision decision) {
            return new DecisionReply(sessionId, decision, true, null);
        }

        public static DecisionReply failure(String sessionId, String errorMessage) {
            return new DecisionReply(sessionId, null, false, errorMessage);
        }
    }

    // ========== STATS MESSAGES ==========
    public static class GetRagStats implements AgentCommand {
        public final ActorRef<RagStats> replyTo;

        public GetRagStats(ActorRef<RagStats> replyTo) {
            this.replyTo = replyTo;
        }
    }
}
