package com.coderag.actors;

import akka.actor.typed.Behavior;
import akka.actor.typed.PostStop;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.coderag.agent.Decision;
import com.coderag.agent.RagAgent;
import com.coderag.messages.Messages.*;

/**
 * RetrievalActor - Serves {@link RagAgent} decisions to actor-based agents.
 * Queries are handled one at a time in arrival order.
 */
public class RetrievalActor extends AbstractBehavior<AgentCommand> {

    private final RagAgent agent;

    public static Behavior<AgentCommand> create(RagAgent agent) {
        return Behaviors.setup(context -> new RetrievalActor(context, agent));
    }

    private RetrievalActor(ActorContext<AgentCommand> context, RagAgent agent) {
        super(context);
        this.agent = agent;

        agent.initialize();
        getContext().getLog().info("🔍 RetrievalActor ready (RAG {})", agent.isEnabled() ? "enabled" : "disabled");
    }

    @Override
    public Receive<AgentCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(Decide.class, this::onDecide)
                .onMessage(GetRagStats.class, this::onGetRagStats)
                .onSignal(PostStop.class, this::onPostStop)
                .build();
    }

    private Behavior<AgentCommand> onDecide(Decide msg) {
        getContext().getLog().info("🔍 Decision request for session [{}]: {}", msg.sessionId, msg.query);

        try {
            Decision decision = agent.decide(msg.query);
            getContext().getLog().info("✅ Session [{}] answered in {}ms ({} context snippets)",
                msg.sessionId, decision.latencyMs, decision.ragContext.size());
            msg.replyTo.tell(DecisionReply.success(msg.sessionId, decision));
        } catch (Exception e) {
            getContext().getLog().error("❌ Base agent failed for session [{}]: {}", msg.sessionId, e.getMessage());
            msg.replyTo.tell(DecisionReply.failure(msg.sessionId, e.getMessage()));
        }

        return this;
    }

    private Behavior<AgentCommand> onGetRagStats(GetRagStats msg) {
        msg.replyTo.tell(agent.getStats());
        return this;
    }

    private Behavior<AgentCommand> onPostStop(PostStop signal) {
        getContext().getLog().info("🔒 RetrievalActor stopped after {} RAG queries", agent.getStats().queriesProcessed);
        return this;
    }
}
