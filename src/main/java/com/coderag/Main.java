package com.coderag;

import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.AskPattern;
import com.coderag.actors.RetrievalActor;
import com.coderag.agent.ContextSnippet;
import com.coderag.agent.PassThroughAgent;
import com.coderag.agent.RagAgent;
import com.coderag.agent.RagStats;
import com.coderag.config.RagConfig;
import com.coderag.embedding.EmbeddingGateway;
import com.coderag.errors.ManifestMissingException;
import com.coderag.errors.RagException;
import com.coderag.messages.Messages.*;
import com.coderag.pipeline.IndexingPipeline;
import com.coderag.pipeline.Manifest;
import com.coderag.pipeline.ManifestStore;
import com.coderag.pipeline.VerificationTool;
import com.coderag.retrieval.VectorIndex;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Scanner;
import java.util.UUID;
import java.util.concurrent.ExecutionException;

/**
 * Code RAG - command-line entry point
 *
 * <pre>
 *   index   build the index for RAG_ROOT_DIR and write the manifest
 *   verify  run canned queries against an existing index
 *   ask     interactive console; answers are enriched with codebase context
 *   clear   remove every entry from the index
 * </pre>
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        String command = args.length > 0 ? args[0].toLowerCase(Locale.ROOT) : "index";

        RagConfig config;
        try {
            config = RagConfig.fromEnv();
        } catch (IllegalArgumentException e) {
            log.error("❌ Invalid configuration: {}", e.getMessage());
            return 1;
        }
        log.info("⚙️  {}", config);

        switch (command) {
            case "index":
                return index(config);
            case "verify":
                return verify(config);
            case "ask":
                return ask(config);
            case "clear":
                return clear(config);
            default:
                System.out.println("Usage: code-rag [index|verify|ask|clear]");
                return 1;
        }
    }

    private static int index(RagConfig config) {
        System.out.println("\n🚀 Codebase Indexing");
        System.out.println("=".repeat(60));
        System.out.println("📁 Root directory: " + config.rootDir.toAbsolutePath());

        try (EmbeddingGateway embeddings = new EmbeddingGateway(config);
             VectorIndex vectorIndex = new VectorIndex(config)) {

            Manifest manifest = new IndexingPipeline(config, embeddings, vectorIndex).run();

            System.out.println("\n✅ Indexing Complete!");
            System.out.println("=".repeat(60));
            System.out.println("   Documents indexed: " + manifest.statistics.documentsLoaded);
            System.out.println("   Chunks created: " + manifest.statistics.chunksCreated);
            System.out.println("   Average chunk size: " + manifest.statistics.averageChunkSize + " chars");
            System.out.println("   Embedding model: " + manifest.statistics.embeddingModel
                + " (backend " + manifest.statistics.embeddingBackend + ")");
            System.out.println("   Vector store: " + manifest.statistics.vectorStoreProvider);
            System.out.println("   Estimated cost: " + manifest.statistics.estimatedCost);
            System.out.println("   File breakdown: " + manifest.fileBreakdown);
            return 0;
        } catch (RagException | RuntimeException e) {
            log.error("❌ Indexing failed: {}", e.getMessage(), e);
            return 1;
        } catch (IOException e) {
            log.warn("⚠️  Error releasing backends: {}", e.getMessage());
            return 0;
        }
    }

    private static int verify(RagConfig config) {
        System.out.println("\n🔍 Index Verification");
        System.out.println("=".repeat(60));

        try (EmbeddingGateway embeddings = new EmbeddingGateway(config);
             VectorIndex vectorIndex = new VectorIndex(config)) {

            new VerificationTool(new ManifestStore(config.manifestFile()), embeddings, vectorIndex,
                VerificationTool.DEFAULT_QUERIES, System.out).verify();
            return 0;
        } catch (ManifestMissingException e) {
            System.out.println("❌ " + e.getMessage());
            return 1;
        } catch (RagException | RuntimeException e) {
            log.error("❌ Verification failed: {}", e.getMessage(), e);
            return 1;
        } catch (IOException e) {
            log.warn("⚠️  Error releasing backends: {}", e.getMessage());
            return 0;
        }
    }

    private static int clear(RagConfig config) {
        try (VectorIndex vectorIndex = new VectorIndex(config)) {
            vectorIndex.clear();
            System.out.println("✅ Index cleared (" + vectorIndex.getProvider() + ")");
            return 0;
        } catch (RagException | RuntimeException e) {
            log.error("❌ Clearing index failed: {}", e.getMessage(), e);
            return 1;
        } catch (IOException e) {
            log.warn("⚠️  Error releasing backends: {}", e.getMessage());
            return 0;
        }
    }

    private static int ask(RagConfig config) {
        EmbeddingGateway embeddings;
        try {
            embeddings = new EmbeddingGateway(config);
        } catch (RagException e) {
            log.error("❌ Embedding backend unavailable: {}", e.getMessage());
            return 1;
        }
        VectorIndex vectorIndex = new VectorIndex(config);
        RagAgent agent = new RagAgent(new PassThroughAgent(), embeddings, vectorIndex, config.ragEnabled);

        ActorSystem<AgentCommand> system = ActorSystem.create(
            RetrievalActor.create(agent), "CodeRagSystem", ConfigFactory.load());
        String sessionId = UUID.randomUUID().toString().substring(0, 8);

        System.out.println("\n💬 Ask about the codebase. Commands: 'stats', 'quit'\n");
        Scanner scanner = new Scanner(System.in);
        try {
            while (true) {
                System.out.print("\n❓ Query: ");
                if (!scanner.hasNextLine()) {
                    break;
                }
                String input = scanner.nextLine().trim();

                if (input.equalsIgnoreCase("quit") || input.equalsIgnoreCase("exit")) {
                    break;
                }
                if (input.isEmpty()) {
                    continue;
                }
                if (input.equalsIgnoreCase("stats")) {
                    RagStats stats = AskPattern.<AgentCommand, RagStats>ask(
                        system, GetRagStats::new, Duration.ofSeconds(5), system.scheduler()
                    ).toCompletableFuture().get();
                    printStats(stats);
                    continue;
                }

                try {
                    DecisionReply reply = AskPattern.<AgentCommand, DecisionReply>ask(
                        system,
                        replyTo -> new Decide(sessionId, input, replyTo),
                        Duration.ofSeconds(30),
                        system.scheduler()
                    ).toCompletableFuture().get();
                    printReply(reply);
                } catch (ExecutionException e) {
                    System.out.println("❌ No answer within 30s: " + e.getCause().getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.error("❌ Stats request failed: {}", e.getCause().getMessage());
        } finally {
            System.out.println("🔄 Shutting down system...");
            system.terminate();
            try {
                embeddings.close();
                vectorIndex.close();
            } catch (IOException e) {
                log.warn("⚠️  Error releasing backends: {}", e.getMessage());
            }
        }
        return 0;
    }

    private static void printReply(DecisionReply reply) {
        if (!reply.success) {
            System.out.println("❌ " + reply.errorMessage);
            return;
        }
        System.out.println("🤖 " + reply.decision.decision);
        for (ContextSnippet snippet : reply.decision.ragContext) {
            System.out.println("   📄 " + snippet.source + " (" + snippet.relevance + ")");
            System.out.println("      " + snippet.preview.replace('\n', ' '));
        }
        System.out.println("   ⏱️  " + reply.decision.latencyMs + "ms"
            + (reply.decision.ragEnhanced ? ", RAG enhanced" : ""));
    }

    private static void printStats(RagStats stats) {
        System.out.println("📊 RAG Stats:");
        System.out.println("   Enabled: " + stats.enabled);
        System.out.println("   Queries: " + stats.queriesProcessed);
        System.out.println("   Successful retrievals: " + stats.successfulRetrievals);
        System.out.println("   Failed retrievals: " + stats.failedRetrievals);
        System.out.println("   Average latency: " + stats.averageLatencyMs + "ms");
        System.out.println("   Index: " + stats.vectorStoreStats.provider
            + " (" + stats.vectorStoreStats.totalDocuments + " documents)");
        System.out.println("   Embeddings: " + stats.embedderStats.provider + "/" + stats.embedderStats.model
            + " via " + stats.embedderStats.backend + ", tokens " + stats.embedderStats.tokensUsed
            + ", fallbacks " + stats.embedderStats.fallbackEmbeddings);
    }
}
