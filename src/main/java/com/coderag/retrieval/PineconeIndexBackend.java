package com.coderag.retrieval;

import com.coderag.errors.BackendInitException;
import com.coderag.errors.RemoteBackendException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * PineconeIndexBackend - Remote vector index over the Pinecone REST data plane.
 *
 * <p>Upserts go out in batches of {@value #UPSERT_BATCH_SIZE}; stored content is cut to a
 * preview length to stay under the metadata payload limit. Network and auth failures on
 * upsert/query/clear surface as {@link RemoteBackendException}.
 */
public class PineconeIndexBackend implements IndexBackend, Closeable {

    private static final Logger log = LoggerFactory.getLogger(PineconeIndexBackend.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String API_VERSION = "2024-07";

    static final int UPSERT_BATCH_SIZE = 100;

    private final String apiKey;
    private final String indexName;
    private final String controlUrl;
    private final int previewLength;
    private final OkHttpClient httpClient;
    private final ObjectMapper jsonMapper;

    private String host;
    private int totalRecords;
    private int dimension;

    public PineconeIndexBackend(String apiKey, String indexName, String host, String controlUrl,
                                int previewLength, long timeoutMs) {
        this.apiKey = apiKey;
        this.indexName = indexName;
        this.host = host;
        this.controlUrl = controlUrl;
        this.previewLength = previewLength;
        this.jsonMapper = new ObjectMapper();
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .build();
    }

    @Override
    public String name() {
        return "pinecone";
    }

    /**
     * Resolve the index host (if not configured) and verify connectivity with index stats.
     */
    @Override
    public int open() throws BackendInitException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new BackendInitException("PINECONE_API_KEY is not set");
        }

        try {
            if (host == null || host.isBlank()) {
                JsonNode description = call(get(controlUrl + "/indexes/" + indexName));
                String resolved = description.path("host").asText("");
                if (resolved.isEmpty()) {
                    throw new BackendInitException("Pinecone index '" + indexName + "' has no host");
                }
                host = resolved.startsWith("http") ? resolved : "https://" + resolved;
                if (host.endsWith("/")) {
                    host = host.substring(0, host.length() - 1);
                }
            }

            JsonNode stats = call(post("/describe_index_stats", jsonMapper.createObjectNode()));
            if (!stats.has("totalVectorCount") && !stats.has("dimension")) {
                throw new BackendInitException("Unexpected describe_index_stats response from " + host);
            }
            totalRecords = stats.path("totalVectorCount").asInt(0);
            dimension = stats.path("dimension").asInt(0);
        } catch (RemoteBackendException e) {
            throw new BackendInitException("Pinecone connection failed: " + e.getMessage(), e);
        }

        log.info("✅ Connected to Pinecone index \"{}\"", indexName);
        log.info("   Total documents: {}", totalRecords);
        return totalRecords;
    }

    @Override
    public void upsert(List<IndexEntry> entries) throws RemoteBackendException {
        for (int start = 0; start < entries.size(); start += UPSERT_BATCH_SIZE) {
            List<IndexEntry> batch = entries.subList(start, Math.min(start + UPSERT_BATCH_SIZE, entries.size()));

            ObjectNode payload = jsonMapper.createObjectNode();
            ArrayNode vectors = payload.putArray("vectors");
            for (IndexEntry entry : batch) {
                ObjectNode vector = vectors.addObject();
                vector.put("id", entry.id);
                ArrayNode values = vector.putArray("values");
                for (float value : entry.embedding) {
                    values.add(value);
                }
                ObjectNode metadata = vector.putObject("metadata");
                metadata.put("source", entry.source);
                metadata.put("type", entry.type);
                metadata.put("chunk", entry.chunkIndex);
                metadata.put("content", entry.content.length() > previewLength
                    ? entry.content.substring(0, previewLength) : entry.content);
            }

            call(post("/vectors/upsert", payload));
            log.info("  ✓ Upserted batch {}", start / UPSERT_BATCH_SIZE + 1);
        }

        if (!entries.isEmpty()) {
            dimension = entries.get(0).embedding.length;
        }
        totalRecords = entries.size();
    }

    @Override
    public List<RetrievalResult> query(float[] vector, int topK, double threshold) throws RemoteBackendException {
        ObjectNode payload = jsonMapper.createObjectNode();
        ArrayNode values = payload.putArray("vector");
        for (float value : vector) {
            values.add(value);
        }
        payload.put("topK", topK);
        payload.put("includeMetadata", true);

        JsonNode response = call(post("/query", payload));

        List<RetrievalResult> matches = new ArrayList<>();
        for (JsonNode match : response.path("matches")) {
            double score = match.path("score").asDouble();
            if (score < threshold) {
                continue;
            }
            JsonNode metadata = match.path("metadata");
            matches.add(new RetrievalResult(
                match.path("id").asText(),
                metadata.path("source").asText(""),
                metadata.path("content").asText(""),
                metadata.path("type").asText(""),
                score,
                metadata.path("chunk").asInt(0)));
        }
        matches.sort((a, b) -> Double.compare(b.score, a.score));
        return matches.size() > topK ? new ArrayList<>(matches.subList(0, topK)) : matches;
    }

    @Override
    public void clear() throws RemoteBackendException {
        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("deleteAll", true);
        call(post("/vectors/delete", payload));
        totalRecords = 0;
    }

    @Override
    public int size() {
        return totalRecords;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private Request get(String url) {
        return baseRequest(url).get().build();
    }

    private Request post(String path, JsonNode body) {
        return baseRequest(host + path).post(RequestBody.create(body.toString(), JSON)).build();
    }

    private Request.Builder baseRequest(String url) {
        return new Request.Builder()
            .url(url)
            .header("Api-Key", apiKey)
            .header("X-Pinecone-API-Version", API_VERSION)
            .header("Accept", "application/json");
    }

    private JsonNode call(Request request) throws RemoteBackendException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String responseBody = body != null ? body.string() : "";

            if (!response.isSuccessful()) {
                throw new RemoteBackendException("Pinecone " + request.url().encodedPath() + " returned HTTP "
                    + response.code() + (responseBody.isEmpty() ? "" : ": " + responseBody), response.code());
            }
            return responseBody.isEmpty() ? jsonMapper.createObjectNode() : jsonMapper.readTree(responseBody);
        } catch (IOException | IllegalArgumentException e) {
            throw new RemoteBackendException("Pinecone call to " + request.url() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
