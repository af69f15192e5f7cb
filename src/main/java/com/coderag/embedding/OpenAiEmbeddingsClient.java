package com.coderag.embedding;

import com.coderag.errors.BackendInitException;
import com.coderag.errors.RemoteBackendException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;

/**
 * OpenAiEmbeddingsClient - Remote embeddings over the OpenAI-compatible /v1/embeddings API.
 * Every successful call reports its token usage to the supplied listener.
 */
public class OpenAiEmbeddingsClient implements EmbeddingsClient, Closeable {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingsClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper jsonMapper;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final int dims;
    private final LongConsumer usageListener;

    public OpenAiEmbeddingsClient(String apiKey, String baseUrl, String model, int dims,
                                  long timeoutMs, LongConsumer usageListener) throws BackendInitException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new BackendInitException("OPENAI_API_KEY is not set");
        }
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.model = model;
        this.dims = dims;
        this.usageListener = usageListener;
        this.jsonMapper = new ObjectMapper();
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(Math.min(timeoutMs, 10_000L), TimeUnit.MILLISECONDS)
            .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .build();

        log.info("🌐 OpenAI embeddings client ready (model={}, dimensions={}, endpoint={})", model, dims, baseUrl);
    }

    @Override
    public float[] embed(String text) throws RemoteBackendException {
        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("model", model);
        payload.put("input", text);
        if (model.startsWith("text-embedding-3")) {
            // v3 models can shorten their output to the configured dimension
            payload.put("dimensions", dims);
        }

        Request request = new Request.Builder()
            .url(baseUrl + "/v1/embeddings")
            .header("Authorization", "Bearer " + apiKey)
            .post(RequestBody.create(payload.toString(), JSON))
            .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String responseBody = body != null ? body.string() : "";
            JsonNode json = parse(responseBody, response.code());

            JsonNode error = json.get("error");
            if (error != null && !error.isNull()) {
                String message = error.path("message").asText("unknown error");
                throw new RemoteBackendException("OpenAI API error: " + message, response.code());
            }
            if (!response.isSuccessful()) {
                throw new RemoteBackendException("OpenAI API returned HTTP " + response.code(), response.code());
            }

            JsonNode embedding = json.path("data").path(0).path("embedding");
            if (!embedding.isArray() || embedding.size() == 0) {
                throw new RemoteBackendException("OpenAI API response has no embedding", response.code());
            }

            float[] vector = new float[embedding.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) embedding.get(i).asDouble();
            }

            long tokens = json.path("usage").path("total_tokens").asLong(0L);
            if (tokens > 0 && usageListener != null) {
                usageListener.accept(tokens);
            }
            return vector;
        } catch (IOException e) {
            throw new RemoteBackendException("OpenAI API call failed: " + e.getMessage(), e);
        }
    }

    private JsonNode parse(String body, int status) throws RemoteBackendException {
        if (body.isEmpty()) {
            throw new RemoteBackendException("OpenAI API returned an empty body (HTTP " + status + ")", status);
        }
        try {
            return jsonMapper.readTree(body);
        } catch (IOException e) {
            throw new RemoteBackendException("OpenAI API returned malformed JSON (HTTP " + status + ")", status, e);
        }
    }

    @Override
    public int dimensions() {
        return dims;
    }

    @Override
    public String name() {
        return "OPENAI";
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
