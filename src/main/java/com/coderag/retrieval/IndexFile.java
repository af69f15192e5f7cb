package com.coderag.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * IndexFile - The on-disk layout of the local index ({@code index.json}):
 *
 * <pre>
 * {
 *   "index": [ ["id", {"embedding": [..], "metadata": {"source", "type", "chunk", "content"}}], ... ],
 *   "count": 42,
 *   "lastIndexed": "2024-05-01T10:15:30Z"
 * }
 * </pre>
 *
 * Conversion is a pure function of the in-memory entries; file I/O happens elsewhere.
 */
public final class IndexFile {

    public final List<IndexEntry> entries;
    public final String lastIndexed;

    public IndexFile(List<IndexEntry> entries, String lastIndexed) {
        this.entries = entries;
        this.lastIndexed = lastIndexed;
    }

    public static JsonNode toJson(ObjectMapper mapper, Collection<IndexEntry> entries, String lastIndexed) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode index = root.putArray("index");

        for (IndexEntry entry : entries) {
            ArrayNode pair = index.addArray();
            pair.add(entry.id);

            ObjectNode data = pair.addObject();
            ArrayNode embedding = data.putArray("embedding");
            for (float value : entry.embedding) {
                embedding.add(value);
            }
            ObjectNode metadata = data.putObject("metadata");
            metadata.put("source", entry.source);
            metadata.put("type", entry.type);
            metadata.put("chunk", entry.chunkIndex);
            metadata.put("content", entry.content);
        }

        root.put("count", entries.size());
        if (lastIndexed != null) {
            root.put("lastIndexed", lastIndexed);
        } else {
            root.putNull("lastIndexed");
        }
        return root;
    }

    /**
     * @throws IllegalArgumentException if the document does not follow the layout above
     */
    public static IndexFile fromJson(JsonNode root) {
        JsonNode index = root.get("index");
        if (index == null || !index.isArray()) {
            throw new IllegalArgumentException("index.json has no 'index' array");
        }

        List<IndexEntry> entries = new ArrayList<>(index.size());
        for (JsonNode pair : index) {
            if (!pair.isArray() || pair.size() != 2) {
                throw new IllegalArgumentException("index.json entry is not an [id, data] pair");
            }
            String id = pair.get(0).asText();
            JsonNode data = pair.get(1);
            JsonNode embeddingNode = data.path("embedding");
            if (!embeddingNode.isArray()) {
                throw new IllegalArgumentException("index.json entry " + id + " has no embedding");
            }

            float[] embedding = new float[embeddingNode.size()];
            for (int i = 0; i < embedding.length; i++) {
                embedding[i] = (float) embeddingNode.get(i).asDouble();
            }

            JsonNode metadata = data.path("metadata");
            entries.add(new IndexEntry(id, embedding,
                metadata.path("source").asText(""),
                metadata.path("type").asText(""),
                metadata.path("chunk").asInt(0),
                metadata.path("content").asText("")));
        }

        JsonNode lastIndexed = root.get("lastIndexed");
        return new IndexFile(entries, lastIndexed == null || lastIndexed.isNull() ? null : lastIndexed.asText());
    }
}
