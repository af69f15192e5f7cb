package com.coderag.retrieval;

import com.coderag.errors.PersistenceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * LocalIndexBackend - In-memory vector map persisted as a single JSON file.
 *
 * <p>Queries compare against every entry (exact cosine ranking). Reads run concurrently;
 * upserts and the file write that follows them hold the write lock, so the map is never
 * serialized while it is being mutated. Insertion order is kept so equal scores rank
 * in the order the entries were first stored.
 */
public class LocalIndexBackend implements IndexBackend {

    private static final Logger log = LoggerFactory.getLogger(LocalIndexBackend.class);

    private final Path indexFile;
    private final ObjectMapper jsonMapper;
    private final Map<String, IndexEntry> entries = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private String lastIndexed;

    public LocalIndexBackend(Path indexFile) {
        this.indexFile = indexFile;
        this.jsonMapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return "local-file";
    }

    @Override
    public int open() throws PersistenceException {
        lock.writeLock().lock();
        try {
            Path dir = indexFile.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }

            entries.clear();
            lastIndexed = null;
            if (Files.exists(indexFile)) {
                JsonNode root = jsonMapper.readTree(indexFile.toFile());
                IndexFile snapshot = IndexFile.fromJson(root);
                for (IndexEntry entry : snapshot.entries) {
                    entries.put(entry.id, entry);
                }
                lastIndexed = snapshot.lastIndexed;
            }

            log.info("✅ Using local RAG index at {}", indexFile);
            log.info("   Total documents: {}", entries.size());
            return entries.size();
        } catch (IOException | IllegalArgumentException e) {
            throw new PersistenceException("Could not load local index " + indexFile + ": " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void upsert(List<IndexEntry> batch) throws PersistenceException {
        lock.writeLock().lock();
        try {
            for (IndexEntry entry : batch) {
                entries.put(entry.id, entry);
            }
            lastIndexed = Instant.now().toString();
            persist();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Caller must hold the write lock.
     */
    private void persist() throws PersistenceException {
        try {
            Path dir = indexFile.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            JsonNode root = IndexFile.toJson(jsonMapper, entries.values(), lastIndexed);
            jsonMapper.writerWithDefaultPrettyPrinter().writeValue(indexFile.toFile(), root);
        } catch (IOException e) {
            throw new PersistenceException("Could not write local index " + indexFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<RetrievalResult> query(float[] vector, int topK, double threshold) {
        List<RetrievalResult> matches = new ArrayList<>();

        lock.readLock().lock();
        try {
            for (IndexEntry entry : entries.values()) {
                double score = VectorMath.cosine(vector, entry.embedding);
                if (score >= threshold) {
                    matches.add(entry.toResult(score));
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        // List.sort is stable: ties keep insertion order
        matches.sort((a, b) -> Double.compare(b.score, a.score));
        return matches.size() > topK ? new ArrayList<>(matches.subList(0, topK)) : matches;
    }

    @Override
    public void clear() throws PersistenceException {
        lock.writeLock().lock();
        try {
            entries.clear();
            lastIndexed = null;
            Files.deleteIfExists(indexFile);
        } catch (IOException e) {
            throw new PersistenceException("Could not delete local index " + indexFile + ": " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int dimension() {
        lock.readLock().lock();
        try {
            return entries.isEmpty() ? 0 : entries.values().iterator().next().embedding.length;
        } finally {
            lock.readLock().unlock();
        }
    }

    public String getLastIndexed() {
        lock.readLock().lock();
        try {
            return lastIndexed;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Path getIndexFile() {
        return indexFile;
    }
}
