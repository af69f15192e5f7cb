package com.coderag.retrieval;

import com.coderag.errors.RagException;

import java.util.List;

/**
 * IndexBackend - Storage and similarity search behind {@link VectorIndex}
 */
public interface IndexBackend {

    /**
     * @return short backend identifier used in stats and the manifest
     */
    String name();

    /**
     * Connect to (or load) the backing store.
     * @return number of entries already stored
     */
    int open() throws RagException;

    /**
     * Insert or overwrite entries by id.
     */
    void upsert(List<IndexEntry> entries) throws RagException;

    /**
     * @return at most {@code topK} results scoring at least {@code threshold}, best first
     */
    List<RetrievalResult> query(float[] vector, int topK, double threshold) throws RagException;

    /**
     * Remove every entry.
     */
    void clear() throws RagException;

    /**
     * @return number of stored entries as last known to this process
     */
    int size();

    /**
     * @return vector dimension of the stored entries, or 0 when unknown or empty
     */
    int dimension();
}
