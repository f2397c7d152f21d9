package com.deepansh.policyradar.memory;

import java.util.List;

/**
 * Session-scoped chunk storage partitioned into namespaces, one per embedding config.
 * A namespace fixes its vector dimension at creation.
 */
public interface VectorIndex {

    /** @return the namespace's dimension, or -1 if it does not exist */
    int dimension(String namespace);

    boolean hasDocument(String namespace, String sessionId, String docKey, String docHash);

    /**
     * Deletes any prior chunks for (session, docKey) and stores {@code chunks}, creating
     * the namespace on first use.
     *
     * @throws DimensionMismatchException before anything is modified, if the chunks'
     *                                    dimension differs from the namespace's
     */
    void replaceDocument(String namespace, String sessionId, String docKey, List<MemoryChunk> chunks);

    /** Drops every chunk in the namespace and re-creates it with {@code dimension}. */
    void recreateNamespace(String namespace, int dimension);

    List<MemoryMatch> search(String namespace, String sessionId, float[] query, int topK);

    /** Removes the session's chunks from every namespace. @return chunks removed */
    long deleteSession(String sessionId);
}
