package com.deepansh.policyradar.memory;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local index for development and tests. Lost on restart.
 */
@Slf4j
public class InMemoryVectorIndex implements VectorIndex {

    private final Map<String, Namespace> namespaces = new ConcurrentHashMap<>();

    @Override
    public int dimension(String namespace) {
        Namespace ns = namespaces.get(namespace);
        return ns != null ? ns.dimension : -1;
    }

    @Override
    public boolean hasDocument(String namespace, String sessionId, String docKey, String docHash) {
        Namespace ns = namespaces.get(namespace);
        if (ns == null) return false;
        synchronized (ns) {
            return ns.rows.stream().anyMatch(c -> sessionId.equals(c.getSessionId())
                    && docKey.equals(c.getDocKey())
                    && docHash.equals(c.getDocHash()));
        }
    }

    @Override
    public void replaceDocument(String namespace, String sessionId, String docKey, List<MemoryChunk> chunks) {
        if (chunks.isEmpty()) return;
        int dimension = chunks.get(0).dimension();
        Namespace ns = namespaces.computeIfAbsent(namespace, k -> {
            log.info("Creating in-memory namespace {} [dim={}]", k, dimension);
            return new Namespace(dimension);
        });
        synchronized (ns) {
            if (ns.dimension != dimension) {
                throw new DimensionMismatchException(namespace, ns.dimension, dimension);
            }
            ns.rows.removeIf(c -> sessionId.equals(c.getSessionId()) && docKey.equals(c.getDocKey()));
            ns.rows.addAll(chunks);
        }
    }

    @Override
    public void recreateNamespace(String namespace, int dimension) {
        log.warn("Recreating in-memory namespace {} [dim={}]", namespace, dimension);
        namespaces.put(namespace, new Namespace(dimension));
    }

    @Override
    public List<MemoryMatch> search(String namespace, String sessionId, float[] query, int topK) {
        Namespace ns = namespaces.get(namespace);
        if (ns == null) return List.of();
        List<MemoryChunk> candidates;
        synchronized (ns) {
            candidates = ns.rows.stream().filter(c -> sessionId.equals(c.getSessionId())).toList();
        }
        return candidates.stream()
                .map(c -> MemoryMatch.of(c, VectorMath.cosineSimilarity(query, VectorMath.toFloatArray(c.getEmbedding()))))
                .sorted(Comparator.comparingDouble(MemoryMatch::score).reversed())
                .limit(topK)
                .toList();
    }

    @Override
    public long deleteSession(String sessionId) {
        long removed = 0;
        for (Namespace ns : namespaces.values()) {
            synchronized (ns) {
                int before = ns.rows.size();
                ns.rows.removeIf(c -> sessionId.equals(c.getSessionId()));
                removed += before - ns.rows.size();
            }
        }
        return removed;
    }

    private static final class Namespace {
        private final int dimension;
        private final List<MemoryChunk> rows = new ArrayList<>();

        private Namespace(int dimension) {
            this.dimension = dimension;
        }
    }
}
