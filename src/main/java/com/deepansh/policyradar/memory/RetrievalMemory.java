package com.deepansh.policyradar.memory;

import com.deepansh.policyradar.config.RadarProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session-scoped document memory: chunk, embed, store, search.
 *
 * Ingest is idempotent per (session, document, content hash). Vectors produced under
 * different embedding configs live in different namespaces and never mix. A namespace
 * whose dimension no longer matches its model is recreated once, never truncated.
 *
 * Locks cover only the delete-then-upsert of one document; embedding happens outside.
 */
@Service
@Slf4j
public class RetrievalMemory {

    private final VectorIndex index;
    private final EmbeddingService embeddingService;
    private final RadarProperties.Memory props;
    private final Map<String, ReentrantLock> namespaceLocks = new ConcurrentHashMap<>();

    public RetrievalMemory(VectorIndex index, EmbeddingService embeddingService, RadarProperties properties) {
        this.index = index;
        this.embeddingService = embeddingService;
        this.props = properties.getMemory();
    }

    public IngestResult ingest(String sessionId, String docKey, String text,
                               DocumentMetadata metadata, EmbeddingConfig config) {
        if (isBlank(sessionId) || isBlank(docKey) || isBlank(text)) {
            return IngestResult.skipped("missing_session_or_text");
        }
        String normalized = TextChunker.normalize(text);
        if (normalized.isEmpty()) {
            return IngestResult.skipped("missing_session_or_text");
        }

        String namespace = config.namespace();
        String docHash = Hashing.sha256(normalized);

        try {
            if (index.hasDocument(namespace, sessionId, docKey, docHash)) {
                log.debug("Document already indexed [session={}, doc={}]", sessionId, docKey);
                return IngestResult.skipped("already_indexed");
            }

            List<TextChunker.Chunk> chunks = TextChunker.chunk(
                    normalized, props.getChunkSize(), props.getChunkOverlap(), props.getMaxChunks());
            List<float[]> vectors = embeddingService.embed(config, chunks.stream().map(TextChunker.Chunk::text).toList());
            if (vectors.size() != chunks.size()) {
                return IngestResult.failed("embedding_failed");
            }

            List<MemoryChunk> rows = toRows(sessionId, docKey, docHash, metadata, chunks, vectors);
            store(namespace, sessionId, docKey, rows);

            log.info("Indexed document [session={}, doc={}, chunks={}, namespace={}]",
                    sessionId, docKey, rows.size(), namespace);
            return IngestResult.indexed(rows.size(), namespace);

        } catch (RuntimeException e) {
            log.error("Ingest failed [session={}, doc={}]: {}", sessionId, docKey, e.getMessage());
            return IngestResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * @return matches best first; empty when nothing is indexed or the query cannot be embedded
     */
    public List<MemoryMatch> query(String sessionId, String text, int topK, EmbeddingConfig config) {
        if (isBlank(sessionId) || isBlank(text)) return List.of();
        try {
            List<float[]> vectors = embeddingService.embed(config, List.of(text));
            if (vectors.isEmpty()) {
                log.warn("Query embedding unavailable, returning no matches [session={}]", sessionId);
                return List.of();
            }
            return index.search(config.namespace(), sessionId, vectors.get(0), topK > 0 ? topK : props.getTopK());
        } catch (RuntimeException e) {
            log.error("Memory query failed [session={}]: {}", sessionId, e.getMessage());
            return List.of();
        }
    }

    public long deleteSession(String sessionId) {
        if (isBlank(sessionId)) return 0;
        return index.deleteSession(sessionId);
    }

    public int defaultTopK() {
        return props.getTopK();
    }

    private void store(String namespace, String sessionId, String docKey, List<MemoryChunk> rows) {
        ReentrantLock lock = namespaceLocks.computeIfAbsent(namespace, k -> new ReentrantLock());
        lock.lock();
        try {
            index.replaceDocument(namespace, sessionId, docKey, rows);
        } catch (DimensionMismatchException e) {
            log.warn("{}; recreating namespace", e.getMessage());
            index.recreateNamespace(namespace, e.getActual());
            index.replaceDocument(namespace, sessionId, docKey, rows);
        } finally {
            lock.unlock();
        }
    }

    private List<MemoryChunk> toRows(String sessionId, String docKey, String docHash, DocumentMetadata metadata,
                                     List<TextChunker.Chunk> chunks, List<float[]> vectors) {
        String idPrefix = chunkIdPrefix(sessionId, docKey);
        Instant now = Instant.now();
        DocumentMetadata meta = metadata != null ? metadata : DocumentMetadata.EMPTY;
        List<MemoryChunk> rows = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            TextChunker.Chunk chunk = chunks.get(i);
            rows.add(MemoryChunk.builder()
                    .id(idPrefix + chunk.index())
                    .sessionId(sessionId)
                    .docKey(docKey)
                    .chunkIndex(chunk.index())
                    .text(chunk.text())
                    .embedding(VectorMath.toDoubleList(vectors.get(i)))
                    .docHash(docHash)
                    .sourceUrl(meta.sourceUrl())
                    .sourceType(meta.sourceType())
                    .pdfUrl(meta.pdfUrl())
                    .createdAt(now)
                    .build());
        }
        return rows;
    }

    static String chunkIdPrefix(String sessionId, String docKey) {
        String session = sessionId.length() > 12 ? sessionId.substring(0, 12) : sessionId;
        return session + "_" + Hashing.sha1(docKey) + "_";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /** Provenance stored alongside every chunk of a document. */
    public record DocumentMetadata(String sourceUrl, String sourceType, String pdfUrl) {
        public static final DocumentMetadata EMPTY = new DocumentMetadata(null, null, null);
    }
}
