package com.deepansh.policyradar.memory;

import java.util.LinkedHashMap;
import java.util.Map;

/** @param score cosine similarity, i.e. 1 - cosine distance */
public record MemoryMatch(
        String id,
        String docKey,
        int chunkIndex,
        String text,
        double score,
        String sourceUrl,
        String sourceType,
        String pdfUrl
) {

    static MemoryMatch of(MemoryChunk chunk, double score) {
        return new MemoryMatch(chunk.getId(), chunk.getDocKey(), chunk.getChunkIndex(), chunk.getText(),
                score, chunk.getSourceUrl(), chunk.getSourceType(), chunk.getPdfUrl());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        m.put("doc_key", docKey);
        m.put("chunk_index", chunkIndex);
        m.put("score", Math.round(score * 10000d) / 10000d);
        m.put("text", text);
        if (sourceUrl != null) m.put("source_url", sourceUrl);
        if (sourceType != null) m.put("source_type", sourceType);
        if (pdfUrl != null) m.put("pdf_url", pdfUrl);
        return m;
    }
}
