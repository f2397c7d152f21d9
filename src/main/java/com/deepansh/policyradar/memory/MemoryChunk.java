package com.deepansh.policyradar.memory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;

import java.time.Instant;
import java.util.List;

/**
 * One embedded window of a document, scoped to a session.
 * Stored in the collection of its embedding namespace.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryChunk {

    @Id
    private String id;

    private String sessionId;
    private String docKey;
    private int chunkIndex;
    private String text;

    /** Stored as List<Double> for MongoDB compatibility */
    private List<Double> embedding;

    /** SHA-256 of the whole normalized document, shared by all its chunks */
    private String docHash;

    private String sourceUrl;
    private String sourceType;
    private String pdfUrl;

    private Instant createdAt;

    public int dimension() {
        return embedding != null ? embedding.size() : 0;
    }
}
