package com.deepansh.policyradar.memory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one ingest. {@code status} is indexed, skipped or failed; {@code reason}
 * explains the latter two.
 */
public record IngestResult(String status, String reason, int chunks, String namespace) {

    public static final String INDEXED = "indexed";
    public static final String SKIPPED = "skipped";
    public static final String FAILED = "failed";

    static IngestResult indexed(int chunks, String namespace) {
        return new IngestResult(INDEXED, null, chunks, namespace);
    }

    public static IngestResult skipped(String reason) {
        return new IngestResult(SKIPPED, reason, 0, null);
    }

    public static IngestResult failed(String reason) {
        return new IngestResult(FAILED, reason, 0, null);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", status);
        if (reason != null) m.put("reason", reason);
        if (INDEXED.equals(status)) m.put("chunks", chunks);
        return m;
    }
}
