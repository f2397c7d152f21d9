package com.deepansh.policyradar.tool;

import com.deepansh.policyradar.memory.IngestResult;
import com.deepansh.policyradar.memory.RetrievalMemory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Feeds text read by content tools into retrieval memory. Only PDF-like content is
 * indexed: a PDF body, a known PDF link, or page images.
 */
@Component
@Slf4j
public class DocumentIndexer {

    private final RetrievalMemory retrievalMemory;

    public DocumentIndexer(RetrievalMemory retrievalMemory) {
        this.retrievalMemory = retrievalMemory;
    }

    public IngestResult index(ToolContext context, String docKey, String text, boolean isPdf, String pdfUrl,
                              List<ToolImage> images, RetrievalMemory.DocumentMetadata metadata) {
        boolean eligible = isPdf || (pdfUrl != null && !pdfUrl.isBlank()) || (images != null && !images.isEmpty());
        if (!eligible) {
            return IngestResult.skipped("not_pdf");
        }
        if (!context.hasSession() || text == null || text.isBlank()) {
            return IngestResult.skipped("missing_session_or_text");
        }
        IngestResult result = retrievalMemory.ingest(context.sessionId(), docKey, text, metadata,
                context.embeddingConfig());
        log.debug("Indexing [{}] -> {}", docKey, result.status());
        return result;
    }
}
