package com.deepansh.policyradar.tool;

import com.deepansh.policyradar.memory.EmbeddingConfig;
import com.deepansh.policyradar.memory.IngestResult;
import com.deepansh.policyradar.memory.RetrievalMemory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentIndexerTest {

    @Mock RetrievalMemory retrievalMemory;
    @InjectMocks DocumentIndexer indexer;

    private static final EmbeddingConfig CONFIG = new EmbeddingConfig("local", "hashing-384", null, null);

    @Test
    void index_htmlWithoutPdfLink_isSkipped() {
        IngestResult result = indexer.index(new ToolContext("s1", CONFIG, 30), "doc", "page text",
                false, null, List.of(), RetrievalMemory.DocumentMetadata.EMPTY);

        assertThat(result.reason()).isEqualTo("not_pdf");
        verifyNoInteractions(retrievalMemory);
    }

    @Test
    void index_pdfWithoutSession_isSkipped() {
        IngestResult result = indexer.index(new ToolContext(null, CONFIG, 30), "doc", "pdf text",
                true, null, List.of(), RetrievalMemory.DocumentMetadata.EMPTY);

        assertThat(result.reason()).isEqualTo("missing_session_or_text");
        verifyNoInteractions(retrievalMemory);
    }

    @Test
    void index_knownPdfLink_ingestsUnderSessionConfig() {
        when(retrievalMemory.ingest(eq("s1"), eq("EPA-1"), anyString(), any(), eq(CONFIG)))
                .thenReturn(IngestResult.skipped("already_indexed"));

        IngestResult result = indexer.index(new ToolContext("s1", CONFIG, 30), "EPA-1", "rule text",
                false, "https://downloads.regulations.gov/EPA-1.pdf", null, RetrievalMemory.DocumentMetadata.EMPTY);

        assertThat(result.reason()).isEqualTo("already_indexed");
    }
}
