package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.memory.EmbeddingConfig;
import com.deepansh.policyradar.memory.MemoryMatch;
import com.deepansh.policyradar.memory.RetrievalMemory;
import com.deepansh.policyradar.tool.ToolContext;
import com.deepansh.policyradar.tool.ToolResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchPdfMemoryToolTest {

    private static final EmbeddingConfig CONFIG = new EmbeddingConfig("local", "hashing-384", null, null);

    @Mock RetrievalMemory memory;
    @InjectMocks SearchPdfMemoryTool tool;

    private static MemoryMatch match(String docKey, int chunk, double score) {
        return new MemoryMatch(docKey + "_" + chunk, docKey, chunk, "text " + chunk, score, null, "pdf",
                "https://example.gov/" + docKey + ".pdf");
    }

    @Test
    void execute_withoutSession_returnsError() {
        ToolResult result = tool.execute(Map.of("query", "interest rates"), new ToolContext(null, CONFIG, 30));

        assertThat(result.errorMessage()).isEqualTo("PDF memory not available without a session.");
        verifyNoInteractions(memory);
    }

    @Test
    @SuppressWarnings("unchecked")
    void execute_matchesFromSameDocument_areGroupedOnce() {
        when(memory.defaultTopK()).thenReturn(5);
        when(memory.query(eq("s1"), eq("interest rates"), eq(5), any())).thenReturn(List.of(
                match("doc-a", 2, 0.9), match("doc-a", 0, 0.8), match("doc-b", 1, 0.5)));

        ToolResult result = tool.execute(Map.of("query", "interest rates"), new ToolContext("s1", CONFIG, 30));

        assertThat(result.getPayload()).containsEntry("count", 3);
        List<Map<String, Object>> documents = (List<Map<String, Object>>) result.getPayload().get("documents");
        assertThat(documents).extracting(d -> d.get("doc_key")).containsExactly("doc-a", "doc-b");
        assertThat((List<?>) result.getPayload().get("matches")).hasSize(3);
        assertThat(tool.completedLabel(Map.of("query", "interest rates"), result))
                .isEqualTo("Search PDF memory: interest rates (top: doc-a +1)");
    }

    @Test
    void execute_topKOutOfRange_isClamped() {
        when(memory.defaultTopK()).thenReturn(5);
        when(memory.query(eq("s1"), eq("q"), eq(10), any())).thenReturn(List.of());

        ToolResult result = tool.execute(Map.of("query", "q", "top_k", 99), new ToolContext("s1", CONFIG, 30));

        assertThat(result.getPayload()).containsEntry("count", 0);
        assertThat(tool.completedLabel(Map.of("query", "q"), result)).isEqualTo("Search PDF memory: q");
    }
}
