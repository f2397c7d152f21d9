package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.SourceRecord;
import com.deepansh.policyradar.provider.RegulationsClient;
import com.deepansh.policyradar.provider.SearchResults;
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
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegsSearchDocumentsToolTest {

    @Mock RegulationsClient client;
    @InjectMocks RegsSearchDocumentsTool tool;

    private static final ToolContext CONTEXT = new ToolContext("s1", null, 45);

    @Test
    void execute_returnsRecordsAsSourcesAndEchoesQuery() {
        List<SourceRecord> records = List.of(
                SourceRecord.builder().sourceType("regulations_document").id("EPA-HQ-1").title("PFAS rule").build(),
                SourceRecord.builder().sourceType("regulations_document").id("EPA-HQ-2").title("PFAS notice").build());
        when(client.searchDocuments("PFAS", 10, 45)).thenReturn(SearchResults.of(records, 57));

        ToolResult result = tool.execute(Map.of("search_term", "PFAS"), CONTEXT);

        assertThat(result.getPayload())
                .containsEntry("search_term", "PFAS")
                .containsEntry("days", 45)
                .containsEntry("count", 2)
                .containsEntry("total", 57);
        assertThat(result.getSources()).extracting(SourceRecord::getId).containsExactly("EPA-HQ-1", "EPA-HQ-2");
        assertThat(tool.preview(result)).containsEntry("top_titles", List.of("PFAS rule", "PFAS notice"));
    }

    @Test
    void execute_pageSizeAndDaysAreClamped() {
        when(client.searchDocuments("water", 25, 365)).thenReturn(SearchResults.of(List.of(), 0));

        ToolResult result = tool.execute(Map.of("search_term", "water", "page_size", 100, "days", "9000"), CONTEXT);

        assertThat(result.getPayload()).containsEntry("count", 0);
    }

    @Test
    void execute_missingSearchTerm_returnsError() {
        assertThat(tool.execute(Map.of(), CONTEXT).errorMessage()).isEqualTo("'search_term' is required");
        verifyNoInteractions(client);
    }
}
