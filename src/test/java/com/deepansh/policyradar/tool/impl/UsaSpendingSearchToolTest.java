package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.SourceRecord;
import com.deepansh.policyradar.provider.SearchResults;
import com.deepansh.policyradar.provider.UsaSpendingClient;
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
class UsaSpendingSearchToolTest {

    @Mock UsaSpendingClient client;
    @InjectMocks UsaSpendingSearchTool tool;

    private static final ToolContext CONTEXT = new ToolContext("s1", null, 30);

    @Test
    void execute_noFilters_returnsErrorWithoutCallingApi() {
        ToolResult result = tool.execute(Map.of("award_type", "grants"), CONTEXT);

        assertThat(result.isError()).isTrue();
        verifyNoInteractions(client);
    }

    @Test
    void execute_recipientOnly_defaultsToContractsOverLastYear() {
        SourceRecord award = SourceRecord.builder().sourceType("usaspending_award").title("ACME CORP").build();
        when(client.searchAwards(null, null, "Acme", "contracts", 365, 10))
                .thenReturn(new SearchResults(List.of(award), 1, Map.of("total_award_amount", 1250000.0)));

        ToolResult result = tool.execute(Map.of("recipient", "Acme"), CONTEXT);

        assertThat(result.getPayload()).containsEntry("recipient", "Acme").doesNotContainKey("keywords")
                .containsEntry("total_award_amount", 1250000.0);
        assertThat(tool.preview(result))
                .containsEntry("top_recipients", List.of("ACME CORP"))
                .containsEntry("total_award_amount", 1250000.0);
        assertThat(tool.label(Map.of("recipient", "Acme"))).isEqualTo("Search USAspending: Acme");
    }
}
