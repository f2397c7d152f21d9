package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.provider.SearchGovClient;
import com.deepansh.policyradar.tool.ToolArgs;
import com.deepansh.policyradar.tool.ToolContext;
import com.deepansh.policyradar.tool.ToolResult;
import com.deepansh.policyradar.tool.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.deepansh.policyradar.tool.JsonSchema.integer;
import static com.deepansh.policyradar.tool.JsonSchema.object;
import static com.deepansh.policyradar.tool.JsonSchema.properties;
import static com.deepansh.policyradar.tool.JsonSchema.string;

@Component
public class SearchGovSearchTool extends SearchTool {

    private final SearchGovClient client;

    public SearchGovSearchTool(SearchGovClient client) {
        super(new ToolSpec("searchgov_search",
                "Web search restricted to government sites via Search.gov. Use when the other sources miss a topic.",
                object(properties(
                        "query", string("Search text"),
                        "limit", integer("Results to return (1-20). Default: 10", 1, 20)),
                        "query"),
                DataSource.SEARCHGOV));
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String query = ToolArgs.string(args, "query");
        if (query == null) return ToolResult.error("'query' is required");
        int limit = ToolArgs.clampedInt(args, "limit", 10, 1, 20);
        return toResult(client.search(query, limit), echo("query", query));
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Search Search.gov: " + ToolArgs.string(args, "query", "");
    }
}
