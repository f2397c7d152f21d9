package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.provider.DataGovClient;
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
public class DataGovSearchTool extends SearchTool {

    private final DataGovClient client;

    public DataGovSearchTool(DataGovClient client) {
        super(new ToolSpec("datagov_search",
                "Search the data.gov catalog for federal datasets. Returns dataset title, publisher and landing page.",
                object(properties(
                        "query", string("Search text"),
                        "organization", string("Publishing organization slug, e.g. epa-gov"),
                        "rows", integer("Datasets to return (1-50). Default: 10", 1, 50)),
                        "query"),
                DataSource.DATAGOV));
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String query = ToolArgs.string(args, "query");
        if (query == null) return ToolResult.error("'query' is required");
        String organization = ToolArgs.string(args, "organization");
        int rows = ToolArgs.clampedInt(args, "rows", 10, 1, 50);
        return toResult(client.search(query, organization, rows), echo("query", query, "organization", organization));
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Search data.gov: " + ToolArgs.string(args, "query", "");
    }
}
