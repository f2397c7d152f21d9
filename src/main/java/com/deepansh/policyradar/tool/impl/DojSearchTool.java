package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.provider.DojClient;
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
public class DojSearchTool extends SearchTool {

    private final DojClient client;

    public DojSearchTool(DojClient client) {
        super(new ToolSpec("doj_search",
                "Search Department of Justice press releases: indictments, settlements, enforcement actions.",
                object(properties(
                        "query", string("Search text"),
                        "component", string("DOJ component, e.g. Civil Rights Division"),
                        "days", integer("Only releases from the last N days", 1, 3650),
                        "limit", integer("Releases to return (1-50). Default: 10", 1, 50)),
                        "query"),
                DataSource.DOJ));
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String query = ToolArgs.string(args, "query");
        if (query == null) return ToolResult.error("'query' is required");
        String component = ToolArgs.string(args, "component");
        int days = ToolArgs.clampedInt(args, "days", context.days(), 1, 3650);
        int limit = ToolArgs.clampedInt(args, "limit", 10, 1, 50);
        return toResult(client.searchPressReleases(query, component, days, limit),
                echo("query", query, "component", component, "days", days));
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Search DOJ: " + ToolArgs.string(args, "query", "");
    }
}
