package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.provider.CongressClient;
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
public class CongressSearchBillsTool extends SearchTool {

    private final CongressClient client;

    public CongressSearchBillsTool(CongressClient client) {
        super(new ToolSpec("congress_search_bills",
                "Search recent bills in a Congress by title keywords. Returns bill number, title, latest action and link.",
                object(properties(
                        "query", string("Keywords matched against bill titles"),
                        "congress", integer("Congress number. Default: 118", 93, 130),
                        "limit", integer("Bills to return (1-50). Default: 10", 1, 50)),
                        "query"),
                DataSource.CONGRESS));
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String query = ToolArgs.string(args, "query");
        if (query == null) return ToolResult.error("'query' is required");
        Integer congress = ToolArgs.optionalInt(args, "congress");
        int limit = ToolArgs.clampedInt(args, "limit", 10, 1, 50);
        return toResult(client.searchBills(query, congress, limit), echo("query", query, "congress", congress));
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Search Congress bills: " + ToolArgs.string(args, "query", "");
    }
}
