package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.provider.GovInfoClient;
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
public class GovInfoSearchTool extends SearchTool {

    private final GovInfoClient client;

    public GovInfoSearchTool(GovInfoClient client) {
        super(new ToolSpec("govinfo_search",
                """
                Search GovInfo for official publications: Federal Register issues, Congressional bills
                and reports, CFR, public laws, court opinions. Optionally restrict to one collection.
                """,
                object(properties(
                        "query", string("Search text"),
                        "keywords", string("Alternative to query"),
                        "collection", string("Collection code, e.g. FR, BILLS, CRPT, CFR, PLAW, USCOURTS"),
                        "days", integer("Only documents published in the last N days", 1, 3650),
                        "page_size", integer("Results to return (1-25). Default: 10", 1, 25))),
                DataSource.GOVINFO));
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String query = ToolArgs.string(args, "query", ToolArgs.string(args, "keywords"));
        if (query == null) return ToolResult.error("'query' is required");
        String collection = ToolArgs.string(args, "collection");
        Integer days = ToolArgs.optionalInt(args, "days");
        int pageSize = ToolArgs.clampedInt(args, "page_size", 10, 1, 25);
        return toResult(client.search(query, collection, days, pageSize),
                echo("query", query, "collection", collection, "days", days));
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Search GovInfo: " + ToolArgs.string(args, "query", ToolArgs.string(args, "keywords", ""));
    }
}
