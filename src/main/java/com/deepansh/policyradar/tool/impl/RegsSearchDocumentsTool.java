package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.provider.RegulationsClient;
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
public class RegsSearchDocumentsTool extends SearchTool {

    private final RegulationsClient client;

    public RegsSearchDocumentsTool(RegulationsClient client) {
        super(new ToolSpec("regs_search_documents",
                """
                Search Regulations.gov for rulemaking documents (proposed rules, final rules, notices,
                supporting material) posted within the time window, newest first.
                """,
                object(properties(
                        "search_term", string("Keywords, e.g. 'PFAS drinking water'"),
                        "page_size", integer("Results to return (5-25). Default: 10", 5, 25),
                        "days", integer("Look back this many days", 1, 365)),
                        "search_term"),
                DataSource.REGULATIONS));
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String term = ToolArgs.string(args, "search_term");
        if (term == null) return ToolResult.error("'search_term' is required");
        int pageSize = ToolArgs.clampedInt(args, "page_size", 10, 5, 25);
        int days = ToolArgs.clampedInt(args, "days", context.days(), 1, 365);
        return toResult(client.searchDocuments(term, pageSize, days), echo("search_term", term, "days", days));
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Search Regulations.gov documents: " + ToolArgs.string(args, "search_term", "");
    }
}
