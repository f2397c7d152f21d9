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
public class RegsSearchDocketsTool extends SearchTool {

    private final RegulationsClient client;

    public RegsSearchDocketsTool(RegulationsClient client) {
        super(new ToolSpec("regs_search_dockets",
                "Search Regulations.gov dockets (the folders grouping a rulemaking's documents), most recently modified first.",
                object(properties(
                        "search_term", string("Keywords"),
                        "page_size", integer("Results to return (5-25). Default: 10", 5, 25)),
                        "search_term"),
                DataSource.REGULATIONS));
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String term = ToolArgs.string(args, "search_term");
        if (term == null) return ToolResult.error("'search_term' is required");
        return toResult(client.searchDockets(term, ToolArgs.clampedInt(args, "page_size", 10, 5, 25)),
                echo("search_term", term));
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Search Regulations.gov dockets: " + ToolArgs.string(args, "search_term", "");
    }
}
