package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.provider.FederalRegisterClient;
import com.deepansh.policyradar.tool.ToolArgs;
import com.deepansh.policyradar.tool.ToolContext;
import com.deepansh.policyradar.tool.ToolResult;
import com.deepansh.policyradar.tool.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.deepansh.policyradar.tool.JsonSchema.enumString;
import static com.deepansh.policyradar.tool.JsonSchema.integer;
import static com.deepansh.policyradar.tool.JsonSchema.object;
import static com.deepansh.policyradar.tool.JsonSchema.properties;
import static com.deepansh.policyradar.tool.JsonSchema.string;

@Component
public class FederalRegisterSearchTool extends SearchTool {

    static final List<String> DOCUMENT_TYPES = List.of("RULE", "PRORULE", "NOTICE", "PRESDOCU");

    private final FederalRegisterClient client;

    public FederalRegisterSearchTool(FederalRegisterClient client) {
        super(new ToolSpec("federal_register_search",
                """
                Search the Federal Register for rules, proposed rules, notices and presidential documents.
                Results include abstract, agencies, publication date and PDF link.
                """,
                object(properties(
                        "query", string("Search text"),
                        "document_type", enumString("Restrict to one document type", DOCUMENT_TYPES),
                        "agency", string("Agency slug, e.g. environmental-protection-agency"),
                        "days", integer("Only documents published in the last N days", 1, 3650),
                        "per_page", integer("Results to return (1-50). Default: 10", 1, 50)),
                        "query"),
                DataSource.FEDERAL_REGISTER));
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String query = ToolArgs.string(args, "query");
        if (query == null) return ToolResult.error("'query' is required");
        String type = ToolArgs.string(args, "document_type");
        if (type != null) {
            type = type.toUpperCase();
            if (!DOCUMENT_TYPES.contains(type)) return ToolResult.error("Unsupported document_type: " + type);
        }
        String agency = ToolArgs.string(args, "agency");
        int days = ToolArgs.clampedInt(args, "days", context.days(), 1, 3650);
        int perPage = ToolArgs.clampedInt(args, "per_page", 10, 1, 50);
        return toResult(client.search(query, type, agency, days, perPage),
                echo("query", query, "document_type", type, "agency", agency, "days", days));
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Search Federal Register: " + ToolArgs.string(args, "query", "");
    }
}
