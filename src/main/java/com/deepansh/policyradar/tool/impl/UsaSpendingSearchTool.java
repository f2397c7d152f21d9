package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.model.SourceRecord;
import com.deepansh.policyradar.provider.UsaSpendingClient;
import com.deepansh.policyradar.tool.ToolArgs;
import com.deepansh.policyradar.tool.ToolContext;
import com.deepansh.policyradar.tool.ToolResult;
import com.deepansh.policyradar.tool.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.deepansh.policyradar.tool.JsonSchema.enumString;
import static com.deepansh.policyradar.tool.JsonSchema.integer;
import static com.deepansh.policyradar.tool.JsonSchema.object;
import static com.deepansh.policyradar.tool.JsonSchema.properties;
import static com.deepansh.policyradar.tool.JsonSchema.string;

@Component
public class UsaSpendingSearchTool extends SearchTool {

    private static final int DEFAULT_DAYS = 365;

    private final UsaSpendingClient client;

    public UsaSpendingSearchTool(UsaSpendingClient client) {
        super(new ToolSpec("usaspending_search",
                """
                Search federal awards on USAspending by keyword, awarding agency or recipient.
                Returns the largest awards with amounts and a total.
                """,
                object(properties(
                        "keywords", string("Keywords (at least 3 characters)"),
                        "agency", string("Awarding agency name"),
                        "recipient", string("Recipient name"),
                        "award_type", enumString("Award category. Default: contracts",
                                List.of("contracts", "grants", "loans", "direct_payments")),
                        "days", integer("Awards starting in the last N days. Default: 365", 1, 3650),
                        "limit", integer("Awards to return (1-50). Default: 10", 1, 50))),
                DataSource.USASPENDING));
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String keywords = ToolArgs.string(args, "keywords");
        String agency = ToolArgs.string(args, "agency");
        String recipient = ToolArgs.string(args, "recipient");
        if (keywords == null && agency == null && recipient == null) {
            return ToolResult.error("Provide at least one of 'keywords', 'agency' or 'recipient'");
        }
        String awardType = ToolArgs.string(args, "award_type", "contracts");
        int days = ToolArgs.clampedInt(args, "days", DEFAULT_DAYS, 1, 3650);
        int limit = ToolArgs.clampedInt(args, "limit", 10, 1, 50);
        return toResult(client.searchAwards(keywords, agency, recipient, awardType, days, limit),
                echo("keywords", keywords, "agency", agency, "recipient", recipient, "days", days));
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Search USAspending: " + ToolArgs.string(args, "keywords",
                ToolArgs.string(args, "recipient", ToolArgs.string(args, "agency", "")));
    }

    @Override
    public Map<String, Object> preview(ToolResult result) {
        List<SourceRecord> sources = result.getSources();
        Map<String, Object> preview = new LinkedHashMap<>();
        preview.put("count", sources.size());
        preview.put("top_recipients", sources.stream()
                .limit(3)
                .map(s -> ToolArgs.truncate(s.getTitle(), 60))
                .toList());
        Object total = result.getPayload().get("total_award_amount");
        if (total != null) preview.put("total_award_amount", total);
        return preview;
    }
}
