package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.provider.CongressClient;
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

@Component
public class CongressSearchVotesTool extends SearchTool {

    private final CongressClient client;

    public CongressSearchVotesTool(CongressClient client) {
        super(new ToolSpec("congress_search_votes",
                "List recent roll-call votes in the House or Senate with question, result and date.",
                object(properties(
                        "chamber", enumString("Chamber. Default: house", List.of("house", "senate")),
                        "congress", integer("Congress number. Default: 118", 93, 130),
                        "limit", integer("Votes to return (1-50). Default: 10", 1, 50))),
                DataSource.CONGRESS));
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String chamber = ToolArgs.string(args, "chamber", "house").toLowerCase();
        if (!chamber.equals("house") && !chamber.equals("senate")) {
            return ToolResult.error("'chamber' must be house or senate");
        }
        Integer congress = ToolArgs.optionalInt(args, "congress");
        int limit = ToolArgs.clampedInt(args, "limit", 10, 1, 50);
        return toResult(client.searchVotes(chamber, congress, limit), echo("chamber", chamber, "congress", congress));
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Search Congress votes: " + ToolArgs.string(args, "chamber", "house");
    }
}
