package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.provider.GovInfoClient;
import com.deepansh.policyradar.tool.ToolArgs;
import com.deepansh.policyradar.tool.ToolContext;
import com.deepansh.policyradar.tool.ToolResult;
import com.deepansh.policyradar.tool.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.deepansh.policyradar.tool.JsonSchema.object;
import static com.deepansh.policyradar.tool.JsonSchema.properties;
import static com.deepansh.policyradar.tool.JsonSchema.string;

@Component
public class GovInfoPackageSummaryTool extends SearchTool {

    private final GovInfoClient client;

    public GovInfoPackageSummaryTool(GovInfoClient client) {
        super(new ToolSpec("govinfo_package_summary",
                "Get the summary of a GovInfo package: title, collection, issue date, author and download links.",
                object(properties("package_id", string("Package ID, e.g. FR-2024-03-15")), "package_id"),
                DataSource.GOVINFO));
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String id = ToolArgs.string(args, "package_id");
        if (id == null) return ToolResult.error("'package_id' is required");
        GovInfoClient.PackageSummary summary = client.packageSummary(id);
        return ToolResult.of(summary.details()).withSources(List.of(summary.record()));
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Get package: " + ToolArgs.string(args, "package_id", "");
    }
}
