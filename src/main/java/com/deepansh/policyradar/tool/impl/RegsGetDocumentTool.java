package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.provider.RegulationsClient;
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
public class RegsGetDocumentTool extends SearchTool {

    private final RegulationsClient client;

    public RegsGetDocumentTool(RegulationsClient client) {
        super(new ToolSpec("regs_get_document",
                "Get metadata for one Regulations.gov document: agency, type, dates, summary and available file formats.",
                object(properties("document_id", string("Document ID, e.g. EPA-HQ-OW-2022-0114-0001")), "document_id"),
                DataSource.REGULATIONS));
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String id = ToolArgs.string(args, "document_id");
        if (id == null) return ToolResult.error("'document_id' is required");
        RegulationsClient.DocumentDetail detail = client.getDocument(id);
        return ToolResult.of(detail.toMap()).withSources(List.of(detail.record()));
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Get document: " + ToolArgs.string(args, "document_id", "");
    }
}
