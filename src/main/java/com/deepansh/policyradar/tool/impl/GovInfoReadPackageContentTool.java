package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.provider.ContentRead;
import com.deepansh.policyradar.provider.GovInfoClient;
import com.deepansh.policyradar.tool.DocumentIndexer;
import com.deepansh.policyradar.tool.ToolArgs;
import com.deepansh.policyradar.tool.ToolContext;
import com.deepansh.policyradar.tool.ToolResult;
import com.deepansh.policyradar.tool.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.deepansh.policyradar.tool.JsonSchema.object;
import static com.deepansh.policyradar.tool.JsonSchema.properties;
import static com.deepansh.policyradar.tool.JsonSchema.string;

@Component
public class GovInfoReadPackageContentTool extends ContentReadTool {

    private final GovInfoClient client;

    public GovInfoReadPackageContentTool(GovInfoClient client, DocumentIndexer indexer) {
        super(new ToolSpec("govinfo_read_package_content",
                "Read the full text of a GovInfo package (HTML, XML or text rendition, falling back to the PDF).",
                object(properties("package_id", string("Package ID")), "package_id"),
                DataSource.GOVINFO), indexer);
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String id = ToolArgs.string(args, "package_id");
        if (id == null) return ToolResult.error("'package_id' is required");
        ContentRead read = client.readContent(id);
        if (read.failed()) return ToolResult.error(read.error());
        return contentResult(context, id, read.record(), read.text(), read.contentType(), read.pdfUrl(), read.images());
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Read package content: " + ToolArgs.string(args, "package_id", "");
    }
}
