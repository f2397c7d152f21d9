package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.provider.ContentRead;
import com.deepansh.policyradar.provider.RegulationsClient;
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
public class RegsReadDocumentContentTool extends ContentReadTool {

    private final RegulationsClient client;

    public RegsReadDocumentContentTool(RegulationsClient client, DocumentIndexer indexer) {
        super(new ToolSpec("regs_read_document_content",
                """
                Read the full text of a Regulations.gov document. Use after a search when the summary
                is not enough. Long PDFs are also indexed for search_pdf_memory.
                """,
                object(properties("document_id", string("Document ID")), "document_id"),
                DataSource.REGULATIONS), indexer);
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String id = ToolArgs.string(args, "document_id");
        if (id == null) return ToolResult.error("'document_id' is required");
        ContentRead read = client.readContent(id);
        if (read.failed()) return ToolResult.error(read.error());
        return contentResult(context, id, read.record(), read.text(), read.contentType(), read.pdfUrl(), read.images());
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Read document content: " + ToolArgs.string(args, "document_id", "");
    }
}
