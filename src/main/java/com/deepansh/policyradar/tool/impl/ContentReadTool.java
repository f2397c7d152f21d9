package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.memory.IngestResult;
import com.deepansh.policyradar.memory.RetrievalMemory;
import com.deepansh.policyradar.model.SourceRecord;
import com.deepansh.policyradar.tool.AgentTool;
import com.deepansh.policyradar.tool.DocumentIndexer;
import com.deepansh.policyradar.tool.ToolContext;
import com.deepansh.policyradar.tool.ToolImage;
import com.deepansh.policyradar.tool.ToolResult;
import com.deepansh.policyradar.tool.ToolSpec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for tools that read a full document. Besides returning the text they index
 * PDF-like content into the session's retrieval memory and report the outcome.
 */
abstract class ContentReadTool implements AgentTool {

    static final int PREVIEW_CHARS = 150;

    private final ToolSpec spec;
    private final DocumentIndexer indexer;

    protected ContentReadTool(ToolSpec spec, DocumentIndexer indexer) {
        this.spec = spec;
        this.indexer = indexer;
    }

    @Override
    public ToolSpec spec() {
        return spec;
    }

    protected ToolResult contentResult(ToolContext context, String docKey, SourceRecord record, String text,
                                       String contentType, String pdfUrl, List<ToolImage> images) {
        boolean isPdf = "pdf".equals(contentType);
        IngestResult indexed = indexer.index(context, docKey, text, isPdf, pdfUrl, images,
                new RetrievalMemory.DocumentMetadata(record != null ? record.getUrl() : null,
                        record != null ? record.getSourceType() : null, pdfUrl));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", docKey);
        if (record != null && record.getTitle() != null) payload.put("title", record.getTitle());
        if (record != null && record.getUrl() != null) payload.put("url", record.getUrl());
        if (pdfUrl != null) payload.put("pdf_url", pdfUrl);
        payload.put("content_type", contentType);
        payload.put("full_text", text == null ? "" : text);
        payload.put("pdf_index", indexed.toMap());

        ToolResult result = ToolResult.of(payload).withImages(images);
        if (record != null) {
            record.setContentType(contentType);
            if (pdfUrl != null && record.getPdfUrl() == null) record.setPdfUrl(pdfUrl);
            result.withSources(List.of(record));
        }
        return result;
    }

    @Override
    public Map<String, Object> preview(ToolResult result) {
        Map<String, Object> payload = result.getPayload();
        Object raw = payload.get("full_text") != null ? payload.get("full_text") : payload.get("text");
        String text = raw == null ? "" : raw.toString();

        Map<String, Object> preview = new LinkedHashMap<>();
        preview.put("id", payload.get("id"));
        preview.put("text_length", text.length());
        preview.put("image_count", result.getImages().size());
        preview.put("preview", text.length() > PREVIEW_CHARS ? text.substring(0, PREVIEW_CHARS) + "..." : text);
        preview.put("pdf_index", payload.get("pdf_index"));
        return preview;
    }
}
