package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.memory.MemoryMatch;
import com.deepansh.policyradar.memory.RetrievalMemory;
import com.deepansh.policyradar.tool.AgentTool;
import com.deepansh.policyradar.tool.ToolArgs;
import com.deepansh.policyradar.tool.ToolContext;
import com.deepansh.policyradar.tool.ToolResult;
import com.deepansh.policyradar.tool.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.deepansh.policyradar.tool.JsonSchema.integer;
import static com.deepansh.policyradar.tool.JsonSchema.object;
import static com.deepansh.policyradar.tool.JsonSchema.properties;
import static com.deepansh.policyradar.tool.JsonSchema.string;

/**
 * Semantic search over documents read earlier in the same session.
 */
@Component
public class SearchPdfMemoryTool implements AgentTool {

    private static final int MAX_DOCUMENTS = 5;

    private final RetrievalMemory memory;
    private final ToolSpec spec;

    public SearchPdfMemoryTool(RetrievalMemory memory) {
        this.memory = memory;
        this.spec = new ToolSpec("search_pdf_memory",
                """
                Search passages of documents already read in this session. Use it to revisit specific
                details (dates, amounts, definitions) without reading the whole document again.
                """,
                object(properties(
                        "query", string("What to look for"),
                        "top_k", integer("Passages to return (1-10). Default: 5", 1, 10)),
                        "query"),
                null);
    }

    @Override
    public ToolSpec spec() {
        return spec;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String query = ToolArgs.string(args, "query");
        if (query == null) return ToolResult.error("'query' is required");
        if (!context.hasSession()) return ToolResult.error("PDF memory not available without a session.");
        int topK = ToolArgs.clampedInt(args, "top_k", memory.defaultTopK(), 1, 10);

        List<MemoryMatch> matches = memory.query(context.sessionId(), query, topK, context.embeddingConfig());

        Map<String, Map<String, Object>> documents = new LinkedHashMap<>();
        for (MemoryMatch match : matches) {
            if (documents.size() >= MAX_DOCUMENTS) break;
            documents.computeIfAbsent(match.docKey(), key -> {
                Map<String, Object> doc = new LinkedHashMap<>();
                doc.put("doc_key", key);
                if (match.pdfUrl() != null) doc.put("pdf_url", match.pdfUrl());
                if (match.sourceType() != null) doc.put("source_type", match.sourceType());
                return doc;
            });
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("count", matches.size());
        payload.put("documents", new ArrayList<>(documents.values()));
        payload.put("matches", matches.stream().map(MemoryMatch::toMap).toList());
        return ToolResult.of(payload);
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Search PDF memory: " + ToolArgs.truncate(ToolArgs.string(args, "query", ""), 50);
    }

    @Override
    @SuppressWarnings("unchecked")
    public String completedLabel(Map<String, Object> args, ToolResult result) {
        Object documents = result.getPayload().get("documents");
        if (!(documents instanceof List<?> docs) || docs.isEmpty()) return label(args);
        String top = String.valueOf(((Map<String, Object>) docs.get(0)).get("doc_key"));
        String suffix = docs.size() > 1 ? " +" + (docs.size() - 1) : "";
        return label(args) + " (top: " + ToolArgs.truncate(top, 40) + suffix + ")";
    }

    @Override
    public Map<String, Object> preview(ToolResult result) {
        Map<String, Object> preview = new LinkedHashMap<>();
        preview.put("count", result.getPayload().getOrDefault("count", 0));
        preview.put("documents", result.getPayload().getOrDefault("documents", List.of()));
        return preview;
    }
}
