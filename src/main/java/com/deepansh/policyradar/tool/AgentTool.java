package com.deepansh.policyradar.tool;

import com.deepansh.policyradar.model.SourceRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contract every research tool implements.
 *
 * {@link #execute} may throw on provider failure; {@link ToolExecutor} turns any
 * exception into an {"error": ...} payload so the loop always continues.
 */
public interface AgentTool {

    ToolSpec spec();

    ToolResult execute(Map<String, Object> arguments, ToolContext context);

    /** Label shown on the running step. */
    default String label(Map<String, Object> arguments) {
        return "Execute: " + spec().name();
    }

    /** Label shown on the finished step; most tools keep the running label. */
    default String completedLabel(Map<String, Object> arguments, ToolResult result) {
        return label(arguments);
    }

    /**
     * Small summary for the UI. Searches report a count and the first three titles.
     */
    default Map<String, Object> preview(ToolResult result) {
        List<SourceRecord> sources = result.getSources();
        Map<String, Object> preview = new LinkedHashMap<>();
        preview.put("count", sources.size());
        preview.put("top_titles", sources.stream()
                .limit(3)
                .map(s -> ToolArgs.truncate(s.getTitle(), 80))
                .toList());
        return preview;
    }
}
