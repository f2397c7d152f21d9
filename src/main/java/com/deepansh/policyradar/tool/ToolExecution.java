package com.deepansh.policyradar.tool;

import com.deepansh.policyradar.model.SourceRecord;

import java.util.List;
import java.util.Map;

/**
 * Everything the orchestrator needs after one call: the model-facing output, discovered
 * sources, the finished step label and preview, and whether the call failed.
 */
public record ToolExecution(
        ToolOutput output,
        List<SourceRecord> sources,
        String label,
        Map<String, Object> preview,
        String error
) {

    public boolean failed() {
        return error != null;
    }
}
