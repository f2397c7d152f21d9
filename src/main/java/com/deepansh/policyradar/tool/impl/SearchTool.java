package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.provider.SearchResults;
import com.deepansh.policyradar.tool.AgentTool;
import com.deepansh.policyradar.tool.ToolResult;
import com.deepansh.policyradar.tool.ToolSpec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base for tools that run one provider search and return its records.
 */
abstract class SearchTool implements AgentTool {

    private final ToolSpec spec;

    protected SearchTool(ToolSpec spec) {
        this.spec = spec;
    }

    @Override
    public ToolSpec spec() {
        return spec;
    }

    /**
     * @param echo request fields repeated back so the model can see what was searched
     */
    protected ToolResult toResult(SearchResults results, Map<String, Object> echo) {
        Map<String, Object> payload = new LinkedHashMap<>(echo);
        payload.put("count", results.records().size());
        payload.put("total", results.total());
        payload.putAll(results.extras());
        payload.put("results", results.records());
        return ToolResult.of(payload).withSources(results.records());
    }

    protected static Map<String, Object> echo(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return m;
    }
}
