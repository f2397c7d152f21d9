package com.deepansh.policyradar.observability;

import com.deepansh.policyradar.model.LlmResponse;
import com.deepansh.policyradar.model.SourceRecord;
import com.deepansh.policyradar.tool.ToolExecution;

import java.util.Map;
import java.util.TreeMap;

/**
 * Accounting for one chat turn: model usage, tool time, records found per source type,
 * failing tools and retrieval-memory indexing outcomes. Read by the turn's closing log line.
 */
public class TurnMetrics {

    private final long startedAtMs = System.currentTimeMillis();

    private int modelCalls;
    private int promptTokens;
    private int completionTokens;

    private int toolCalls;
    private long toolTimeMs;
    private final Map<String, Integer> recordsBySourceType = new TreeMap<>();
    private final Map<String, Integer> failuresByTool = new TreeMap<>();
    private final Map<String, Integer> pdfIndexOutcomes = new TreeMap<>();

    public void modelCall(LlmResponse response) {
        modelCalls++;
        promptTokens += response.getPromptTokens();
        completionTokens += response.getCompletionTokens();
    }

    public void toolCall(String toolName, long latencyMs, ToolExecution execution) {
        toolCalls++;
        toolTimeMs += latencyMs;
        if (execution.failed()) failuresByTool.merge(toolName, 1, Integer::sum);
        for (SourceRecord record : execution.sources()) {
            String type = record.getSourceType() != null ? record.getSourceType() : "unknown";
            recordsBySourceType.merge(type, 1, Integer::sum);
        }
        if (execution.preview() != null && execution.preview().get("pdf_index") instanceof Map<?, ?> index
                && index.get("status") != null) {
            pdfIndexOutcomes.merge(String.valueOf(index.get("status")), 1, Integer::sum);
        }
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startedAtMs;
    }

    public int modelCalls() {
        return modelCalls;
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    public int toolCalls() {
        return toolCalls;
    }

    public long toolTimeMs() {
        return toolTimeMs;
    }

    public Map<String, Integer> recordsBySourceType() {
        return Map.copyOf(recordsBySourceType);
    }

    public Map<String, Integer> failuresByTool() {
        return Map.copyOf(failuresByTool);
    }

    public Map<String, Integer> pdfIndexOutcomes() {
        return Map.copyOf(pdfIndexOutcomes);
    }

    /** Compact form for log lines, e.g. {@code records={federal_register=4} failed={} pdf_index={indexed=1}} */
    public String breakdown() {
        return "records=" + recordsBySourceType + " failed=" + failuresByTool + " pdf_index=" + pdfIndexOutcomes;
    }
}
