package com.deepansh.policyradar.tool;

import com.deepansh.policyradar.model.SourceRecord;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one tool invocation produced: an ordered JSON-able payload, optional image
 * attachments and the source records discovered along the way.
 * A failed call is a result whose payload carries "error".
 */
@Getter
public class ToolResult {

    private final Map<String, Object> payload;
    private final List<ToolImage> images;
    private final List<SourceRecord> sources;

    private ToolResult(Map<String, Object> payload, List<ToolImage> images, List<SourceRecord> sources) {
        this.payload = payload;
        this.images = images;
        this.sources = sources;
    }

    public static ToolResult of(Map<String, Object> payload) {
        return new ToolResult(new LinkedHashMap<>(payload), new ArrayList<>(), new ArrayList<>());
    }

    public static ToolResult error(String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", message != null ? message : "Unknown error");
        return of(payload);
    }

    public ToolResult withSources(List<SourceRecord> records) {
        if (records != null) sources.addAll(records);
        return this;
    }

    public ToolResult withImages(List<ToolImage> extracted) {
        if (extracted != null) images.addAll(extracted);
        return this;
    }

    public ToolResult put(String key, Object value) {
        payload.put(key, value);
        return this;
    }

    public boolean isError() {
        return payload.get("error") != null;
    }

    public String errorMessage() {
        Object e = payload.get("error");
        return e != null ? e.toString() : null;
    }
}
