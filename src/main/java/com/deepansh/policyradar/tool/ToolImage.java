package com.deepansh.policyradar.tool;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Image extracted from fetched content (typically a rendered page of a scanned PDF).
 * Bytes travel to the model as an attachment, never inside the JSON payload.
 */
public record ToolImage(
        String id,
        Integer page,
        String source,
        String mimeType,
        Integer width,
        Integer height,
        byte[] data
) {

    public int byteSize() {
        return data != null ? data.length : 0;
    }

    public String base64() {
        return data != null ? Base64.getEncoder().encodeToString(data) : "";
    }

    public String dataUrl() {
        return "data:" + mimeType + ";base64," + base64();
    }

    public Map<String, Object> metadata() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        m.put("page", page);
        m.put("source", source);
        m.put("mime_type", mimeType);
        m.put("width", width);
        m.put("height", height);
        m.put("byte_size", byteSize());
        return m;
    }
}
