package com.deepansh.policyradar.tool;

import com.deepansh.policyradar.config.RadarProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounds what a tool result may put into a model's context window.
 *
 * Text fields are cut at a sentence boundary where one exists past 80% of the budget.
 * Images are admitted first-come until the per-call count, per-image size or cumulative
 * size limit is hit; the rest are counted, not sent.
 *
 * Pure apart from its limits: same input, same output.
 */
@Component
@Slf4j
public class SanitizePolicy {

    public static final String TEXT_TRUNCATION_MARKER = "\n\n[Content truncated for model context...]";
    public static final String OUTPUT_TRUNCATION_MARKER = "\n\n[Content truncated...]";

    private static final List<String> TEXT_FIELDS = List.of("full_text", "text");

    private final RadarProperties.Sanitize limits;

    public SanitizePolicy(RadarProperties properties) {
        this.limits = properties.getSanitize();
    }

    public Sanitized apply(ToolResult result) {
        Map<String, Object> payload = new LinkedHashMap<>(result.getPayload());
        payload.remove("images");

        for (String field : TEXT_FIELDS) {
            if (payload.get(field) instanceof String text) {
                String cut = truncateText(text, limits.getMaxTextChars());
                payload.put(field, cut);
                payload.put(field + "_length", text.length());
                payload.put(field + "_truncated", !cut.equals(text));
            }
        }

        List<ToolImage> admitted = new ArrayList<>();
        if (!result.getImages().isEmpty()) {
            int skipped = 0;
            long total = 0;
            for (ToolImage image : result.getImages()) {
                int size = image.byteSize();
                if (admitted.size() >= limits.getMaxImages()
                        || size > limits.getMaxImageBytes()
                        || total + size > limits.getMaxTotalImageBytes()) {
                    skipped++;
                    continue;
                }
                admitted.add(image);
                total += size;
            }
            payload.put("image_count", admitted.size());
            payload.put("image_metadata", admitted.stream().map(ToolImage::metadata).toList());
            payload.put("images_skipped_for_model", skipped);
            if (skipped > 0) {
                log.debug("Images withheld from model: {} of {}", skipped, result.getImages().size());
            }
        }

        return new Sanitized(payload, admitted);
    }

    /**
     * Cuts {@code text} to at most {@code max} characters plus the truncation marker.
     */
    public static String truncateText(String text, int max) {
        if (text == null || text.length() <= max) return text;
        String cut = text.substring(0, max);
        int lastPeriod = cut.lastIndexOf('.');
        if (lastPeriod > max * 0.8) {
            cut = cut.substring(0, lastPeriod + 1);
        }
        return cut + TEXT_TRUNCATION_MARKER;
    }

    /**
     * Serializes a sanitized payload for a model, capped at the model text budget.
     */
    public String toModelText(Map<String, Object> payload, ObjectMapper objectMapper) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Tool payload not serializable, sending error instead: {}", e.getMessage());
            json = "{\"error\":\"Tool output could not be serialized.\"}";
        }
        int max = limits.getMaxModelTextChars();
        return json.length() <= max ? json : json.substring(0, max) + OUTPUT_TRUNCATION_MARKER;
    }

    public record Sanitized(Map<String, Object> payload, List<ToolImage> images) {}
}
