package com.deepansh.policyradar.memory;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Fixed-size overlapping character windows over normalized text.
 *
 * Chunk size is at least 200, overlap at most half the chunk size. Each window starts
 * {@code size - overlap} after the previous one, and the chunk count is capped.
 */
@Slf4j
public final class TextChunker {

    static final int MIN_CHUNK_SIZE = 200;

    private static final Pattern HORIZONTAL_WS = Pattern.compile("[ \\t]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    private TextChunker() {}

    public static String normalize(String text) {
        if (text == null) return "";
        String out = text.replace("\r\n", "\n");
        out = HORIZONTAL_WS.matcher(out).replaceAll(" ");
        out = BLANK_LINES.matcher(out).replaceAll("\n\n");
        return out.trim();
    }

    public static List<Chunk> chunk(String text, int chunkSize, int overlap, int maxChunks) {
        List<Chunk> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) return chunks;

        int size = Math.max(MIN_CHUNK_SIZE, chunkSize);
        int step = Math.max(0, Math.min(overlap, size / 2));

        int start = 0;
        int length = text.length();
        while (start < length) {
            int end = Math.min(length, start + size);
            chunks.add(new Chunk(chunks.size(), start, text.substring(start, end)));
            if (end == length) break;
            if (chunks.size() >= maxChunks) {
                log.warn("Chunk cap reached [max={}], dropping remaining {} chars", maxChunks, length - end);
                break;
            }
            start = end - step;
        }
        return chunks;
    }

    public record Chunk(int index, int offset, String text) {}
}
