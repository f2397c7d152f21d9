package com.deepansh.policyradar.fetch;

import com.deepansh.policyradar.tool.ToolImage;

import java.util.List;

/**
 * Result of one fetch. Either {@code error} is set, or {@code text} holds the full
 * extracted text (possibly empty for image-only PDFs).
 */
public record FetchedContent(
        String url,
        String title,
        String text,
        String contentType,
        List<ToolImage> images,
        String error
) {

    public static final String TYPE_PDF = "pdf";
    public static final String TYPE_HTML = "html";
    public static final String TYPE_TEXT = "text";

    public static FetchedContent failure(String url, String error) {
        return new FetchedContent(url, null, null, null, List.of(), error);
    }

    public boolean failed() {
        return error != null;
    }

    public boolean isPdf() {
        return TYPE_PDF.equals(contentType);
    }
}
