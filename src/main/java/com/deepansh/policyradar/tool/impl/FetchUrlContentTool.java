package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.fetch.ContentFetcher;
import com.deepansh.policyradar.fetch.FetchedContent;
import com.deepansh.policyradar.model.SourceRecord;
import com.deepansh.policyradar.tool.DocumentIndexer;
import com.deepansh.policyradar.tool.ToolArgs;
import com.deepansh.policyradar.tool.ToolContext;
import com.deepansh.policyradar.tool.ToolResult;
import com.deepansh.policyradar.tool.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.deepansh.policyradar.tool.JsonSchema.integer;
import static com.deepansh.policyradar.tool.JsonSchema.object;
import static com.deepansh.policyradar.tool.JsonSchema.properties;
import static com.deepansh.policyradar.tool.JsonSchema.string;

/**
 * Reads any allowed URL, typically a PDF or page linked from a search result.
 * Always visible regardless of the selected sources.
 */
@Component
public class FetchUrlContentTool extends ContentReadTool {

    private final ContentFetcher fetcher;
    private final int defaultMaxLength;

    public FetchUrlContentTool(ContentFetcher fetcher, DocumentIndexer indexer, RadarProperties properties) {
        super(new ToolSpec("fetch_url_content",
                """
                Fetch a government web page or PDF and return its text. Use for pdf_url or url values
                returned by other tools. Only .gov and .mil hosts are allowed by default.
                """,
                object(properties(
                        "url", string("Absolute URL to fetch"),
                        "max_length", integer("Maximum characters of text to return. Default: 15000", 500, 100000)),
                        "url"),
                null), indexer);
        this.fetcher = fetcher;
        this.defaultMaxLength = properties.getFetch().getDefaultMaxLength();
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String url = ToolArgs.string(args, "url");
        if (url == null) return ToolResult.error("'url' is required");
        int maxLength = ToolArgs.clampedInt(args, "max_length", defaultMaxLength, 500, 100_000);

        FetchedContent fetched = fetcher.fetch(url);
        if (fetched.failed()) return ToolResult.error(fetched.error());

        String text = fetched.text() == null ? "" : fetched.text();
        SourceRecord record = SourceRecord.builder()
                .sourceType("web_page")
                .id(fetched.url())
                .title(fetched.title())
                .url(fetched.url())
                .pdfUrl(fetched.isPdf() ? fetched.url() : null)
                .build();

        // Memory gets the whole document; the model gets max_length characters
        ToolResult result = contentResult(context, fetched.url(), record, text, fetched.contentType(),
                record.getPdfUrl(), fetched.images());
        if (text.length() > maxLength) {
            result.put("full_text", text.substring(0, maxLength));
            result.put("truncated_at", maxLength);
        }
        return result;
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Fetch URL: " + ToolArgs.truncate(ToolArgs.string(args, "url", ""), 50);
    }
}
