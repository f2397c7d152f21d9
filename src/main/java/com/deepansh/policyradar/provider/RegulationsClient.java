package com.deepansh.policyradar.provider;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.fetch.ContentFetcher;
import com.deepansh.policyradar.fetch.FetchedContent;
import com.deepansh.policyradar.model.SourceRecord;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Regulations.gov v4: documents, dockets and document content.
 */
@Component
@Slf4j
public class RegulationsClient extends GovApiClient {

    private static final String SITE = "https://www.regulations.gov";
    private static final List<String> FORMAT_PREFERENCE = List.of("htm", "html", "txt", "pdf");

    private final String apiKey;
    private final ContentFetcher contentFetcher;

    public RegulationsClient(RadarProperties properties,
                             RestClient.Builder restClientBuilder,
                             @Qualifier("govApiRetry") Retry retry,
                             ContentFetcher contentFetcher) {
        super("Regulations.gov",
                restClientBuilder.clone().baseUrl(properties.getProviders().getRegulationsBaseUrl()).build(),
                retry);
        this.apiKey = properties.getProviders().getGovApiKey();
        this.contentFetcher = contentFetcher;
    }

    public SearchResults searchDocuments(String searchTerm, int pageSize, int days) {
        JsonNode root = getJson(uri -> uri.path("/documents")
                .queryParam("filter[searchTerm]", searchTerm)
                .queryParam("filter[postedDate][ge]", since(days))
                .queryParam("filter[postedDate][le]", today())
                .queryParam("sort", "-postedDate")
                .queryParam("page[size]", pageSize)
                .build(), headers());

        List<SourceRecord> records = new ArrayList<>();
        for (JsonNode item : root.path("data")) {
            records.add(documentRecord(item.path("id").asText(), item.path("attributes")));
        }
        return SearchResults.of(records, root.path("meta").path("totalElements").asInt(records.size()));
    }

    public SearchResults searchDockets(String searchTerm, int pageSize) {
        JsonNode root = getJson(uri -> uri.path("/dockets")
                .queryParam("filter[searchTerm]", searchTerm)
                .queryParam("sort", "-lastModifiedDate")
                .queryParam("page[size]", pageSize)
                .build(), headers());

        List<SourceRecord> records = new ArrayList<>();
        for (JsonNode item : root.path("data")) {
            String id = item.path("id").asText();
            JsonNode attrs = item.path("attributes");
            Map<String, Object> raw = new LinkedHashMap<>();
            putIfPresent(raw, "docket_type", text(attrs, "docketType"));
            records.add(SourceRecord.builder()
                    .sourceType("regulations_docket")
                    .id(id)
                    .title(text(attrs, "title"))
                    .agency(text(attrs, "agencyId"))
                    .date(text(attrs, "lastModifiedDate"))
                    .url(SITE + "/docket/" + id)
                    .raw(raw.isEmpty() ? null : raw)
                    .build());
        }
        return SearchResults.of(records, root.path("meta").path("totalElements").asInt(records.size()));
    }

    public DocumentDetail getDocument(String documentId) {
        JsonNode root = getJson(uri -> uri.path("/documents/{id}")
                .queryParam("include", "attachments")
                .build(documentId), headers());

        JsonNode data = root.path("data");
        JsonNode attrs = data.path("attributes");
        SourceRecord record = documentRecord(documentId, attrs);

        Map<String, String> formats = new LinkedHashMap<>();
        for (JsonNode f : attrs.path("fileFormats")) {
            String format = text(f, "format");
            String url = text(f, "fileUrl");
            if (format != null && url != null) formats.putIfAbsent(format.toLowerCase(), url);
        }
        for (JsonNode attachment : root.path("included")) {
            for (JsonNode f : attachment.path("attributes").path("fileFormats")) {
                String format = text(f, "format");
                String url = text(f, "fileUrl");
                if (format != null && url != null) formats.putIfAbsent(format.toLowerCase(), url);
            }
        }
        if (formats.containsKey("pdf")) record.setPdfUrl(formats.get("pdf"));

        return new DocumentDetail(record, text(attrs, "documentType"), text(attrs, "docketId"),
                text(attrs, "summary"), text(attrs, "abstract"),
                text(attrs, "commentStartDate"), text(attrs, "commentEndDate"), formats);
    }

    /**
     * Header built from the API attributes, then the body of the best available
     * file format. Falls back to the public document page when there is no file.
     */
    public ContentRead readContent(String documentId) {
        DocumentDetail detail = getDocument(documentId);
        SourceRecord record = detail.record();

        String fileUrl = FORMAT_PREFERENCE.stream()
                .map(detail.fileFormats()::get)
                .filter(u -> u != null)
                .findFirst()
                .orElse(record.getUrl());

        FetchedContent fetched = contentFetcher.fetch(fileUrl);
        String header = detail.header();
        if (fetched.failed()) {
            if (header.isBlank()) return ContentRead.failure(record, "No content available.");
            log.info("Regulations.gov file fetch failed [{}], returning attributes only: {}", documentId, fetched.error());
            return new ContentRead(record, header, "text", record.getPdfUrl(), List.of(), null);
        }

        String body = fetched.text() == null ? "" : fetched.text();
        if (body.isBlank() && header.isBlank() && fetched.images().isEmpty()) {
            return ContentRead.failure(record, "No content available.");
        }
        String text = header.isBlank() ? body : header + "\n\n---\n\n" + body;
        String pdfUrl = fetched.isPdf() ? fileUrl : record.getPdfUrl();
        return new ContentRead(record, text, fetched.contentType(), pdfUrl, fetched.images(), null);
    }

    private SourceRecord documentRecord(String id, JsonNode attrs) {
        Map<String, Object> raw = new LinkedHashMap<>();
        putIfPresent(raw, "document_type", text(attrs, "documentType"));
        putIfPresent(raw, "docket_id", text(attrs, "docketId"));
        putIfPresent(raw, "comment_end_date", text(attrs, "commentEndDate"));
        String excerpt = text(attrs, "summary") != null ? text(attrs, "summary") : text(attrs, "abstract");
        return SourceRecord.builder()
                .sourceType("regulations_document")
                .id(id)
                .title(text(attrs, "title"))
                .agency(text(attrs, "agencyId"))
                .date(text(attrs, "postedDate"))
                .url(SITE + "/document/" + id)
                .excerpt(abbreviate(excerpt, 500))
                .raw(raw.isEmpty() ? null : raw)
                .build();
    }

    private Map<String, String> headers() {
        return Map.of("X-Api-Key", apiKey == null ? "" : apiKey);
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) map.put(key, value);
    }

    public record DocumentDetail(
            SourceRecord record,
            String documentType,
            String docketId,
            String summary,
            String abstractText,
            String commentStartDate,
            String commentEndDate,
            Map<String, String> fileFormats
    ) {

        String header() {
            StringBuilder sb = new StringBuilder();
            appendLine(sb, "Title", record.getTitle());
            appendLine(sb, "Agency", record.getAgency());
            appendLine(sb, "Document Type", documentType);
            appendLine(sb, "Posted", record.getDate());
            appendLine(sb, "Summary", summary);
            appendLine(sb, "Abstract", abstractText);
            return sb.toString().trim();
        }

        public Map<String, Object> toMap() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id", record.getId());
            m.put("title", record.getTitle());
            m.put("agency", record.getAgency());
            m.put("document_type", documentType);
            m.put("docket_id", docketId);
            m.put("posted_date", record.getDate());
            m.put("comment_start_date", commentStartDate);
            m.put("comment_end_date", commentEndDate);
            m.put("summary", summary);
            m.put("abstract", abstractText);
            m.put("url", record.getUrl());
            m.put("file_formats", fileFormats);
            return m;
        }

        private static void appendLine(StringBuilder sb, String label, String value) {
            if (value != null && !value.isBlank()) sb.append(label).append(": ").append(value).append('\n');
        }
    }
}
