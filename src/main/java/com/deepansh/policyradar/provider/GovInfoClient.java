package com.deepansh.policyradar.provider;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.exception.ApiException;
import com.deepansh.policyradar.exception.UpstreamErrors;
import com.deepansh.policyradar.fetch.FetchedContent;
import com.deepansh.policyradar.fetch.JsoupContentFetcher;
import com.deepansh.policyradar.fetch.PdfExtractor;
import com.deepansh.policyradar.model.SourceRecord;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.parser.Parser;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GovInfo: full-text search over published government documents, package summaries
 * and package content (htm, then xml, then txt, then pdf).
 */
@Component
@Slf4j
public class GovInfoClient extends GovApiClient {

    private static final String SITE = "https://www.govinfo.gov/app/details/";
    private static final List<String> TEXT_FORMATS = List.of("htm", "xml", "txt");

    private final String apiKey;
    private final PdfExtractor pdfExtractor;

    public GovInfoClient(RadarProperties properties,
                         RestClient.Builder restClientBuilder,
                         @Qualifier("govApiRetry") Retry retry) {
        super("GovInfo",
                restClientBuilder.clone().baseUrl(properties.getProviders().getGovinfoBaseUrl()).build(),
                retry);
        this.apiKey = properties.getProviders().getGovApiKey();
        this.pdfExtractor = new PdfExtractor(properties.getFetch().isExtractPdfImages());
    }

    public SearchResults search(String query, String collection, Integer days, int pageSize) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", buildQuery(query, collection, days));
        body.put("pageSize", String.valueOf(pageSize));
        body.put("offsetMark", "*");
        body.put("sorts", List.of(Map.of("field", "lastModified", "sortOrder", "DESC")));

        JsonNode root = postJson(uri -> uri.path("/search").queryParam("api_key", apiKey).build(), body);

        List<SourceRecord> records = new ArrayList<>();
        for (JsonNode item : root.path("results")) {
            String packageId = text(item, "packageId");
            Map<String, Object> raw = new LinkedHashMap<>();
            if (text(item, "collectionCode") != null) raw.put("collection", text(item, "collectionCode"));
            if (text(item, "granuleId") != null) raw.put("granule_id", text(item, "granuleId"));
            records.add(SourceRecord.builder()
                    .sourceType("govinfo_result")
                    .id(packageId)
                    .title(text(item, "title"))
                    .agency(joinAuthors(item.path("governmentAuthor")))
                    .date(text(item, "dateIssued") != null ? text(item, "dateIssued") : text(item, "lastModified"))
                    .url(packageId != null ? SITE + packageId : null)
                    .pdfUrl(text(item.path("download"), "pdfLink"))
                    .raw(raw.isEmpty() ? null : raw)
                    .build());
        }
        return SearchResults.of(records, root.path("count").asInt(records.size()));
    }

    /**
     * GovInfo query syntax: free text plus optional field operators.
     */
    static String buildQuery(String query, String collection, Integer days) {
        List<String> parts = new ArrayList<>();
        if (query != null && !query.isBlank()) parts.add(query.trim());
        if (collection != null && !collection.isBlank()) parts.add("collection:" + collection.trim().toUpperCase());
        if (days != null && days > 0) parts.add("publishdate:range(" + since(days) + ",)");
        return String.join(" ", parts);
    }

    public PackageSummary packageSummary(String packageId) {
        JsonNode root = getJson(uri -> uri.path("/packages/{id}/summary").queryParam("api_key", apiKey).build(packageId));

        JsonNode download = root.path("download");
        SourceRecord record = SourceRecord.builder()
                .sourceType("govinfo_package")
                .id(packageId)
                .title(text(root, "title"))
                .agency(text(root, "governmentAuthor1") != null ? text(root, "governmentAuthor1") : text(root, "publisher"))
                .date(text(root, "dateIssued"))
                .url(SITE + packageId)
                .pdfUrl(text(download, "pdfLink"))
                .excerpt(abbreviate(text(root, "description"), 500))
                .build();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("package_id", packageId);
        details.put("title", record.getTitle());
        details.put("collection", text(root, "collectionCode"));
        details.put("category", text(root, "category"));
        details.put("date_issued", record.getDate());
        details.put("last_modified", text(root, "lastModified"));
        details.put("pages", text(root, "pages"));
        details.put("government_author", record.getAgency());
        details.put("download", download.isObject() ? download : null);
        details.put("url", record.getUrl());
        return new PackageSummary(record, details);
    }

    public ContentRead readContent(String packageId) {
        SourceRecord record = SourceRecord.builder()
                .sourceType("govinfo_package")
                .id(packageId)
                .url(SITE + packageId)
                .build();

        for (String format : TEXT_FORMATS) {
            try {
                String body = fetchFormat(packageId, format);
                if (body == null || body.isBlank()) continue;
                String text = switch (format) {
                    case "htm" -> JsoupContentFetcher.extractHtml(record.getUrl(), body).text();
                    case "xml" -> Jsoup.parse(body, "", Parser.xmlParser()).text();
                    default -> body.trim();
                };
                if (!text.isBlank()) {
                    return new ContentRead(record, text, format.equals("htm") ? FetchedContent.TYPE_HTML
                            : FetchedContent.TYPE_TEXT, null, List.of(), null);
                }
            } catch (ApiException e) {
                log.debug("GovInfo {} rendition unavailable for {}: {}", format, packageId, e.getMessage());
            }
        }

        try {
            byte[] pdf = withRetry(() -> restClient.get()
                    .uri(uri -> uri.path("/packages/{id}/pdf").queryParam("api_key", apiKey).build(packageId))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw UpstreamErrors.from(label(), res);
                    })
                    .body(byte[].class));
            if (pdf != null && pdf.length > 0) {
                FetchedContent extracted = pdfExtractor.extract(record.getUrl(), pdf);
                if (!extracted.failed()) {
                    String pdfUrl = "https://www.govinfo.gov/content/pkg/" + packageId + "/pdf/" + packageId + ".pdf";
                    record.setPdfUrl(pdfUrl);
                    return new ContentRead(record, extracted.text(), FetchedContent.TYPE_PDF, pdfUrl,
                            extracted.images(), null);
                }
            }
        } catch (ApiException e) {
            log.debug("GovInfo pdf rendition unavailable for {}: {}", packageId, e.getMessage());
        }
        return ContentRead.failure(record, "No content available.");
    }

    private String fetchFormat(String packageId, String format) {
        return withRetry(() -> restClient.get()
                .uri(uri -> uri.path("/packages/{id}/{format}").queryParam("api_key", apiKey).build(packageId, format))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw UpstreamErrors.from(label(), res);
                })
                .body(String.class));
    }

    private static String joinAuthors(JsonNode authors) {
        if (authors.isArray()) {
            List<String> names = new ArrayList<>();
            authors.forEach(a -> names.add(a.asText()));
            return names.isEmpty() ? null : String.join(", ", names);
        }
        return authors.isTextual() ? authors.asText() : null;
    }

    public record PackageSummary(SourceRecord record, Map<String, Object> details) {}
}
