package com.deepansh.policyradar.provider;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.model.SourceRecord;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Data.gov CKAN catalog search. */
@Component
public class DataGovClient extends GovApiClient {

    private final String apiKey;

    public DataGovClient(RadarProperties properties,
                         RestClient.Builder restClientBuilder,
                         @Qualifier("govApiRetry") Retry retry) {
        super("Data.gov",
                restClientBuilder.clone().baseUrl(properties.getProviders().getDatagovBaseUrl()).build(),
                retry);
        this.apiKey = properties.getProviders().getGovApiKey();
    }

    public SearchResults search(String query, String organization, int rows) {
        JsonNode root = getJson(uri -> {
            uri.path("/package_search")
                    .queryParam("q", query)
                    .queryParam("rows", rows)
                    .queryParam("start", 0);
            if (organization != null) uri.queryParam("fq", "organization:\"" + organization + "\"");
            return uri.build();
        }, apiKey == null || apiKey.isBlank() ? Map.of() : Map.of("x-api-key", apiKey));

        JsonNode result = root.path("result");
        List<SourceRecord> records = new ArrayList<>();
        for (JsonNode dataset : result.path("results")) {
            String id = text(dataset, "id");
            String name = text(dataset, "name");
            String pdfUrl = null;
            int resourceCount = 0;
            for (JsonNode resource : dataset.path("resources")) {
                resourceCount++;
                if (pdfUrl == null && "pdf".equalsIgnoreCase(text(resource, "format"))) {
                    pdfUrl = text(resource, "url");
                }
            }
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("resource_count", resourceCount);
            if (name != null) raw.put("name", name);

            records.add(SourceRecord.builder()
                    .sourceType("datagov")
                    .id(id)
                    .title(text(dataset, "title"))
                    .agency(text(dataset.path("organization"), "title"))
                    .date(text(dataset, "metadata_modified"))
                    .url("https://catalog.data.gov/dataset/" + (name != null ? name : id))
                    .excerpt(abbreviate(text(dataset, "notes"), 500))
                    .pdfUrl(pdfUrl)
                    .raw(raw)
                    .build());
        }
        return SearchResults.of(records, result.path("count").asInt(records.size()));
    }
}
