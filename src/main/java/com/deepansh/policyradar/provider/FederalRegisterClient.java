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

/** Federal Register documents API. No key required. */
@Component
public class FederalRegisterClient extends GovApiClient {

    public FederalRegisterClient(RadarProperties properties,
                                 RestClient.Builder restClientBuilder,
                                 @Qualifier("govApiRetry") Retry retry) {
        super("Federal Register",
                restClientBuilder.clone().baseUrl(properties.getProviders().getFederalRegisterBaseUrl()).build(),
                retry);
    }

    /**
     * @param documentType RULE, PRORULE, NOTICE or PRESDOCU; null for all
     * @param agency       agency slug, e.g. environmental-protection-agency
     */
    public SearchResults search(String query, String documentType, String agency, int days, int perPage) {
        JsonNode root = getJson(uri -> {
            uri.path("/documents.json")
                    .queryParam("conditions[term]", query)
                    .queryParam("conditions[publication_date][gte]", since(days))
                    .queryParam("per_page", perPage)
                    .queryParam("page", 1)
                    .queryParam("order", "newest");
            if (documentType != null) uri.queryParam("conditions[type][]", documentType);
            if (agency != null) uri.queryParam("conditions[agencies][]", agency);
            return uri.build();
        });

        List<SourceRecord> records = new ArrayList<>();
        for (JsonNode doc : root.path("results")) {
            List<String> agencies = new ArrayList<>();
            doc.path("agencies").forEach(a -> {
                String name = text(a, "name");
                if (name != null) agencies.add(name);
            });
            Map<String, Object> raw = new LinkedHashMap<>();
            if (text(doc, "type") != null) raw.put("type", text(doc, "type"));

            records.add(SourceRecord.builder()
                    .sourceType("federal_register")
                    .id(text(doc, "document_number"))
                    .title(text(doc, "title"))
                    .agency(agencies.isEmpty() ? null : String.join(", ", agencies))
                    .date(text(doc, "publication_date"))
                    .url(text(doc, "html_url"))
                    .excerpt(abbreviate(text(doc, "abstract"), 500))
                    .pdfUrl(text(doc, "pdf_url"))
                    .raw(raw.isEmpty() ? null : raw)
                    .build());
        }
        return SearchResults.of(records, root.path("count").asInt(records.size()));
    }
}
