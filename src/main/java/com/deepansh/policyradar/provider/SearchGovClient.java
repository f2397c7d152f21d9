package com.deepansh.policyradar.provider;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.exception.RadarException;
import com.deepansh.policyradar.model.SourceRecord;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/** Search.gov i14y results for a configured affiliate site. */
@Component
public class SearchGovClient extends GovApiClient {

    static final String NOT_CONFIGURED =
            "Search.gov is not configured. Set SEARCHGOV_AFFILIATE and SEARCHGOV_ACCESS_KEY environment variables.";

    private final RadarProperties.Providers providers;

    public SearchGovClient(RadarProperties properties,
                           RestClient.Builder restClientBuilder,
                           @Qualifier("govApiRetry") Retry retry) {
        super("Search.gov",
                restClientBuilder.clone().baseUrl(properties.getProviders().getSearchgovBaseUrl()).build(),
                retry);
        this.providers = properties.getProviders();
    }

    public SearchResults search(String query, int limit) {
        if (!providers.hasSearchGovCredentials()) {
            throw new RadarException(NOT_CONFIGURED);
        }
        JsonNode root = getJson(uri -> uri.path("/results/i14y")
                .queryParam("affiliate", providers.getSearchgovAffiliate())
                .queryParam("access_key", providers.getSearchgovAccessKey())
                .queryParam("query", query)
                .queryParam("limit", limit)
                .build());

        List<SourceRecord> records = new ArrayList<>();
        for (JsonNode hit : root.path("web").path("results")) {
            String url = text(hit, "url");
            String link = url != null ? url : text(hit, "link");
            records.add(SourceRecord.builder()
                    .sourceType("searchgov")
                    .id(link)
                    .title(text(hit, "title"))
                    .agency(hostOf(link))
                    .date(text(hit, "publication_date"))
                    .url(link)
                    .excerpt(abbreviate(text(hit, "snippet"), 400))
                    .build());
        }
        return SearchResults.of(records, root.path("web").path("total").asInt(records.size()));
    }

    private static String hostOf(String url) {
        try {
            return url != null ? URI.create(url).getHost() : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
