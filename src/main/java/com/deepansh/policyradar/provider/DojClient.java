package com.deepansh.policyradar.provider;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.model.SourceRecord;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.Retry;
import org.jsoup.Jsoup;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Justice.gov press releases. The API has no date filter; the time window is applied
 * to the newest-first result page.
 */
@Component
public class DojClient extends GovApiClient {

    public DojClient(RadarProperties properties,
                     RestClient.Builder restClientBuilder,
                     @Qualifier("govApiRetry") Retry retry) {
        super("DOJ",
                restClientBuilder.clone().baseUrl(properties.getProviders().getDojBaseUrl()).build(),
                retry);
    }

    public SearchResults searchPressReleases(String query, String component, int days, int limit) {
        JsonNode root = getJson(uri -> {
            uri.path("/press_releases.json")
                    .queryParam("pagesize", Math.min(50, limit * 2))
                    .queryParam("page", 0)
                    .queryParam("sort", "date")
                    .queryParam("direction", "DESC");
            if (query != null) uri.queryParam("keyword", query);
            if (component != null) uri.queryParam("component", component);
            return uri.build();
        });

        LocalDate cutoff = LocalDate.now(ZoneOffset.UTC).minusDays(days);
        List<SourceRecord> records = new ArrayList<>();
        for (JsonNode release : root.path("results")) {
            if (records.size() >= limit) break;
            LocalDate date = parseDate(text(release, "date"));
            if (date != null && date.isBefore(cutoff)) continue;

            List<String> components = new ArrayList<>();
            release.path("component").forEach(c -> {
                String name = text(c, "name");
                if (name != null) components.add(name);
            });
            records.add(SourceRecord.builder()
                    .sourceType("doj_press_release")
                    .id(text(release, "uuid"))
                    .title(text(release, "title"))
                    .agency(components.isEmpty() ? "U.S. Department of Justice" : String.join(", ", components))
                    .date(date != null ? date.format(ISO_DATE) : null)
                    .url(text(release, "url"))
                    .excerpt(abbreviate(text(release, "teaser") != null ? text(release, "teaser") : stripTags(text(release, "body")), 400))
                    .build());
        }
        return SearchResults.of(records, records.size());
    }

    /** Release dates arrive as epoch seconds. */
    static LocalDate parseDate(String raw) {
        if (raw == null) return null;
        try {
            return Instant.ofEpochSecond(Long.parseLong(raw.trim())).atZone(ZoneOffset.UTC).toLocalDate();
        } catch (NumberFormatException e) {
            try {
                return LocalDate.parse(raw.length() >= 10 ? raw.substring(0, 10) : raw);
            } catch (RuntimeException unparsable) {
                return null;
            }
        }
    }

    private static String stripTags(String html) {
        return html == null ? null : Jsoup.parse(html).text();
    }
}
