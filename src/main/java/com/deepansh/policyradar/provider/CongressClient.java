package com.deepansh.policyradar.provider;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.model.SourceRecord;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Congress.gov v3. The bill list endpoint has no text search, so bills are fetched
 * newest-first and filtered locally on title and number.
 */
@Component
public class CongressClient extends GovApiClient {

    public static final int DEFAULT_CONGRESS = 118;

    private static final int SCAN_SIZE = 250;

    private static final Map<String, String> BILL_TYPE_SLUGS = Map.of(
            "hr", "house-bill",
            "s", "senate-bill",
            "hjres", "house-joint-resolution",
            "sjres", "senate-joint-resolution",
            "hconres", "house-concurrent-resolution",
            "sconres", "senate-concurrent-resolution",
            "hres", "house-resolution",
            "sres", "senate-resolution");

    private final String apiKey;

    public CongressClient(RadarProperties properties,
                          RestClient.Builder restClientBuilder,
                          @Qualifier("govApiRetry") Retry retry) {
        super("Congress.gov",
                restClientBuilder.clone().baseUrl(properties.getProviders().getCongressBaseUrl()).build(),
                retry);
        this.apiKey = properties.getProviders().getGovApiKey();
    }

    public SearchResults searchBills(String query, Integer congress, int limit) {
        String path = congress != null ? "/bill/" + congress : "/bill";
        JsonNode root = getJson(uri -> uri.path(path)
                .queryParam("format", "json")
                .queryParam("limit", SCAN_SIZE)
                .queryParam("offset", 0)
                .build(), headers());

        List<String> terms = query == null ? List.of()
                : Arrays.stream(query.toLowerCase(Locale.ROOT).split("\\s+")).filter(t -> !t.isBlank()).toList();

        List<SourceRecord> records = new ArrayList<>();
        for (JsonNode bill : root.path("bills")) {
            if (records.size() >= limit) break;
            String type = text(bill, "type") == null ? "" : text(bill, "type").toLowerCase(Locale.ROOT);
            String number = text(bill, "number");
            String title = text(bill, "title");
            String haystack = ((title == null ? "" : title) + " " + type + " " + number + " " + type + number)
                    .toLowerCase(Locale.ROOT);
            if (!terms.stream().allMatch(haystack::contains)) continue;

            int billCongress = bill.path("congress").asInt(congress != null ? congress : DEFAULT_CONGRESS);
            JsonNode latest = bill.path("latestAction");
            Map<String, Object> raw = new LinkedHashMap<>();
            if (text(latest, "text") != null) raw.put("latest_action", text(latest, "text"));
            if (text(bill, "originChamber") != null) raw.put("origin_chamber", text(bill, "originChamber"));

            records.add(SourceRecord.builder()
                    .sourceType("congress_bill")
                    .id(billCongress + "-" + type + "-" + number)
                    .title(title)
                    .agency("Congress")
                    .date(text(latest, "actionDate") != null ? text(latest, "actionDate") : text(bill, "updateDate"))
                    .url(billUrl(billCongress, type, number))
                    .excerpt(abbreviate(text(latest, "text"), 300))
                    .raw(raw.isEmpty() ? null : raw)
                    .build());
        }
        return SearchResults.of(records, records.size());
    }

    public SearchResults searchVotes(String chamber, Integer congress, int limit) {
        String resolvedChamber = "senate".equalsIgnoreCase(chamber) ? "senate" : "house";
        int resolvedCongress = congress != null ? congress : DEFAULT_CONGRESS;
        JsonNode root = getJson(uri -> uri.path("/{chamber}/rollCall/{congress}")
                .queryParam("format", "json")
                .queryParam("limit", limit)
                .build(resolvedChamber, resolvedCongress), headers());

        JsonNode votes = root.path("votes");
        if (!votes.isArray()) votes = root.path("rollCalls");
        if (!votes.isArray()) votes = root.path(resolvedChamber + "RollCallVotes");

        List<SourceRecord> records = new ArrayList<>();
        for (JsonNode vote : votes) {
            if (records.size() >= limit) break;
            String rollCall = first(vote, "rollCallNumber", "rollNumber", "number");
            String question = first(vote, "voteQuestion", "question", "description");
            Map<String, Object> raw = new LinkedHashMap<>();
            String result = first(vote, "result", "voteResult");
            if (result != null) raw.put("result", result);
            raw.put("chamber", resolvedChamber);

            records.add(SourceRecord.builder()
                    .sourceType("congress_vote")
                    .id(resolvedCongress + "-" + resolvedChamber + "-" + rollCall)
                    .title(question != null ? question : "Roll call " + rollCall)
                    .agency(resolvedChamber.equals("house") ? "U.S. House" : "U.S. Senate")
                    .date(first(vote, "startDate", "date", "updateDate"))
                    .url(first(vote, "url", "sourceDataURL"))
                    .excerpt(result)
                    .raw(raw)
                    .build());
        }
        return SearchResults.of(records, records.size());
    }

    static String billUrl(int congress, String type, String number) {
        String slug = BILL_TYPE_SLUGS.getOrDefault(type, type);
        return "https://www.congress.gov/bill/" + ordinal(congress) + "-congress/" + slug + "/" + number;
    }

    static String ordinal(int n) {
        int mod100 = n % 100;
        if (mod100 >= 11 && mod100 <= 13) return n + "th";
        return switch (n % 10) {
            case 1 -> n + "st";
            case 2 -> n + "nd";
            case 3 -> n + "rd";
            default -> n + "th";
        };
    }

    private static String first(JsonNode node, String... fields) {
        for (String f : fields) {
            String v = text(node, f);
            if (v != null) return v;
        }
        return null;
    }

    private Map<String, String> headers() {
        return Map.of("X-Api-Key", apiKey == null ? "" : apiKey);
    }
}
