package com.deepansh.policyradar.provider;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.model.SourceRecord;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * USAspending award search, sorted by award amount.
 */
@Component
public class UsaSpendingClient extends GovApiClient {

    static final Map<String, List<String>> AWARD_TYPE_CODES = Map.of(
            "contracts", List.of("A", "B", "C", "D"),
            "grants", List.of("02", "03", "04", "05"),
            "loans", List.of("07", "08"),
            "direct_payments", List.of("06", "10"));

    private static final List<String> FIELDS = List.of(
            "Award ID", "Recipient Name", "Award Amount", "Description",
            "Awarding Agency", "Start Date", "End Date", "generated_internal_id");

    public UsaSpendingClient(RadarProperties properties,
                             RestClient.Builder restClientBuilder,
                             @Qualifier("govApiRetry") Retry retry) {
        super("USAspending",
                restClientBuilder.clone().baseUrl(properties.getProviders().getUsaspendingBaseUrl()).build(),
                retry);
    }

    public SearchResults searchAwards(String keywords, String agency, String recipient,
                                      String awardType, int days, int limit) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("filters", buildFilters(keywords, agency, recipient, awardType, days));
        body.put("fields", FIELDS);
        body.put("limit", limit);
        body.put("page", 1);
        body.put("sort", "Award Amount");
        body.put("order", "desc");

        JsonNode root = postJson(uri -> uri.path("/search/spending_by_award/").build(), body);

        List<SourceRecord> records = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (JsonNode award : root.path("results")) {
            String recipientName = text(award, "Recipient Name");
            String description = text(award, "Description");
            BigDecimal amount = award.path("Award Amount").isNumber()
                    ? award.path("Award Amount").decimalValue() : BigDecimal.ZERO;
            total = total.add(amount);
            String internalId = text(award, "generated_internal_id");

            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("award_amount", amount);
            if (recipientName != null) raw.put("recipient", recipientName);
            if (text(award, "End Date") != null) raw.put("end_date", text(award, "End Date"));

            records.add(SourceRecord.builder()
                    .sourceType("usaspending")
                    .id(text(award, "Award ID"))
                    .title((recipientName != null ? recipientName : "Unknown recipient")
                            + (description != null ? ": " + abbreviate(description, 100) : ""))
                    .agency(text(award, "Awarding Agency"))
                    .date(text(award, "Start Date"))
                    .url(internalId != null ? "https://www.usaspending.gov/award/" + internalId : null)
                    .excerpt(abbreviate(description, 300))
                    .raw(raw)
                    .build());
        }

        Map<String, Object> extras = new LinkedHashMap<>();
        extras.put("total_award_amount", total);
        extras.put("award_type", resolveAwardType(awardType));
        extras.put("brief", brief(records, total));
        return new SearchResults(records, records.size(), extras);
    }

    static Map<String, Object> buildFilters(String keywords, String agency, String recipient,
                                            String awardType, int days) {
        Map<String, Object> filters = new LinkedHashMap<>();
        // The API rejects keywords shorter than three characters
        if (keywords != null && keywords.trim().length() >= 3) {
            filters.put("keywords", List.of(keywords.trim()));
        }
        if (agency != null && !agency.isBlank()) {
            filters.put("agencies", List.of(Map.of("type", "awarding", "tier", "toptier", "name", agency.trim())));
        }
        if (recipient != null && !recipient.isBlank()) {
            filters.put("recipient_search_text", List.of(recipient.trim()));
        }
        filters.put("award_type_codes", AWARD_TYPE_CODES.get(resolveAwardType(awardType)));
        filters.put("time_period", List.of(Map.of("start_date", since(days), "end_date", today())));
        return filters;
    }

    private static String resolveAwardType(String awardType) {
        return awardType != null && AWARD_TYPE_CODES.containsKey(awardType) ? awardType : "contracts";
    }

    private static String brief(List<SourceRecord> records, BigDecimal total) {
        if (records.isEmpty()) return "No awards matched.";
        SourceRecord top = records.get(0);
        return String.format("%d awards totaling $%,.0f; largest: %s", records.size(), total, top.getTitle());
    }
}
