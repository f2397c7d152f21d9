package com.deepansh.policyradar.provider;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.model.SourceRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Treasury Fiscal Data. Each supported dataset maps to one endpoint; rows come back
 * newest first.
 */
@Component
public class FiscalDataClient extends GovApiClient {

    public static final String DEFAULT_DATASET = "debt_to_penny";

    static final Map<String, Dataset> DATASETS = Map.of(
            "debt_to_penny", new Dataset("/v2/accounting/od/debt_to_penny", "Debt to the Penny"),
            "debt_outstanding", new Dataset("/v1/debt/mspd/mspd_table_1", "Monthly Statement of the Public Debt"),
            "treasury_offset", new Dataset("/v1/debt/top/top_state", "Treasury Offset Program by State"),
            "interest_rates", new Dataset("/v1/accounting/od/avg_interest_rates", "Average Interest Rates"),
            "monthly_receipts", new Dataset("/v1/accounting/mts/mts_table_4", "Monthly Treasury Statement: Receipts"),
            "monthly_outlays", new Dataset("/v1/accounting/mts/mts_table_5", "Monthly Treasury Statement: Outlays"),
            "federal_surplus_deficit", new Dataset("/v2/accounting/od/statement_net_cost", "Statement of Net Cost"));

    private final String baseUrl;
    private final ObjectMapper objectMapper;

    public FiscalDataClient(RadarProperties properties,
                            RestClient.Builder restClientBuilder,
                            @Qualifier("govApiRetry") Retry retry,
                            ObjectMapper objectMapper) {
        super("Fiscal Data",
                restClientBuilder.clone().baseUrl(properties.getProviders().getFiscalDataBaseUrl()).build(),
                retry);
        this.baseUrl = properties.getProviders().getFiscalDataBaseUrl();
        this.objectMapper = objectMapper;
    }

    public SearchResults query(String datasetKey, int pageSize) {
        String key = DATASETS.containsKey(datasetKey) ? datasetKey : DEFAULT_DATASET;
        Dataset dataset = DATASETS.get(key);

        JsonNode root = getJson(uri -> uri.path(dataset.endpoint())
                .queryParam("page[size]", pageSize)
                .queryParam("sort", "-record_date")
                .build());

        List<SourceRecord> records = new ArrayList<>();
        int i = 0;
        for (JsonNode row : root.path("data")) {
            String recordDate = text(row, "record_date");
            Map<String, Object> raw = objectMapper.convertValue(row, new TypeReference<LinkedHashMap<String, Object>>() {});
            records.add(SourceRecord.builder()
                    .sourceType("fiscal_data")
                    .id(key + "-" + (recordDate != null ? recordDate : String.valueOf(i)))
                    .title(title(key, dataset, row))
                    .agency("U.S. Department of the Treasury")
                    .date(recordDate)
                    .url(baseUrl + dataset.endpoint())
                    .raw(raw)
                    .build());
            i++;
        }

        Map<String, Object> extras = new LinkedHashMap<>();
        extras.put("dataset", key);
        extras.put("dataset_name", dataset.name());
        return new SearchResults(records, root.path("meta").path("total-count").asInt(records.size()), extras);
    }

    static String title(String key, Dataset dataset, JsonNode row) {
        String date = text(row, "record_date");
        String suffix = date != null ? " (" + date + ")" : "";
        if ("debt_to_penny".equals(key)) {
            String amount = text(row, "tot_pub_debt_out_amt");
            if (amount != null) {
                try {
                    double trillions = Double.parseDouble(amount) / 1e12;
                    return String.format("Public Debt: $%.2fT%s", trillions, suffix);
                } catch (NumberFormatException ignored) {
                    return "Public Debt: $" + amount + suffix;
                }
            }
        }
        if ("interest_rates".equals(key)) {
            String security = text(row, "security_desc");
            String rate = text(row, "avg_interest_rate_amt");
            if (security != null && rate != null) return security + ": " + rate + "%" + suffix;
        }
        String classification = text(row, "classification_desc");
        if (classification != null) return dataset.name() + ": " + classification + suffix;
        return dataset.name() + suffix;
    }

    record Dataset(String endpoint, String name) {}
}
