package com.deepansh.policyradar.tool.impl;

import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.provider.FiscalDataClient;
import com.deepansh.policyradar.tool.ToolArgs;
import com.deepansh.policyradar.tool.ToolContext;
import com.deepansh.policyradar.tool.ToolResult;
import com.deepansh.policyradar.tool.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.deepansh.policyradar.tool.JsonSchema.enumString;
import static com.deepansh.policyradar.tool.JsonSchema.integer;
import static com.deepansh.policyradar.tool.JsonSchema.object;
import static com.deepansh.policyradar.tool.JsonSchema.properties;

@Component
public class FiscalDataQueryTool extends SearchTool {

    private final FiscalDataClient client;

    public FiscalDataQueryTool(FiscalDataClient client) {
        super(new ToolSpec("fiscal_data_query",
                "Query Treasury Fiscal Data: national debt, interest rates, monthly receipts and outlays. Newest rows first.",
                object(properties(
                        "dataset", enumString("Dataset. Default: debt_to_penny", List.of(
                                "debt_to_penny", "debt_outstanding", "treasury_offset", "interest_rates",
                                "monthly_receipts", "monthly_outlays", "federal_surplus_deficit")),
                        "page_size", integer("Rows to return (1-100). Default: 10", 1, 100))),
                DataSource.FISCAL_DATA));
        this.client = client;
    }

    @Override
    public ToolResult execute(Map<String, Object> args, ToolContext context) {
        String dataset = ToolArgs.string(args, "dataset", FiscalDataClient.DEFAULT_DATASET);
        int pageSize = ToolArgs.clampedInt(args, "page_size", 10, 1, 100);
        return toResult(client.query(dataset, pageSize), echo());
    }

    @Override
    public String label(Map<String, Object> args) {
        return "Query Fiscal Data: " + ToolArgs.string(args, "dataset", FiscalDataClient.DEFAULT_DATASET);
    }

    @Override
    public Map<String, Object> preview(ToolResult result) {
        Map<String, Object> preview = new LinkedHashMap<>();
        preview.put("count", result.getSources().size());
        preview.put("dataset", result.getPayload().get("dataset"));
        return preview;
    }
}
