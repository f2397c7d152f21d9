package com.deepansh.policyradar.provider;

import com.deepansh.policyradar.model.SourceRecord;

import java.util.List;
import java.util.Map;

/**
 * Normalized search response.
 *
 * @param total provider-reported total when known, otherwise the record count
 * @param extras provider-specific summary fields passed through to the model
 */
public record SearchResults(List<SourceRecord> records, int total, Map<String, Object> extras) {

    public static SearchResults of(List<SourceRecord> records, int total) {
        return new SearchResults(records, total, Map.of());
    }
}
