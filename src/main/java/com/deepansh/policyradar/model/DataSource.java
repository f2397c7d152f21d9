package com.deepansh.policyradar.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * External data providers a chat turn may draw on. The key is the wire name used in
 * source selections and router answers.
 */
public enum DataSource {

    REGULATIONS("regulations", "Regulations.gov"),
    GOVINFO("govinfo", "GovInfo"),
    CONGRESS("congress", "Congress.gov"),
    FEDERAL_REGISTER("federal_register", "Federal Register"),
    USASPENDING("usaspending", "USAspending.gov"),
    FISCAL_DATA("fiscal_data", "Treasury Fiscal Data"),
    DATAGOV("datagov", "Data.gov"),
    DOJ("doj", "DOJ press releases"),
    SEARCHGOV("searchgov", "Search.gov");

    private final String key;
    private final String displayName;

    DataSource(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<DataSource> fromKey(String key) {
        if (key == null) return Optional.empty();
        String normalized = key.trim().toLowerCase();
        return Arrays.stream(values()).filter(s -> s.key.equals(normalized)).findFirst();
    }
}
