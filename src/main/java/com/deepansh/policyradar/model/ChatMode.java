package com.deepansh.policyradar.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Legacy coarse source filter kept for older clients. */
public enum ChatMode {
    REGULATIONS,
    GOVINFO,
    BOTH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ChatMode fromWire(String value) {
        if (value == null || value.isBlank()) return BOTH;
        return switch (value.trim().toLowerCase()) {
            case "regulations" -> REGULATIONS;
            case "govinfo" -> GOVINFO;
            default -> BOTH;
        };
    }
}
