package com.deepansh.policyradar.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StepStatus {
    RUNNING,
    DONE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
