package com.deepansh.billbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolCallStatus {

    PREPARING,
    EXECUTING,
    PROCESSING,
    RETRYING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
