package com.deepansh.billbot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ContentType {

    BILL("bill"),
    EXECUTIVE_ACTION("executive_action");

    private final String wireName;

    ContentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Accepts the wire name, the enum name, and the plural forms clients tend to send. */
    @JsonCreator
    public static ContentType fromValue(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase();
        if (v.equals("bills")) return BILL;
        if (v.equals("executive_actions") || v.equals("executive-actions")) return EXECUTIVE_ACTION;
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(v) || t.name().equalsIgnoreCase(v))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown content type: " + value));
    }
}
