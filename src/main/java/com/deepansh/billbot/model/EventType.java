package com.deepansh.billbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Stream event kinds. Clients key their UI updates off the wire name. */
public enum EventType {

    START,
    CONTENT,
    TOOL_CALL,
    CITATION,
    ERROR,
    END;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == END;
    }
}
