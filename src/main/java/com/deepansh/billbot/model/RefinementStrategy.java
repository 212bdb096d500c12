package com.deepansh.billbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** How the query of an iteration was derived from the previous one. */
public enum RefinementStrategy {

    INITIAL,
    EXPAND_TERMS,
    NARROW_FOCUS,
    CHANGE_TIMEFRAME,
    ADJUST_FILTERS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /** Progress narration shown to the user while the refined query runs. */
    public String describe() {
        return switch (this) {
            case INITIAL -> "Initial search";
            case EXPAND_TERMS -> "Broadening the search with related terms";
            case NARROW_FOCUS -> "Narrowing the search to the most relevant focus";
            case CHANGE_TIMEFRAME -> "Shifting the search to a more recent timeframe";
            case ADJUST_FILTERS -> "Adjusting search filters";
        };
    }
}
