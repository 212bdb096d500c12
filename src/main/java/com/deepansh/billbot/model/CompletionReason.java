package com.deepansh.billbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CompletionReason {

    MAX_ITERATIONS,
    RESULT_CAP,
    NO_NEW_RESULTS,
    DIMINISHING_RETURNS,
    CANCELLED,
    TOOL_FAILURE,
    TIME_BUDGET_EXCEEDED,
    /** Unexpected internal failure */
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /** Status reported in the end event. */
    public String endStatus() {
        return switch (this) {
            case CANCELLED -> "stopped";
            case TOOL_FAILURE, ERROR -> "error";
            default -> "completed";
        };
    }

    /** Stopped by one of the loop's own continuation rules. */
    public boolean isNaturalStop() {
        return switch (this) {
            case MAX_ITERATIONS, RESULT_CAP, NO_NEW_RESULTS, DIMINISHING_RETURNS, TIME_BUDGET_EXCEEDED -> true;
            default -> false;
        };
    }
}
