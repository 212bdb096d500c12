package com.deepansh.billbot.model.payload;

import com.deepansh.billbot.model.RefinementStrategy;
import com.deepansh.billbot.model.ToolCallStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Progress of one tool call. All events for the same call share {@code id};
 * {@code message} is the human-readable narration.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolCallPayload {

    String id;
    String name;
    Map<String, Object> arguments;
    ToolCallStatus status;
    String message;
    String error;
    Metadata metadata;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Metadata {
        int iteration;
        RefinementStrategy strategy;
        String searchType;
        Integer resultCount;
        Integer newResultCount;
        Integer cumulativeCount;
        Long duration;
    }
}
