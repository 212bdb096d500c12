package com.deepansh.billbot.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StopResult {
    boolean success;
    String message;
    String stoppedAt;
    String sessionId;
    String connectionId;
}
