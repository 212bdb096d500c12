package com.deepansh.billbot.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * One record returned by a search tool. Identity is (contentType, contentId).
 * {@code sourceMetadata} holds the raw record exactly as the tool returned it.
 */
@Value
@Builder
public class ResultRecord {

    String contentId;
    ContentType contentType;
    String title;
    String summary;
    double relevanceScore;
    /** introduced date for bills, signed date for executive actions */
    LocalDate date;
    Map<String, Object> sourceMetadata;

    public Key key() {
        return new Key(contentType, contentId);
    }

    public record Key(ContentType contentType, String contentId) {}
}
