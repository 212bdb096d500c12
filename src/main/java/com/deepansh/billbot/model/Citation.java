package com.deepansh.billbot.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Client-facing provenance record derived 1:1 from a deduplicated {@link ResultRecord}.
 * Immutable: once streamed it is never changed.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Citation {

    String id;
    ContentType type;
    String title;
    String url;
    double relevanceScore;
    String excerpt;

    // bill metadata
    String billNumber;
    String sponsor;
    String chamber;
    String status;
    String introducedDate;
    String committee;

    // executive action metadata
    Integer executiveOrderNumber;
    String actionType;
    String administration;
    String presidentName;
    String signedDate;
    String citation;
    List<String> agencies;

    Source source;
    SearchContext searchContext;
    RelevanceIndicators relevanceIndicators;

    /** The tool's record as returned, for fields not promoted above */
    Map<String, Object> sourceMetadata;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Source {
        String name;
        /** official | congressional | whitehouse */
        String type;
        String publishedDate;
        String author;
    }

    @Value
    @Builder
    public static class SearchContext {
        String query;
        String searchMethod;
        int rank;
        String searchTimestamp;
        int iterationsUsed;
    }

    @Value
    @Builder
    public static class RelevanceIndicators {
        int termMatches;
        double titleRelevance;
        double summaryRelevance;
        double recency;
    }
}
