package com.deepansh.billbot.model;

import lombok.Builder;
import lombok.Value;

/**
 * One pass of the search loop. Append-only: once recorded it is used both for
 * continuation decisions and for progress narration.
 */
@Value
@Builder
public class SearchIteration {

    int iterationNumber;
    String queryUsed;
    RefinementStrategy strategy;
    int resultCount;
    int newResultCount;
    int cumulativeCount;
    long durationMs;
    /** Mean age in days of the records returned this round; -1 when none carried a date */
    long averageAgeDays;
}
