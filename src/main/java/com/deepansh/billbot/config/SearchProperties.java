package com.deepansh.billbot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Limits and heuristics for the iterative search loop.
 * Bound from application.yml under the "search" prefix.
 *
 * The refinement thresholds are heuristics, not measured values. Tune them freely.
 */
@Component
@ConfigurationProperties(prefix = "search")
@Validated
@Data
public class SearchProperties {

    public static final int ITERATION_CEILING = 50;

    @Min(1) @Max(ITERATION_CEILING)
    private int maxIterations = 20;

    @Min(1)
    private int resultCap = 50;

    @NotNull
    private Duration timeBudget = Duration.ofSeconds(60);

    @Min(1)
    private int diminishingWindow = 3;

    @DecimalMin("0.0")
    private double diminishingThreshold = 1.0;

    @Min(1) @Max(50)
    private int pageSize = 20;

    private String billTool = "search_bills";
    private String executiveActionTool = "search_executive_actions";
    private String defaultSearchType = "hybrid";

    /** How often a blocked tool call re-checks the cancellation token */
    private Duration cancellationPollInterval = Duration.ofMillis(100);

    @Valid
    private Refinement refinement = new Refinement();

    @Valid
    private Answer answer = new Answer();

    @Data
    public static class Refinement {
        /** Below this cumulative count the query is broadened */
        @Min(0)
        private int expandBelow = 5;
        /** Above this many results in the last round the query is narrowed */
        @Min(0)
        private int narrowAbove = 15;
        /** Average result age beyond which the timeframe is moved */
        private Duration staleAfter = Duration.ofDays(365);
        /** Vocabulary terms appended when expanding */
        @Min(1)
        private int expansionTerms = 2;
        /** Focus terms AND-ed in when narrowing */
        @Min(1)
        private int focusTerms = 1;
        /** Top results mined for vocabulary */
        @Min(1)
        private int vocabularySample = 3;
    }

    @Data
    public static class Answer {
        private boolean enabled = true;
        /** Citations handed to the text generator */
        @Min(1)
        private int contextLimit = 10;
    }

    /** Clamps a per-request override into the allowed iteration range. */
    public int resolveMaxIterations(Integer requested) {
        if (requested == null) return maxIterations;
        return Math.min(Math.max(requested, 1), ITERATION_CEILING);
    }
}
