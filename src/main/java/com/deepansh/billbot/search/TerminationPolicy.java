package com.deepansh.billbot.search;

import com.deepansh.billbot.config.SearchProperties;
import com.deepansh.billbot.model.CompletionReason;
import com.deepansh.billbot.model.SearchIteration;

import java.util.List;
import java.util.Optional;

/**
 * Decides after each iteration whether the loop stops. Checked in order:
 * iteration limit, result cap, an empty round, then a low trailing average
 * of new results. Cancellation and the time budget are checked by the loop itself.
 */
public class TerminationPolicy {

    private final int maxIterations;
    private final int resultCap;
    private final int window;
    private final double threshold;

    public TerminationPolicy(int maxIterations, int resultCap, int window, double threshold) {
        this.maxIterations = maxIterations;
        this.resultCap = resultCap;
        this.window = window;
        this.threshold = threshold;
    }

    public static TerminationPolicy from(SearchProperties props, int maxIterations) {
        return new TerminationPolicy(maxIterations, props.getResultCap(),
                props.getDiminishingWindow(), props.getDiminishingThreshold());
    }

    public Optional<CompletionReason> evaluate(List<SearchIteration> iterations, int cumulative) {
        if (iterations.isEmpty()) return Optional.empty();

        if (iterations.size() >= maxIterations) return Optional.of(CompletionReason.MAX_ITERATIONS);
        if (cumulative >= resultCap) return Optional.of(CompletionReason.RESULT_CAP);

        SearchIteration last = iterations.get(iterations.size() - 1);
        if (last.getNewResultCount() == 0) return Optional.of(CompletionReason.NO_NEW_RESULTS);

        if (iterations.size() >= window) {
            double average = iterations.subList(iterations.size() - window, iterations.size()).stream()
                    .mapToInt(SearchIteration::getNewResultCount)
                    .average()
                    .orElse(0);
            if (average < threshold) return Optional.of(CompletionReason.DIMINISHING_RETURNS);
        }
        return Optional.empty();
    }

    public int maxIterations() {
        return maxIterations;
    }
}
