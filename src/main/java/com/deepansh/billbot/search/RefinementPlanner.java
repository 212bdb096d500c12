package com.deepansh.billbot.search;

import com.deepansh.billbot.config.SearchProperties;
import com.deepansh.billbot.model.DateRange;
import com.deepansh.billbot.model.RefinementStrategy;
import com.deepansh.billbot.model.ResultRecord;
import com.deepansh.billbot.model.SearchFilters;
import com.deepansh.billbot.model.SearchIteration;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Chooses how the next iteration's query differs from the last one.
 *
 * Rules are tried in order and the first that applies wins:
 * <ol>
 *   <li>few results so far: broaden with vocabulary from the best results</li>
 *   <li>the last round was crowded: AND in a focus term</li>
 *   <li>the last round was old on average: restrict to the past year</li>
 *   <li>otherwise: relax one filter, or switch search mode when none is left</li>
 * </ol>
 * Refined queries always derive from the original query so terms never pile up.
 */
public class RefinementPlanner {

    private static final Pattern TOKEN = Pattern.compile("[a-z0-9]+");
    private static final List<String> SEARCH_TYPE_ROTATION = List.of("hybrid", "semantic", "keyword");

    private static final Set<String> STOPWORDS = Set.of(
            "about", "above", "act", "after", "again", "against", "also", "amend", "amends", "among",
            "and", "another", "any", "are", "because", "been", "before", "being", "between", "bill",
            "both", "but", "can", "could", "does", "during", "each", "from", "further", "have",
            "having", "into", "its", "more", "most", "other", "over", "provide", "provides", "purposes",
            "same", "section", "shall", "should", "such", "than", "that", "the", "their", "them",
            "then", "there", "these", "they", "this", "those", "through", "under", "until", "upon",
            "very", "were", "what", "when", "where", "which", "while", "with", "within", "would",
            "year", "years");

    private final SearchProperties.Refinement settings;
    private final Clock clock;

    public RefinementPlanner(SearchProperties.Refinement settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    /** Next query, filters and search mode. */
    public Plan plan(PlanningState state) {
        return expandTerms(state)
                .or(() -> narrowFocus(state))
                .or(() -> changeTimeframe(state))
                .orElseGet(() -> adjustFilters(state));
    }

    private Optional<Plan> expandTerms(PlanningState state) {
        if (state.cumulativeCount() >= settings.getExpandBelow()) return Optional.empty();

        List<String> terms = vocabulary(state).stream().limit(settings.getExpansionTerms()).toList();
        if (terms.isEmpty()) return Optional.empty();

        String query = state.originalQuery() + " OR " + String.join(" OR ", terms);
        return Optional.of(new Plan(RefinementStrategy.EXPAND_TERMS, query, state.filters(), state.searchType()));
    }

    private Optional<Plan> narrowFocus(PlanningState state) {
        SearchIteration last = state.lastIteration();
        if (last == null || last.getResultCount() <= settings.getNarrowAbove()) return Optional.empty();

        List<String> focus = vocabulary(state).stream().limit(settings.getFocusTerms()).toList();
        if (focus.isEmpty()) return Optional.empty();

        String query = state.originalQuery() + " AND " + String.join(" AND ", focus);
        return Optional.of(new Plan(RefinementStrategy.NARROW_FOCUS, query, state.filters(), state.searchType()));
    }

    private Optional<Plan> changeTimeframe(PlanningState state) {
        SearchIteration last = state.lastIteration();
        if (last == null || last.getAverageAgeDays() < 0) return Optional.empty();
        if (last.getAverageAgeDays() <= settings.getStaleAfter().toDays()) return Optional.empty();
        if (state.filters().getDateRange() != null) return Optional.empty();

        LocalDate today = LocalDate.now(clock);
        DateRange pastYear = new DateRange(today.minusYears(1).toString(), today.toString());
        SearchFilters filters = state.filters().toBuilder().dateRange(pastYear).build();
        return Optional.of(new Plan(RefinementStrategy.CHANGE_TIMEFRAME, state.originalQuery(), filters, state.searchType()));
    }

    private Plan adjustFilters(PlanningState state) {
        SearchFilters relaxed = relaxOne(state.filters());
        if (relaxed != null) {
            return new Plan(RefinementStrategy.ADJUST_FILTERS, state.originalQuery(), relaxed, state.searchType());
        }
        return new Plan(RefinementStrategy.ADJUST_FILTERS, state.originalQuery(), state.filters(),
                nextSearchType(state.searchType()));
    }

    /** Copy of the filters with the most restrictive remaining one removed, or null when none is set. */
    static SearchFilters relaxOne(SearchFilters filters) {
        SearchFilters.SearchFiltersBuilder b = filters.toBuilder();
        if (notEmpty(filters.getStatus())) return b.status(null).build();
        if (notEmpty(filters.getSponsor())) return b.sponsor(null).build();
        if (notEmpty(filters.getTopics())) return b.topics(null).build();
        if (filters.getCommittee() != null) return b.committee(null).build();
        if (filters.getChamber() != null) return b.chamber(null).build();
        if (filters.getCongress() != null) return b.congress(null).build();
        if (filters.getDateRange() != null) return b.dateRange(null).build();
        if (filters.getActionType() != null) return b.actionType(null).build();
        if (filters.getAdministration() != null) return b.administration(null).build();
        if (notEmpty(filters.getAgencies())) return b.agencies(null).build();
        return null;
    }

    static String nextSearchType(String current) {
        int idx = SEARCH_TYPE_ROTATION.indexOf(current == null ? "" : current.toLowerCase(Locale.ROOT));
        return SEARCH_TYPE_ROTATION.get((idx + 1) % SEARCH_TYPE_ROTATION.size());
    }

    /**
     * Frequent words of the top results that the query does not already contain,
     * most frequent first, ties alphabetical.
     */
    List<String> vocabulary(PlanningState state) {
        Set<String> queryTerms = new HashSet<>(tokens(state.originalQuery()).toList());
        Map<String, Integer> counts = new LinkedHashMap<>();

        state.topResults().stream()
                .limit(settings.getVocabularySample())
                .flatMap(r -> Stream.concat(tokens(r.getTitle()), tokens(r.getSummary())))
                .filter(t -> t.length() > 3)
                .filter(t -> !STOPWORDS.contains(t))
                .filter(t -> !queryTerms.contains(t))
                .forEach(t -> counts.merge(t, 1, Integer::sum));

        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .toList();
    }

    private static Stream<String> tokens(String text) {
        if (text == null) return Stream.empty();
        Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        return m.results().map(MatchResult::group);
    }

    private static boolean notEmpty(List<?> list) {
        return list != null && !list.isEmpty();
    }

    /**
     * What the planner looks at.
     *
     * @param topResults accumulated records, best first
     */
    public record PlanningState(String originalQuery,
                                SearchFilters filters,
                                String searchType,
                                List<SearchIteration> iterations,
                                int cumulativeCount,
                                List<ResultRecord> topResults) {

        SearchIteration lastIteration() {
            return iterations.isEmpty() ? null : iterations.get(iterations.size() - 1);
        }
    }

    /** The next iteration's inputs. */
    public record Plan(RefinementStrategy strategy, String query, SearchFilters filters, String searchType) {
    }
}
