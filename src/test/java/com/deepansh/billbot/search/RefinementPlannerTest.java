package com.deepansh.billbot.search;

import com.deepansh.billbot.config.SearchProperties;
import com.deepansh.billbot.model.ContentType;
import com.deepansh.billbot.model.DateRange;
import com.deepansh.billbot.model.RefinementStrategy;
import com.deepansh.billbot.model.ResultRecord;
import com.deepansh.billbot.model.SearchFilters;
import com.deepansh.billbot.model.SearchIteration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RefinementPlannerTest {

    private RefinementPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new RefinementPlanner(new SearchProperties.Refinement(),
                Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void fewResults_expandsWithTopResultVocabulary() {
        List<ResultRecord> top = List.of(
                record("Rural broadband expansion", "Grants for broadband deployment in rural counties."),
                record("Broadband affordability", "Subsidies for rural households."));

        RefinementPlanner.Plan plan = planner.plan(state("internet access", SearchFilters.empty(), 3, 3, -1, top));

        assertThat(plan.strategy()).isEqualTo(RefinementStrategy.EXPAND_TERMS);
        assertThat(plan.query()).isEqualTo("internet access OR broadband OR rural");
    }

    @Test
    void fewResultsButNoVocabulary_fallsThroughToFilters() {
        SearchFilters filters = SearchFilters.builder().status(List.of("passed")).chamber("senate").build();

        RefinementPlanner.Plan plan = planner.plan(state("zzz", filters, 0, 0, -1, List.of()));

        assertThat(plan.strategy()).isEqualTo(RefinementStrategy.ADJUST_FILTERS);
        assertThat(plan.filters().getStatus()).isNull();
        assertThat(plan.filters().getChamber()).isEqualTo("senate");
        assertThat(plan.query()).isEqualTo("zzz");
    }

    @Test
    void crowdedRound_narrowsWithFocusTerm() {
        List<ResultRecord> top = List.of(
                record("Medicare drug pricing", "Negotiation of drug prices under Medicare."),
                record("Drug importation", "Allows importation of prescription drug products."));

        RefinementPlanner.Plan plan = planner.plan(state("health care costs", SearchFilters.empty(), 20, 20, -1, top));

        assertThat(plan.strategy()).isEqualTo(RefinementStrategy.NARROW_FOCUS);
        assertThat(plan.query()).isEqualTo("health care costs AND drug");
    }

    @Test
    void staleResults_moveTimeframeToPastYear() {
        RefinementPlanner.Plan plan = planner.plan(state("tariffs", SearchFilters.empty(), 10, 10, 900, List.of()));

        assertThat(plan.strategy()).isEqualTo(RefinementStrategy.CHANGE_TIMEFRAME);
        assertThat(plan.filters().getDateRange()).isEqualTo(new DateRange("2023-06-01", "2024-06-01"));
        assertThat(plan.query()).isEqualTo("tariffs");
    }

    @Test
    void staleResultsWithExistingRange_adjustsFiltersInstead() {
        SearchFilters filters = SearchFilters.builder().dateRange(new DateRange("2010-01-01", "2012-01-01")).build();

        RefinementPlanner.Plan plan = planner.plan(state("tariffs", filters, 10, 10, 900, List.of()));

        assertThat(plan.strategy()).isEqualTo(RefinementStrategy.ADJUST_FILTERS);
        assertThat(plan.filters().getDateRange()).isNull();
    }

    @Test
    void noFiltersLeft_rotatesSearchType() {
        RefinementPlanner.Plan plan = planner.plan(state("tariffs", SearchFilters.empty(), 10, 10, 30, List.of()));

        assertThat(plan.strategy()).isEqualTo(RefinementStrategy.ADJUST_FILTERS);
        assertThat(plan.searchType()).isEqualTo("semantic");
        assertThat(RefinementPlanner.nextSearchType("semantic")).isEqualTo("keyword");
        assertThat(RefinementPlanner.nextSearchType("keyword")).isEqualTo("hybrid");
        assertThat(RefinementPlanner.nextSearchType("unknown")).isEqualTo("hybrid");
    }

    @Test
    void refinedQueries_alwaysDeriveFromOriginal() {
        List<ResultRecord> top = List.of(record("Solar energy credits", "Solar credits for homeowners."));

        RefinementPlanner.Plan first = planner.plan(state("renewables", SearchFilters.empty(), 1, 1, -1, top));
        RefinementPlanner.Plan second = planner.plan(state("renewables", first.filters(), 2, 1, -1, top));

        assertThat(first.query()).startsWith("renewables OR ");
        assertThat(second.query()).startsWith("renewables OR ").doesNotContain("OR renewables");
        assertThat(second.query()).isEqualTo(first.query());
    }

    @Test
    void vocabulary_skipsStopwordsShortWordsAndQueryTerms() {
        List<ResultRecord> top = List.of(record("A bill to amend the Water Act", "Provides water grants for the states"));

        List<String> vocabulary = planner.vocabulary(state("water", SearchFilters.empty(), 1, 1, -1, top));

        assertThat(vocabulary).containsExactly("grants", "states")
                .doesNotContain("water", "bill", "amend", "provides", "act");
    }

    @Test
    void relaxOne_removesOneFilterAtATime() {
        SearchFilters filters = SearchFilters.builder()
                .sponsor(List.of("Rep. Lee"))
                .topics(List.of("Health"))
                .build();

        SearchFilters once = RefinementPlanner.relaxOne(filters);
        SearchFilters twice = RefinementPlanner.relaxOne(once);

        assertThat(once.getSponsor()).isNull();
        assertThat(once.getTopics()).containsExactly("Health");
        assertThat(twice.isEmpty()).isTrue();
        assertThat(RefinementPlanner.relaxOne(twice)).isNull();
        assertThat(filters.getSponsor()).containsExactly("Rep. Lee");
    }

    private static RefinementPlanner.PlanningState state(String query, SearchFilters filters, int cumulative,
                                                         int lastResultCount, long ageDays, List<ResultRecord> top) {
        SearchIteration last = SearchIteration.builder()
                .iterationNumber(1)
                .queryUsed(query)
                .strategy(RefinementStrategy.INITIAL)
                .resultCount(lastResultCount)
                .newResultCount(lastResultCount)
                .cumulativeCount(cumulative)
                .averageAgeDays(ageDays)
                .build();
        return new RefinementPlanner.PlanningState(query, filters, "hybrid", List.of(last), cumulative, top);
    }

    private static ResultRecord record(String title, String summary) {
        return ResultRecord.builder()
                .contentId(title)
                .contentType(ContentType.BILL)
                .title(title)
                .summary(summary)
                .relevanceScore(0.5)
                .build();
    }
}
