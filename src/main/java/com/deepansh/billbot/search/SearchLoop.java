package com.deepansh.billbot.search;

import com.deepansh.billbot.config.SearchProperties;
import com.deepansh.billbot.exception.BillBotException;
import com.deepansh.billbot.exception.ToolCallException;
import com.deepansh.billbot.llm.AnswerGenerator;
import com.deepansh.billbot.llm.AnswerRequest;
import com.deepansh.billbot.model.Citation;
import com.deepansh.billbot.model.CompletionReason;
import com.deepansh.billbot.model.ContentType;
import com.deepansh.billbot.model.EventType;
import com.deepansh.billbot.model.RefinementStrategy;
import com.deepansh.billbot.model.ResultRecord;
import com.deepansh.billbot.model.SearchFilters;
import com.deepansh.billbot.model.SearchIteration;
import com.deepansh.billbot.model.SearchOptions;
import com.deepansh.billbot.model.ToolCallStatus;
import com.deepansh.billbot.model.payload.ContentPayload;
import com.deepansh.billbot.model.payload.EndPayload;
import com.deepansh.billbot.model.payload.ErrorPayload;
import com.deepansh.billbot.model.payload.StartPayload;
import com.deepansh.billbot.model.payload.ToolCallPayload;
import com.deepansh.billbot.observability.RunContext;
import com.deepansh.billbot.session.SearchSession;
import com.deepansh.billbot.streaming.EventSink;
import com.deepansh.billbot.tool.SearchToolRequest;
import com.deepansh.billbot.tool.SearchToolResult;
import com.deepansh.billbot.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The refine-and-accumulate search loop.
 *
 * Per-session flow:
 * 1. Emit start
 * 2. Search every requested content type with the current query
 * 3. Merge new records into the accumulator, record the iteration
 * 4. Stop if a termination rule fires, otherwise refine and repeat
 * 5. Emit citations best first, optionally a generated answer, then end
 *
 * Cancellation and the time budget are checked before every search call and
 * while a call is in flight. Every run ends with exactly one end event.
 */
@Service
@Slf4j
public class SearchLoop {

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    private static final int MAX_ATTEMPTS = 2;

    private final ToolRegistry toolRegistry;
    private final CitationNormalizer citationNormalizer;
    private final AnswerGenerator answerGenerator;
    private final SearchProperties props;
    private final Clock clock;

    public SearchLoop(ToolRegistry toolRegistry,
                      CitationNormalizer citationNormalizer,
                      AnswerGenerator answerGenerator,
                      SearchProperties props,
                      Clock clock) {
        this.toolRegistry = toolRegistry;
        this.citationNormalizer = citationNormalizer;
        this.answerGenerator = answerGenerator;
        this.props = props;
        this.clock = clock;
    }

    /** Runs the session to completion on the calling thread. Never throws. */
    public CompletionReason run(SearchSession session, SearchOptions options, EventSink sink) {
        return new Run(session, options != null ? options : SearchOptions.defaults(), sink).execute();
    }

    /** State of one run. Confined to the thread executing it. */
    private final class Run {

        private final SearchSession session;
        private final SearchOptions options;
        private final EventSink sink;
        private final RunContext runCtx;
        private final ResultAccumulator accumulator;
        private final TerminationPolicy policy;
        private final RefinementPlanner planner;
        private final List<ContentType> contentTypes;
        private final long deadlineNanos;
        private final long startNanos = System.nanoTime();

        private String query;
        private SearchFilters filters;
        private String searchType;
        private RefinementStrategy strategy = RefinementStrategy.INITIAL;

        Run(SearchSession session, SearchOptions options, EventSink sink) {
            this.session = session;
            this.options = options;
            this.sink = sink;
            this.runCtx = new RunContext(session.getSessionId(), session.getConnectionId());
            this.accumulator = new ResultAccumulator(props.getResultCap());
            this.policy = TerminationPolicy.from(props, props.resolveMaxIterations(options.getMaxIterations()));
            this.planner = new RefinementPlanner(props.getRefinement(), clock);
            this.contentTypes = resolveContentTypes(options.getContentTypes());
            this.deadlineNanos = startNanos + props.getTimeBudget().toNanos();
            this.query = session.getOriginalQuery();
            this.filters = options.getSearchFilters() != null ? options.getSearchFilters() : SearchFilters.empty();
            this.searchType = options.getSearchType() != null ? options.getSearchType() : props.getDefaultSearchType();
        }

        CompletionReason execute() {
            log.info("Search run started {} query='{}', maxIterations={}, contentTypes={}",
                    session, session.getOriginalQuery(), policy.maxIterations(), contentTypes);

            sink.push(EventType.START, new StartPayload(session.getSessionId(), session.getConnectionId(),
                    session.getMessageId(), session.getOriginalQuery(), Instant.now(clock).toString()));

            CompletionReason reason;
            BillBotException failure = null;
            try {
                reason = iterate();
            } catch (LoopInterrupted e) {
                reason = e.reason;
                log.info("Search run interrupted {} reason={}", session, reason.wireName());
            } catch (ToolFailure e) {
                reason = CompletionReason.TOOL_FAILURE;
                failure = e.failure;
                log.warn("Search run ended by tool failure {}: {}", session, e.failure.getMessage());
            } catch (RuntimeException e) {
                log.error("Search run failed {}", session, e);
                reason = CompletionReason.ERROR;
                failure = internalError(e);
            }

            return finish(reason, failure);
        }

        private CompletionReason iterate() {
            for (int iteration = 1; ; iteration++) {
                checkpoint();
                SearchIteration round = searchRound(iteration);
                session.recordIteration(round);
                log.info("Iteration {}/{} {} strategy={}, results={}, new={}, total={}",
                        iteration, policy.maxIterations(), session, strategy.wireName(),
                        round.getResultCount(), round.getNewResultCount(), round.getCumulativeCount());

                checkpoint();
                Optional<CompletionReason> stop = policy.evaluate(session.getIterations(), accumulator.size());
                if (stop.isPresent()) return stop.get();

                refine();
            }
        }

        private void refine() {
            List<ResultRecord> top = accumulator.ranked().stream()
                    .map(ResultAccumulator.Entry::record)
                    .toList();
            RefinementPlanner.Plan plan = planner.plan(new RefinementPlanner.PlanningState(
                    session.getOriginalQuery(), filters, searchType, session.getIterations(),
                    accumulator.size(), top));

            strategy = plan.strategy();
            query = plan.query();
            filters = plan.filters();
            searchType = plan.searchType();
            log.debug("Refined {} strategy={}, query='{}', searchType={}", session, strategy.wireName(), query, searchType);
        }

        // ─── Searching ────────────────────────────────────────────────────────

        private SearchIteration searchRound(int iteration) {
            long roundStart = System.nanoTime();
            int resultCount = 0;
            int added = 0;
            List<ResultRecord> returned = new ArrayList<>();

            for (ContentType type : contentTypes) {
                if (accumulator.isFull()) break;
                checkpoint();

                SearchToolResult result = searchWithRetry(type, iteration);
                int fresh = accumulator.merge(result.results(), iteration, query);
                resultCount += result.results().size();
                added += fresh;
                returned.addAll(result.results());
                emitToolCall(callId(iteration, type), toolName(type), null, ToolCallStatus.COMPLETED,
                        "Found " + result.results().size() + " " + label(type) + " (" + fresh + " new, "
                                + accumulator.size() + " total)",
                        null, metadata(iteration)
                                .resultCount(result.results().size())
                                .newResultCount(fresh)
                                .cumulativeCount(accumulator.size())
                                .build());
            }

            return SearchIteration.builder()
                    .iterationNumber(iteration)
                    .queryUsed(query)
                    .strategy(strategy)
                    .resultCount(resultCount)
                    .newResultCount(added)
                    .cumulativeCount(accumulator.size())
                    .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - roundStart))
                    .averageAgeDays(averageAgeDays(returned))
                    .build();
        }

        /** One call, retried once on a tool failure. A second failure ends the run. */
        private SearchToolResult searchWithRetry(ContentType type, int iteration) {
            String tool = toolName(type);
            String id = callId(iteration, type);
            SearchToolRequest request = new SearchToolRequest(type, query, searchType, filters,
                    props.getPageSize(), iteration, accumulator.contentIds(type));
            Map<String, Object> args = describeArguments(request);

            emitToolCall(id, tool, args, ToolCallStatus.PREPARING,
                    strategy.describe() + ": \"" + query + "\"", null, metadata(iteration).build());

            for (int attempt = 1; ; attempt++) {
                checkpoint();
                emitToolCall(id, tool, null, ToolCallStatus.EXECUTING,
                        "Searching " + label(type) + (attempt > 1 ? " (attempt " + attempt + ")" : ""),
                        null, metadata(iteration).build());

                long callStart = System.currentTimeMillis();
                try {
                    SearchToolResult result = await(toolRegistry.search(tool, request), tool);
                    long latency = System.currentTimeMillis() - callStart;
                    runCtx.recordToolCall(tool, iteration, latency, result.results().size(), null);
                    emitToolCall(id, tool, null, ToolCallStatus.PROCESSING,
                            "Processing " + result.results().size() + " " + label(type), null,
                            metadata(iteration).resultCount(result.results().size()).duration(latency).build());
                    return result;
                } catch (BillBotException e) {
                    long latency = System.currentTimeMillis() - callStart;
                    runCtx.recordToolCall(tool, iteration, latency, 0, e.getMessage());

                    if (e instanceof ToolCallException && attempt < MAX_ATTEMPTS) {
                        log.warn("Tool call [{}] failed {} ({}), retrying", tool, session, e.getMessage());
                        runCtx.recordRetry();
                        emitToolCall(id, tool, null, ToolCallStatus.RETRYING,
                                "Search failed, retrying", e.getMessage(), metadata(iteration).duration(latency).build());
                        continue;
                    }
                    emitToolCall(id, tool, null, ToolCallStatus.FAILED,
                            "Search failed", e.getMessage(), metadata(iteration).duration(latency).build());
                    throw new ToolFailure(e);
                }
            }
        }

        /**
         * Waits for a tool result in short slices so that a stop request or the
         * time budget is noticed while the call is still in flight.
         */
        private <T> T await(CompletableFuture<T> future, String tool) {
            long slice = Math.max(1, props.getCancellationPollInterval().toMillis());
            while (true) {
                try {
                    checkpoint();
                } catch (LoopInterrupted e) {
                    future.cancel(false);
                    throw e;
                }
                try {
                    return future.get(slice, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    log.trace("Still waiting on [{}] {}", tool, session);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof BillBotException bbe) throw bbe;
                    throw new ToolCallException(tool, "Tool call failed: " + cause.getMessage(), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    future.cancel(false);
                    session.cancel();
                    throw new LoopInterrupted(CompletionReason.CANCELLED);
                }
            }
        }

        private void checkpoint() {
            if (session.isCancelled()) throw new LoopInterrupted(CompletionReason.CANCELLED);
            if (System.nanoTime() - deadlineNanos > 0) throw new LoopInterrupted(CompletionReason.TIME_BUDGET_EXCEEDED);
        }

        // ─── Finalizing ───────────────────────────────────────────────────────

        /** Streams what was accumulated, then the terminal events. The end event is always pushed. */
        private CompletionReason finish(CompletionReason reason, BillBotException failure) {
            CompletionReason outcome = reason;
            BillBotException error = failure;
            try {
                List<Citation> citations = emitCitations();
                if (error == null && shouldGenerateAnswer(reason, citations)) {
                    generateAnswer(citations);
                }
            } catch (RuntimeException e) {
                log.error("Finalizing failed {}", session, e);
                if (error == null) {
                    outcome = CompletionReason.ERROR;
                    error = internalError(e);
                }
            } finally {
                try {
                    if (error != null) {
                        sink.push(EventType.ERROR, ErrorPayload.from(error));
                    }
                    long duration = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                    sink.push(EventType.END, new EndPayload(session.getMessageId(), outcome.endStatus(), outcome,
                            session.iterationCount(), accumulator.size(), duration));
                } finally {
                    runCtx.logSummary(outcome, session.iterationCount(), accumulator.size());
                }
            }
            return outcome;
        }

        private List<Citation> emitCitations() {
            List<ResultAccumulator.Entry> ranked = accumulator.ranked();
            List<Citation> citations = new ArrayList<>(ranked.size());
            Instant now = Instant.now(clock);
            int rank = 1;
            for (ResultAccumulator.Entry entry : ranked) {
                Citation citation;
                try {
                    citation = citationNormalizer.normalize(entry.record(), new CitationNormalizer.CitationContext(
                            entry.query(), searchType, rank, session.iterationCount(), now));
                } catch (RuntimeException e) {
                    log.warn("Skipping result that could not be normalized {} key={}: {}",
                            session, entry.record().key(), e.toString());
                    continue;
                }
                rank++;
                citations.add(citation);
                if (sink.push(EventType.CITATION, citation)) {
                    runCtx.recordCitation();
                }
            }
            return citations;
        }

        private boolean shouldGenerateAnswer(CompletionReason reason, List<Citation> citations) {
            return reason.isNaturalStop()
                    && !citations.isEmpty()
                    && props.getAnswer().isEnabled()
                    && !Boolean.FALSE.equals(options.getGenerateAnswer())
                    && answerGenerator.isEnabled()
                    && !session.isCancelled()
                    && sink.isOpen();
        }

        private void generateAnswer(List<Citation> citations) {
            List<Citation> context = citations.subList(0, Math.min(citations.size(), props.getAnswer().getContextLimit()));
            AnswerRequest request = new AnswerRequest(session.getOriginalQuery(), context,
                    options.getModel(), options.getTemperature(), session::isCancelled);
            try {
                answerGenerator.streamAnswer(request, chunk -> {
                    if (sink.push(EventType.CONTENT, new ContentPayload(chunk, session.getMessageId()))) {
                        runCtx.recordAnswerChunk();
                    }
                });
            } catch (BillBotException e) {
                log.warn("Answer generation failed {}: {}", session, e.getMessage());
                sink.push(EventType.ERROR, ErrorPayload.from(e));
            }
        }

        // ─── Helpers ──────────────────────────────────────────────────────────

        private void emitToolCall(String id, String name, Map<String, Object> args, ToolCallStatus status,
                                  String message, String error, ToolCallPayload.Metadata metadata) {
            sink.push(EventType.TOOL_CALL, ToolCallPayload.builder()
                    .id(id)
                    .name(name)
                    .arguments(args)
                    .status(status)
                    .message(message)
                    .error(error)
                    .metadata(metadata)
                    .build());
        }

        private ToolCallPayload.Metadata.MetadataBuilder metadata(int iteration) {
            return ToolCallPayload.Metadata.builder()
                    .iteration(iteration)
                    .strategy(strategy)
                    .searchType(searchType);
        }

        private BillBotException internalError(RuntimeException e) {
            return new BillBotException("Search failed: " + e.getMessage(), INTERNAL_ERROR, true, e);
        }

        private String callId(int iteration, ContentType type) {
            return session.getSessionId() + "-" + iteration + "-" + type.wireName();
        }

        private long averageAgeDays(List<ResultRecord> records) {
            LocalDate today = LocalDate.now(clock);
            return Math.round(records.stream()
                    .map(ResultRecord::getDate)
                    .filter(d -> d != null)
                    .mapToLong(d -> ChronoUnit.DAYS.between(d, today))
                    .average()
                    .orElse(-1));
        }
    }

    private String toolName(ContentType type) {
        return type == ContentType.BILL ? props.getBillTool() : props.getExecutiveActionTool();
    }

    private static String label(ContentType type) {
        return type == ContentType.BILL ? "bills" : "executive actions";
    }

    private static List<ContentType> resolveContentTypes(List<ContentType> requested) {
        if (requested == null || requested.isEmpty()) {
            return List.of(ContentType.BILL, ContentType.EXECUTIVE_ACTION);
        }
        return List.copyOf(new LinkedHashSet<>(requested));
    }

    private static Map<String, Object> describeArguments(SearchToolRequest request) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("query", request.query());
        args.put("searchType", request.searchType());
        Map<String, Object> filters = request.filters().forContentType(request.contentType());
        if (!filters.isEmpty()) args.put("filters", filters);
        args.put("limit", request.limit());
        args.put("iteration", request.iteration());
        return args;
    }

    /** Cancellation or time budget observed at a checkpoint. */
    private static final class LoopInterrupted extends RuntimeException {
        private final CompletionReason reason;

        LoopInterrupted(CompletionReason reason) {
            super(reason.wireName(), null, false, false);
            this.reason = reason;
        }
    }

    /** Both attempts of a tool call failed. */
    private static final class ToolFailure extends RuntimeException {
        private final BillBotException failure;

        ToolFailure(BillBotException failure) {
            super(failure.getMessage(), failure, false, false);
            this.failure = failure;
        }
    }
}
