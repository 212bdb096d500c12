package com.deepansh.billbot.tool;

import com.deepansh.billbot.config.SearchProperties;
import com.deepansh.billbot.config.ToolProperties;
import com.deepansh.billbot.llm.AnswerGenerator;
import com.deepansh.billbot.model.Citation;
import com.deepansh.billbot.model.CompletionReason;
import com.deepansh.billbot.model.ContentType;
import com.deepansh.billbot.model.EventType;
import com.deepansh.billbot.model.SearchOptions;
import com.deepansh.billbot.model.StreamEvent;
import com.deepansh.billbot.model.ToolCallStatus;
import com.deepansh.billbot.model.payload.EndPayload;
import com.deepansh.billbot.model.payload.ErrorPayload;
import com.deepansh.billbot.model.payload.ToolCallPayload;
import com.deepansh.billbot.search.CitationNormalizer;
import com.deepansh.billbot.search.SearchLoop;
import com.deepansh.billbot.session.SearchSession;
import com.deepansh.billbot.streaming.RecordingEventSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Search loop, tool registry and stdio connection wired together over an
 * in-memory worker that dies mid-session.
 */
class WorkerCrashRecoveryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Deque<FakeWorkerProcess> queued = new ArrayDeque<>();
    private final List<FakeWorkerProcess> launched = new CopyOnWriteArrayList<>();

    private ScheduledExecutorService scheduler;
    private StdioToolConnection connection;
    private SearchLoop loop;
    private RecordingEventSink sink;

    @BeforeEach
    void setUp() {
        ToolProperties.Worker workerProps = new ToolProperties.Worker();
        workerProps.setCallTimeout(Duration.ofSeconds(2));
        workerProps.setStartupTimeout(Duration.ofMillis(500));
        workerProps.setRestartBackoff(Duration.ofMillis(50));
        workerProps.setStableUptime(Duration.ofSeconds(30));
        workerProps.setShutdownGrace(Duration.ofMillis(200));
        workerProps.setDesyncThreshold(3);

        scheduler = Executors.newScheduledThreadPool(2);
        CircuitBreaker breaker = CircuitBreaker.of("toolWorker", CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(3)
                .minimumNumberOfCalls(3)
                .failureRateThreshold(100)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .build());

        WorkerLauncher launcher = () -> {
            FakeWorkerProcess worker = queued.isEmpty() ? searchWorker() : queued.poll();
            launched.add(worker);
            return worker;
        };
        connection = new StdioToolConnection(launcher, workerProps, objectMapper, scheduler, breaker);
        ToolRegistry registry = new ToolRegistry(connection, mock(ContextCache.class), new ToolProperties(), objectMapper);

        SearchProperties searchProps = new SearchProperties();
        searchProps.setCancellationPollInterval(Duration.ofMillis(10));
        searchProps.setTimeBudget(Duration.ofSeconds(10));
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
        // a mock generator reports itself disabled, so no answer is streamed
        loop = new SearchLoop(registry, new CitationNormalizer(clock), mock(AnswerGenerator.class), searchProps, clock);
        sink = new RecordingEventSink("conn-1");
    }

    @AfterEach
    void tearDown() {
        connection.close();
        scheduler.shutdownNow();
    }

    @Test
    void workerDiesDuringSearch_retryReachesRestartedWorkerAndSessionCompletes() {
        FakeWorkerProcess crashing = searchWorker().crashOn("search_bills");
        FakeWorkerProcess replacement = searchWorker();
        queued.add(crashing);
        queued.add(replacement);
        connection.start();

        CompletionReason reason = loop.run(session(), billsOnly(), sink);

        assertThat(reason).isEqualTo(CompletionReason.NO_NEW_RESULTS);
        List<ToolCallPayload> toolCalls = sink.payloads(EventType.TOOL_CALL);
        assertThat(toolCalls).extracting(ToolCallPayload::getStatus).contains(ToolCallStatus.RETRYING);
        assertThat(sink.<Citation>payloads(EventType.CITATION)).extracting(Citation::getId).containsExactly("bill:hr-1");
        assertThat(sink.payloads(EventType.ERROR)).isEmpty();
        EndPayload end = sink.last(EventType.END);
        assertThat(end.status()).isEqualTo("completed");

        assertThat(launched).hasSize(2);
        assertThat(crashing.callsTo("search_bills")).isEqualTo(1);
        assertThat(replacement.callsTo("search_bills")).isEqualTo(2);
        assertThat(connection.state()).isEqualTo(WorkerState.READY);
        assertWellFormed();
    }

    @Test
    void workerDiesOnRetryToo_endsWithRecoverableToolFailure() {
        queued.add(searchWorker().crashOn("search_bills"));
        queued.add(searchWorker().crashOn("search_bills"));
        connection.start();

        CompletionReason reason = loop.run(session(), billsOnly(), sink);

        assertThat(reason).isEqualTo(CompletionReason.TOOL_FAILURE);
        assertThat(sink.payloads(EventType.CITATION)).isEmpty();
        ErrorPayload error = sink.last(EventType.ERROR);
        assertThat(error.code()).isEqualTo("PROCESS_DIED");
        assertThat(error.recoverable()).isTrue();
        EndPayload end = sink.last(EventType.END);
        assertThat(end.status()).isEqualTo("error");
        assertThat(end.completionReason()).isEqualTo(CompletionReason.TOOL_FAILURE);
        assertWellFormed();
    }

    private void assertWellFormed() {
        List<StreamEvent> events = sink.events();
        assertThat(events).extracting(StreamEvent::sequence).isSorted().doesNotHaveDuplicates();
        assertThat(events.get(0).type()).isEqualTo(EventType.START);
        assertThat(events.get(events.size() - 1).type()).isEqualTo(EventType.END);
    }

    private static SearchOptions billsOnly() {
        SearchOptions options = SearchOptions.defaults();
        options.setContentTypes(List.of(ContentType.BILL));
        return options;
    }

    private static SearchSession session() {
        return new SearchSession("s-1", "conn-1", "msg-1", "clean water", Instant.parse("2024-06-01T00:00:00Z"));
    }

    private static FakeWorkerProcess searchWorker() {
        return new FakeWorkerProcess()
                .tool("search_bills", args -> Map.of("results", List.of(
                        Map.of("id", "hr-1", "title", "Clean Water Act", "relevanceScore", 0.9))))
                .tool("get_available_statuses", args -> "introduced, passed");
    }
}
