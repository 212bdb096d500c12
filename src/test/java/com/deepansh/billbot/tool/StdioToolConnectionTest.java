package com.deepansh.billbot.tool;

import com.deepansh.billbot.config.ToolProperties;
import com.deepansh.billbot.exception.ToolCallException;
import com.deepansh.billbot.exception.ToolTimeoutException;
import com.deepansh.billbot.exception.WorkerDiedException;
import com.deepansh.billbot.exception.WorkerUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;

class StdioToolConnectionTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Deque<FakeWorkerProcess> queued = new ArrayDeque<>();
    private final List<FakeWorkerProcess> launched = new CopyOnWriteArrayList<>();

    private ToolProperties.Worker props;
    private ScheduledExecutorService scheduler;
    private CircuitBreaker breaker;
    private StdioToolConnection connection;

    @BeforeEach
    void setUp() {
        props = new ToolProperties.Worker();
        props.setCallTimeout(Duration.ofSeconds(2));
        props.setStartupTimeout(Duration.ofMillis(500));
        props.setRestartBackoff(Duration.ofMillis(50));
        props.setStableUptime(Duration.ofSeconds(30));
        props.setShutdownGrace(Duration.ofMillis(200));
        props.setDesyncThreshold(3);

        scheduler = Executors.newScheduledThreadPool(2);
        breaker = CircuitBreaker.of("toolWorker", CircuitBreakerConfig.custom()
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
        connection = new StdioToolConnection(launcher, props, objectMapper, scheduler, breaker);
    }

    @AfterEach
    void tearDown() {
        connection.close();
        scheduler.shutdownNow();
    }

    @Test
    void start_completesHandshakeAndLoadsCatalog() {
        connection.start();

        assertThat(connection.state()).isEqualTo(WorkerState.READY);
        assertThat(connection.catalog()).extracting(ToolDescriptor::getName)
                .containsExactly("get_available_statuses", "search_bills");

        List<JsonNode> received = launched.get(0).received();
        JsonNode initialize = received.get(0);
        assertThat(initialize.path("method").asText()).isEqualTo("initialize");
        assertThat(initialize.path("params").path("protocolVersion").asText()).isEqualTo("2024-11-05");
        assertThat(initialize.path("params").path("clientInfo").path("name").asText()).isEqualTo("bill-bot-backend");
        assertThat(received.get(1).path("method").asText()).isEqualTo("notifications/initialized");
        assertThat(received.get(1).has("id")).isFalse();
        assertThat(received.get(2).path("method").asText()).isEqualTo("tools/list");
    }

    @Test
    void call_jsonTextContent_isParsed() throws Exception {
        JsonNode result = connection.call("search_bills", Map.of("query", "water")).get(2, TimeUnit.SECONDS);

        assertThat(result.path("results").isArray()).isTrue();
        assertThat(result.path("results").get(0).path("id").asText()).isEqualTo("hr-1");
    }

    @Test
    void call_plainTextContent_staysText() throws Exception {
        JsonNode result = connection.call("get_available_statuses", Map.of()).get(2, TimeUnit.SECONDS);

        assertThat(result.isTextual()).isTrue();
        assertThat(result.asText()).isEqualTo("introduced, passed");
    }

    @Test
    void call_correlationIdsAreUniqueAcrossCalls() throws Exception {
        connection.call("search_bills", Map.of("query", "a")).get(2, TimeUnit.SECONDS);
        connection.call("search_bills", Map.of("query", "b")).get(2, TimeUnit.SECONDS);

        List<Long> ids = launched.get(0).received().stream()
                .filter(r -> r.has("id"))
                .map(r -> r.get("id").asLong())
                .toList();
        assertThat(ids).doesNotHaveDuplicates().isSorted();
    }

    @Test
    void call_workerReportsError_failsWithToolCallException() {
        assertThatThrownBy(() -> connection.call("no_such_tool", Map.of()).get(2, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(ToolCallException.class)
                .hasMessageContaining("Unknown tool");
    }

    @Test
    void call_noResponse_timesOutAndForgetsTheCall() {
        queued.add(searchWorker().silent("search_bills"));

        assertThatThrownBy(() -> connection.call("search_bills", Map.of("query", "x"), Duration.ofMillis(150))
                .get(2, TimeUnit.SECONDS))
                .cause()
                .isInstanceOf(ToolTimeoutException.class);

        awaitTrue(() -> connection.pendingCount() == 0);
    }

    @Test
    void call_workerExits_failsInFlightCallAndRestarts() throws Exception {
        queued.add(searchWorker().crashOn("search_bills"));
        queued.add(searchWorker());

        assertThatThrownBy(() -> connection.call("search_bills", Map.of("query", "x")).get(2, TimeUnit.SECONDS))
                .cause()
                .isInstanceOf(WorkerDiedException.class);

        awaitTrue(() -> launched.size() == 2 && connection.state() == WorkerState.READY);

        JsonNode result = connection.call("search_bills", Map.of("query", "x")).get(2, TimeUnit.SECONDS);
        assertThat(result.path("results").size()).isEqualTo(1);
    }

    @Test
    void call_duringRestart_waitsForFreshWorker() throws Exception {
        connection.start();
        launched.get(0).crash(1);

        JsonNode result = connection.call("search_bills", Map.of("query", "x")).get(2, TimeUnit.SECONDS);

        assertThat(result.path("results").size()).isEqualTo(1);
        assertThat(launched).hasSize(2);
    }

    @Test
    void unmatchedAndMalformedLines_areDroppedWithoutBreakingTheConnection() throws Exception {
        connection.start();
        FakeWorkerProcess worker = launched.get(0);

        worker.emit("{\"jsonrpc\":\"2.0\",\"id\":999,\"result\":{}}");
        worker.emit("not json at all");
        worker.logToStderr("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}");

        JsonNode result = connection.call("search_bills", Map.of("query", "x")).get(2, TimeUnit.SECONDS);
        assertThat(result.path("results").size()).isEqualTo(1);
        assertThat(worker.isAlive()).isTrue();
    }

    @Test
    void repeatedDesync_isTreatedAsWorkerFailure() {
        connection.start();
        FakeWorkerProcess first = launched.get(0);

        first.emit("garbage 1");
        first.emit("garbage 2");
        first.emit("garbage 3");

        awaitTrue(() -> !first.isAlive());
        awaitTrue(() -> launched.size() == 2 && connection.state() == WorkerState.READY);
    }

    @Test
    void repeatedFailedStarts_openTheRestartCircuit() {
        for (int i = 0; i < 4; i++) {
            queued.add(searchWorker().withoutHandshake());
        }

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> connection.start()).isInstanceOf(WorkerUnavailableException.class);
        }
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        assertThatThrownBy(() -> connection.start())
                .isInstanceOf(WorkerUnavailableException.class)
                .hasMessageContaining("suspended");
        assertThat(connection.state()).isEqualTo(WorkerState.CIRCUIT_OPEN);
        assertThat(launched).hasSize(3);

        assertThatThrownBy(() -> connection.call("search_bills", Map.of("query", "x")).get(1, TimeUnit.SECONDS))
                .cause()
                .isInstanceOf(WorkerUnavailableException.class);
        assertThatThrownBy(() -> connection.ensureStarted()).isInstanceOf(WorkerUnavailableException.class);
    }

    @Test
    void close_workerIgnoresSigterm_isKilledAfterGrace() throws Exception {
        queued.add(searchWorker().ignoringSigterm());
        connection.start();

        connection.close();

        FakeWorkerProcess worker = launched.get(0);
        assertThat(worker.isAlive()).isFalse();
        assertThat(worker.onExit().get()).isEqualTo(137);
        assertThat(connection.state()).isEqualTo(WorkerState.STOPPED);
        assertThatThrownBy(() -> connection.call("search_bills", Map.of("query", "x")).get(1, TimeUnit.SECONDS))
                .cause()
                .isInstanceOf(WorkerUnavailableException.class);
    }

    private static FakeWorkerProcess searchWorker() {
        return new FakeWorkerProcess()
                .tool("search_bills", args -> Map.of("results", List.of(
                        Map.of("id", "hr-1", "title", "Clean Water Act", "relevanceScore", 0.9))))
                .tool("get_available_statuses", args -> "introduced, passed");
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 3000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) return;
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted");
            }
        }
        fail("condition not met within 3s");
    }
}
