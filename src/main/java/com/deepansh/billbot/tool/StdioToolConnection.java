package com.deepansh.billbot.tool;

import com.deepansh.billbot.config.ToolProperties;
import com.deepansh.billbot.exception.BillBotException;
import com.deepansh.billbot.exception.ProtocolException;
import com.deepansh.billbot.exception.ToolCallException;
import com.deepansh.billbot.exception.ToolTimeoutException;
import com.deepansh.billbot.exception.WorkerDiedException;
import com.deepansh.billbot.exception.WorkerUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Line-delimited JSON-RPC 2.0 over a child process's stdin/stdout.
 *
 * Per worker generation:
 * - one reader thread for stdout (responses), one for stderr (logged, never parsed)
 * - a pending-call table keyed by correlation id
 * - an exit hook that fails every pending call with {@link WorkerDiedException}
 *   and schedules a restart after the configured backoff
 *
 * Restart storms are bounded by a Resilience4j circuit breaker: each start attempt
 * takes a permission, a failed handshake or an exit before {@code stable-uptime}
 * records an error, and surviving {@code stable-uptime} records a success.
 * While the breaker is open calls fail fast and no start is attempted.
 *
 * Correlation ids come from one {@link AtomicLong} shared by all callers and all
 * worker generations, so an id is never reused.
 */
@Slf4j
public class StdioToolConnection implements ToolConnection {

    private static final String JSONRPC = "2.0";
    private static final int LOG_LINE_LIMIT = 200;

    private final WorkerLauncher launcher;
    private final ToolProperties.Worker props;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;
    private final CircuitBreaker restartBreaker;

    private final AtomicLong nextId = new AtomicLong(1);
    private final AtomicInteger generations = new AtomicInteger();
    private final Object lifecycleLock = new Object();

    private volatile WorkerState state = WorkerState.STOPPED;
    private volatile Worker current;
    private volatile CompletableFuture<Void> ready = new CompletableFuture<>();
    private volatile List<ToolDescriptor> catalog = List.of();
    private volatile boolean closed;
    private ScheduledFuture<?> scheduledRestart;

    public StdioToolConnection(WorkerLauncher launcher,
                               ToolProperties.Worker props,
                               ObjectMapper objectMapper,
                               ScheduledExecutorService scheduler,
                               CircuitBreaker restartBreaker) {
        this.launcher = launcher;
        this.props = props;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.restartBreaker = restartBreaker;
    }

    // ─── Lifecycle ────────────────────────────────────────────────────────────

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (closed) {
                throw new WorkerUnavailableException("Tool connection is closed");
            }
            if (state == WorkerState.READY && current != null && current.process.isAlive()) {
                return;
            }
            if (!restartBreaker.tryAcquirePermission()) {
                openCircuit();
                throw new WorkerUnavailableException("Tool worker restarts are suspended after repeated failures");
            }
            try {
                launchAndHandshake(WorkerState.STARTING);
            } catch (WorkerUnavailableException e) {
                state = WorkerState.STOPPED;
                failReadyGate(e);
                throw e;
            }
        }
    }

    @Override
    public void ensureStarted() {
        switch (state) {
            case READY, STARTING, RESTARTING -> { }
            case CIRCUIT_OPEN -> throw new WorkerUnavailableException(
                    "Tool worker is unavailable (restart circuit open)");
            case STOPPED -> start();
        }
    }

    /**
     * Stops the worker: SIGTERM, then a forced kill once the grace period runs out.
     * Pending calls fail with {@link WorkerDiedException}. Idempotent.
     */
    @Override
    public void close() {
        Worker worker;
        synchronized (lifecycleLock) {
            if (closed) return;
            closed = true;
            if (scheduledRestart != null) scheduledRestart.cancel(false);
            worker = current;
            current = null;
            state = WorkerState.STOPPED;
            if (worker != null && !worker.stable) {
                restartBreaker.releasePermission();
            }
        }
        ready.completeExceptionally(new WorkerUnavailableException("Tool connection is closed"));
        if (worker == null) return;

        worker.failAll("Tool worker was shut down");
        worker.process.destroy();
        try {
            worker.process.onExit().get(props.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS);
            log.info("Tool worker stopped [pid={}]", worker.process.pid());
        } catch (TimeoutException e) {
            log.warn("Tool worker ignored SIGTERM for {}ms, killing [pid={}]",
                    props.getShutdownGrace().toMillis(), worker.process.pid());
            worker.process.destroyForcibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.process.destroyForcibly();
        } catch (ExecutionException e) {
            log.warn("Error waiting for tool worker exit: {}", e.getMessage());
            worker.process.destroyForcibly();
        }
    }

    /** Caller holds {@link #lifecycleLock}. */
    private void launchAndHandshake(WorkerState startingState) {
        state = startingState;
        long startedNanos = System.nanoTime();

        WorkerProcess process;
        try {
            process = launcher.launch();
        } catch (IOException e) {
            restartBreaker.onError(System.nanoTime() - startedNanos, TimeUnit.NANOSECONDS, e);
            throw new WorkerUnavailableException("Failed to launch tool worker", e);
        }

        Worker worker = new Worker(process, generations.incrementAndGet(), startedNanos);
        current = worker;
        worker.startReaders();
        process.onExit().whenComplete((code, err) -> handleExit(worker, code));

        try {
            Duration timeout = props.getStartupTimeout();
            awaitHandshake(request(worker, "initialize", initializeParams(), "initialize"), timeout);
            worker.sendNotification("notifications/initialized");
            JsonNode listed = awaitHandshake(request(worker, "tools/list", objectMapper.createObjectNode(), "tools/list"), timeout);
            catalog = parseCatalog(listed);
        } catch (RuntimeException e) {
            current = null;
            process.destroyForcibly();
            restartBreaker.onError(System.nanoTime() - startedNanos, TimeUnit.NANOSECONDS, e);
            throw e instanceof WorkerUnavailableException wue
                    ? wue
                    : new WorkerUnavailableException("Tool worker handshake failed", e);
        }

        state = WorkerState.READY;
        if (ready.isDone()) {
            ready = CompletableFuture.completedFuture(null);
        } else {
            ready.complete(null);
        }
        log.info("Tool worker ready [pid={}, generation={}, tools={}]",
                process.pid(), worker.generation, catalog.size());

        scheduler.schedule(() -> markStable(worker),
                props.getStableUptime().toMillis(), TimeUnit.MILLISECONDS);
    }

    private JsonNode awaitHandshake(PendingCall call, Duration timeout) {
        try {
            return call.future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.abandon();
            throw new WorkerUnavailableException(
                    "Tool worker did not answer " + call.toolName + " within " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerUnavailableException("Interrupted during tool worker handshake");
        } catch (ExecutionException e) {
            throw new WorkerUnavailableException("Tool worker handshake failed", e.getCause());
        }
    }

    private void markStable(Worker worker) {
        synchronized (lifecycleLock) {
            if (current != worker || worker.stable) return;
            worker.stable = true;
            restartBreaker.onSuccess(System.nanoTime() - worker.startedNanos, TimeUnit.NANOSECONDS);
            log.debug("Tool worker stable [generation={}]", worker.generation);
        }
    }

    private void handleExit(Worker worker, Integer exitCode) {
        worker.failAll("Tool worker exited with code " + exitCode);

        synchronized (lifecycleLock) {
            if (current != worker) {
                // handshake failure or close() already dealt with this generation
                return;
            }
            current = null;
            if (closed) {
                state = WorkerState.STOPPED;
                return;
            }
            log.warn("Tool worker exited unexpectedly [pid={}, code={}, generation={}]",
                    worker.process.pid(), exitCode, worker.generation);
            if (!worker.stable) {
                restartBreaker.onError(System.nanoTime() - worker.startedNanos, TimeUnit.NANOSECONDS,
                        new WorkerDiedException(null, "exited with code " + exitCode));
            }
            if (ready.isDone()) {
                ready = new CompletableFuture<>();
            }
            state = WorkerState.RESTARTING;
            scheduleRestart(props.getRestartBackoff().toMillis());
        }
    }

    /** Caller holds {@link #lifecycleLock}. */
    private void scheduleRestart(long delayMs) {
        scheduledRestart = scheduler.schedule(this::restart, delayMs, TimeUnit.MILLISECONDS);
    }

    private void restart() {
        synchronized (lifecycleLock) {
            if (closed || current != null) return;
            if (!restartBreaker.tryAcquirePermission()) {
                openCircuit();
                return;
            }
            if (ready.isDone()) {
                ready = new CompletableFuture<>();
            }
            log.info("Restarting tool worker");
            try {
                launchAndHandshake(WorkerState.RESTARTING);
            } catch (WorkerUnavailableException e) {
                log.warn("Tool worker restart failed: {}", e.getMessage());
                state = WorkerState.RESTARTING;
                scheduleRestart(props.getRestartBackoff().toMillis());
            }
        }
    }

    /** Caller holds {@link #lifecycleLock}. */
    private void openCircuit() {
        state = WorkerState.CIRCUIT_OPEN;
        failReadyGate(new WorkerUnavailableException("Tool worker restart circuit is open"));
        long cooldownMs = restartBreaker.getCircuitBreakerConfig()
                .getWaitIntervalFunctionInOpenState().apply(1);
        log.error("Tool worker failed repeatedly; suspending restarts for {}ms", cooldownMs);
        scheduleRestart(cooldownMs);
    }

    private void failReadyGate(BillBotException cause) {
        CompletableFuture<Void> gate = ready;
        ready = new CompletableFuture<>();
        gate.completeExceptionally(cause);
    }

    // ─── Calls ────────────────────────────────────────────────────────────────

    @Override
    public CompletableFuture<JsonNode> call(String toolName, Map<String, Object> arguments) {
        return call(toolName, arguments, props.getCallTimeout());
    }

    @Override
    public CompletableFuture<JsonNode> call(String toolName, Map<String, Object> arguments, Duration timeout) {
        if (closed) {
            return CompletableFuture.failedFuture(new WorkerUnavailableException("Tool connection is closed"));
        }
        if (state == WorkerState.CIRCUIT_OPEN) {
            return CompletableFuture.failedFuture(
                    new WorkerUnavailableException("Tool worker is unavailable (restart circuit open)"));
        }
        if (state == WorkerState.STOPPED) {
            try {
                start();
            } catch (BillBotException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        ObjectNode params = objectMapper.createObjectNode();
        params.put("name", toolName);
        params.set("arguments", objectMapper.valueToTree(arguments != null ? arguments : Map.of()));

        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        ScheduledFuture<?> timer = scheduler.schedule(
                () -> result.completeExceptionally(new ToolTimeoutException(toolName, timeout)),
                timeout.toMillis(), TimeUnit.MILLISECONDS);

        // Gate on readiness so calls made during a restart wait for the fresh worker,
        // bounded by this call's own timeout.
        ready.thenCompose(ignored -> {
                    Worker worker = current;
                    if (worker == null) {
                        return CompletableFuture.failedFuture(
                                new WorkerDiedException(toolName, "Tool worker is not running"));
                    }
                    PendingCall call = request(worker, "tools/call", params, toolName);
                    result.whenComplete((v, err) -> {
                        if (err != null) call.abandon();
                    });
                    return call.future;
                })
                .whenComplete((node, err) -> {
                    timer.cancel(false);
                    if (err != null) {
                        result.completeExceptionally(unwrap(err));
                    } else {
                        try {
                            result.complete(decodeToolResult(toolName, node));
                        } catch (BillBotException e) {
                            result.completeExceptionally(e);
                        }
                    }
                });

        return result;
    }

    private PendingCall request(Worker worker, String method, JsonNode params, String label) {
        long id = nextId.getAndIncrement();
        PendingCall call = new PendingCall(id, label, worker);

        ObjectNode message = objectMapper.createObjectNode();
        message.put("jsonrpc", JSONRPC);
        message.put("id", id);
        message.put("method", method);
        message.set("params", params);

        worker.pending.put(id, call);
        try {
            worker.write(objectMapper.writeValueAsString(message));
            log.debug("→ worker [id={}, method={}, tool={}]", id, method, label);
        } catch (IOException e) {
            worker.pending.remove(id);
            call.future.completeExceptionally(
                    new WorkerDiedException(label, "Could not write to tool worker: " + e.getMessage()));
        }
        return call;
    }

    /**
     * tools/call results carry a content array; text items are joined and parsed
     * as JSON when they look like JSON.
     */
    JsonNode decodeToolResult(String toolName, JsonNode result) {
        if (result == null || result.isMissingNode() || result.isNull()) {
            return objectMapper.nullNode();
        }
        JsonNode content = result.path("content");
        if (!content.isArray()) {
            return result;
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode item : content) {
            if ("text".equals(item.path("type").asText()) && item.has("text")) {
                if (text.length() > 0) text.append('\n');
                text.append(item.get("text").asText());
            }
        }

        if (result.path("isError").asBoolean(false)) {
            throw new ToolCallException(toolName, "Tool '" + toolName + "' reported an error: " + text);
        }

        String joined = text.toString().trim();
        if (joined.startsWith("{") || joined.startsWith("[")) {
            try {
                return objectMapper.readTree(joined);
            } catch (JsonProcessingException e) {
                log.debug("Tool [{}] returned JSON-looking text that did not parse, keeping as text", toolName);
            }
        }
        return TextNode.valueOf(joined);
    }

    private static Throwable unwrap(Throwable err) {
        return err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
    }

    private ObjectNode initializeParams() {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("protocolVersion", props.getProtocolVersion());
        params.set("capabilities", objectMapper.createObjectNode());
        ObjectNode clientInfo = params.putObject("clientInfo");
        clientInfo.put("name", props.getClientName());
        clientInfo.put("version", props.getClientVersion());
        return params;
    }

    private List<ToolDescriptor> parseCatalog(JsonNode listed) {
        JsonNode tools = listed.path("tools");
        if (!tools.isArray()) {
            throw new ProtocolException("tools/list response has no tools array");
        }
        List<ToolDescriptor> out = new ArrayList<>();
        tools.forEach(node -> out.add(ToolDescriptor.from(node, objectMapper)));
        return List.copyOf(out);
    }

    // ─── Inbound ──────────────────────────────────────────────────────────────

    private void handleLine(Worker worker, String line) {
        if (line.isBlank()) return;

        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            protocolError(worker, "malformed message", line);
            return;
        }

        JsonNode idNode = message.get("id");
        if (idNode == null || idNode.isNull()) {
            log.debug("← worker notification: {}", message.path("method").asText("?"));
            return;
        }
        if (!idNode.canConvertToLong()) {
            protocolError(worker, "non-numeric id", line);
            return;
        }

        PendingCall call = worker.pending.remove(idNode.asLong());
        if (call == null) {
            protocolError(worker, "response for unknown id " + idNode.asLong(), line);
            return;
        }
        worker.desync.set(0);

        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            call.future.completeExceptionally(new ToolCallException(call.toolName,
                    "Tool '" + call.toolName + "' failed: " + error.path("message").asText(error.toString())));
        } else {
            call.future.complete(message.path("result"));
        }
    }

    private void protocolError(Worker worker, String problem, String line) {
        int count = worker.desync.incrementAndGet();
        log.warn("Dropped worker output ({}) [generation={}, consecutive={}]: {}",
                problem, worker.generation, count, truncate(line));
        if (count >= props.getDesyncThreshold() && worker.process.isAlive()) {
            log.error("Tool worker protocol desync repeated {} times, restarting it", count);
            worker.process.destroyForcibly();
        }
    }

    private static String truncate(String line) {
        return line.length() <= LOG_LINE_LIMIT ? line : line.substring(0, LOG_LINE_LIMIT) + "…";
    }

    @Override
    public List<ToolDescriptor> catalog() {
        return catalog;
    }

    @Override
    public WorkerState state() {
        return state;
    }

    int pendingCount() {
        Worker worker = current;
        return worker == null ? 0 : worker.pending.size();
    }

    // ─── Per-generation state ─────────────────────────────────────────────────

    private final class Worker {

        final WorkerProcess process;
        final int generation;
        final long startedNanos;
        final Map<Long, PendingCall> pending = new ConcurrentHashMap<>();
        final AtomicInteger desync = new AtomicInteger();
        final BufferedWriter writer;
        volatile boolean stable;

        Worker(WorkerProcess process, int generation, long startedNanos) {
            this.process = process;
            this.generation = generation;
            this.startedNanos = startedNanos;
            this.writer = new BufferedWriter(new OutputStreamWriter(process.stdin(), StandardCharsets.UTF_8));
        }

        void startReaders() {
            daemon("tool-worker-out-" + generation, () -> pump(process.stdout(), line -> handleLine(this, line)));
            daemon("tool-worker-err-" + generation, () -> pump(process.stderr(),
                    line -> log.warn("[tool-worker:{}] {}", generation, line)));
        }

        void write(String line) throws IOException {
            synchronized (writer) {
                writer.write(line);
                writer.write('\n');
                writer.flush();
            }
        }

        void sendNotification(String method) {
            ObjectNode message = objectMapper.createObjectNode();
            message.put("jsonrpc", JSONRPC);
            message.put("method", method);
            try {
                write(objectMapper.writeValueAsString(message));
            } catch (IOException e) {
                throw new WorkerUnavailableException("Could not write to tool worker", e);
            }
        }

        void failAll(String reason) {
            for (Long id : List.copyOf(pending.keySet())) {
                PendingCall call = pending.remove(id);
                if (call != null) {
                    call.future.completeExceptionally(new WorkerDiedException(call.toolName, reason));
                }
            }
        }

        private void pump(InputStream stream, Consumer<String> sink) {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.accept(line);
                }
            } catch (IOException e) {
                log.debug("Tool worker stream closed [generation={}]: {}", generation, e.getMessage());
            }
        }

        private void daemon(String name, Runnable body) {
            Thread thread = new Thread(body, name);
            thread.setDaemon(true);
            thread.start();
        }
    }

    private static final class PendingCall {

        final long id;
        final String toolName;
        final Worker worker;
        final CompletableFuture<JsonNode> future = new CompletableFuture<>();

        PendingCall(long id, String toolName, Worker worker) {
            this.id = id;
            this.toolName = toolName;
            this.worker = worker;
        }

        /** Forget the call; a late response for it is then a desync. */
        void abandon() {
            worker.pending.remove(id);
        }
    }
}
