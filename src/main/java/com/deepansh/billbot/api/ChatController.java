package com.deepansh.billbot.api;

import com.deepansh.billbot.llm.AnswerGenerator;
import com.deepansh.billbot.model.ChatRequest;
import com.deepansh.billbot.model.StopRequest;
import com.deepansh.billbot.model.StopResult;
import com.deepansh.billbot.model.StreamEvent;
import com.deepansh.billbot.session.SearchSessionService;
import com.deepansh.billbot.streaming.EventChannel;
import com.deepansh.billbot.streaming.EventStreamMultiplexer;
import com.deepansh.billbot.tool.ToolDescriptor;
import com.deepansh.billbot.tool.ToolRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Chat endpoints.
 *
 * POST /api/v1/chat/stream                  start a search, stream its events (SSE)
 * POST /api/v1/chat/stop                    cancel a running search
 * GET  /api/v1/chat/status/{sessionId}      whether a session is still running
 * GET  /api/v1/chat/connection/{connectionId}
 * GET  /api/v1/chat/tools                   enriched tool catalog
 * GET  /api/v1/chat/health
 */
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final SearchSessionService sessionService;
    private final EventStreamMultiplexer multiplexer;
    private final ToolRegistry toolRegistry;
    private final AnswerGenerator answerGenerator;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    @PostMapping("/stream")
    public Flux<ServerSentEvent<StreamEvent>> stream(@Valid @RequestBody ChatRequest request) {
        String sessionId = orGenerate(request.getSessionId(), "session-");
        String connectionId = orGenerate(request.getConnectionId(), "conn-");

        log.info("Chat stream request [sessionId={}, connectionId={}, message='{}']",
                sessionId, connectionId, request.getMessage());

        // a rejected request must leave an already open stream with this id untouched
        EventChannel channel = multiplexer.create(connectionId);
        try {
            sessionService.startSession(request.getMessage(), sessionId, channel, request.getOptions());
        } catch (RuntimeException e) {
            channel.close();
            throw e;
        }
        multiplexer.attach(channel);
        return channel.asFlux();
    }

    @PostMapping("/stop")
    public ResponseEntity<StopResult> stop(@Valid @RequestBody StopRequest request) {
        log.info("Stop request [sessionId={}, connectionId={}, closeConnection={}]",
                request.getSessionId(), request.getConnectionId(), request.isCloseConnection());
        return ResponseEntity.ok(sessionService.stopSession(
                request.getSessionId(), request.getConnectionId(), request.isCloseConnection()));
    }

    @GetMapping("/status/{sessionId}")
    public ResponseEntity<Map<String, Object>> status(@PathVariable String sessionId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", sessionId);
        body.put("isActive", sessionService.isActive(sessionId));
        body.put("activeSessions", sessionService.activeSessionCount());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/connection/{connectionId}")
    public ResponseEntity<Map<String, Object>> connection(@PathVariable String connectionId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("connectionId", connectionId);
        body.put("isActive", multiplexer.isActive(connectionId));
        body.put("stats", multiplexer.stats());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/tools")
    public ResponseEntity<Map<String, Object>> tools() {
        List<ToolDescriptor> tools = toolRegistry.listTools();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tools", tools);
        body.put("count", tools.size());
        body.put("context", toolRegistry.contextSnapshot());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("worker", toolRegistry.healthCheck());
        body.put("answerGenerator", Map.of(
                "enabled", answerGenerator.isEnabled(),
                "circuit", circuitBreakerRegistry.circuitBreaker("answerGenerator").getState().name()));
        body.put("activeSessions", sessionService.activeSessionCount());
        body.put("activeConnections", multiplexer.activeCount());
        return ResponseEntity.ok(body);
    }

    private static String orGenerate(String provided, String prefix) {
        return provided != null && !provided.isBlank() ? provided : prefix + UUID.randomUUID();
    }
}
