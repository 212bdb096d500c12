package com.deepansh.billbot.tool;

import com.deepansh.billbot.config.ToolProperties;
import com.deepansh.billbot.exception.BillBotException;
import com.deepansh.billbot.exception.ToolCallException;
import com.deepansh.billbot.exception.ValidationException;
import com.deepansh.billbot.model.ContentType;
import com.deepansh.billbot.model.ResultRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Typed facade over the {@link ToolConnection}.
 *
 * The catalog is whatever the current worker advertised at handshake; it is
 * re-indexed whenever a restarted worker reports a new one. Descriptions of the
 * search tools are enriched with currently valid filter values pulled through
 * {@link ContextCache}.
 *
 * Arguments are checked against the tool's declared required fields before
 * dispatch; a tool the worker never advertised is rejected without a round trip.
 */
@Component
@Slf4j
public class ToolRegistry {

    private static final List<ContextKind> BILL_CONTEXT =
            List.of(ContextKind.SPONSORS, ContextKind.STATUSES, ContextKind.TOPICS);
    private static final List<ContextKind> EXECUTIVE_CONTEXT = List.of(ContextKind.ADMINISTRATIONS);

    private final ToolConnection connection;
    private final ContextCache contextCache;
    private final ToolProperties toolProperties;
    private final ObjectMapper objectMapper;

    private final Map<String, ToolDescriptor> tools = new ConcurrentHashMap<>();
    private volatile List<ToolDescriptor> indexedCatalog = List.of();

    public ToolRegistry(ToolConnection connection,
                        ContextCache contextCache,
                        ToolProperties toolProperties,
                        ObjectMapper objectMapper) {
        this.connection = connection;
        this.contextCache = contextCache;
        this.toolProperties = toolProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * Starts the worker once the application is up. A worker that cannot start
     * here is not fatal: sessions retry the start and report the failure themselves.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        try {
            connection.start();
            refreshCatalog();
        } catch (BillBotException e) {
            log.error("Tool worker unavailable at startup: {}", e.getMessage());
        }
    }

    public void refreshCatalog() {
        List<ToolDescriptor> catalog = connection.catalog();
        tools.clear();
        catalog.forEach(tool -> {
            tools.put(tool.getName(), tool);
            log.info("Registered tool: [{}]", tool.getName());
        });
        indexedCatalog = catalog;
        log.info("Total tools registered: {}", tools.size());
    }

    public List<ToolDescriptor> listTools() {
        syncCatalog();
        return tools.values().stream()
                .sorted(Comparator.comparing(ToolDescriptor::getName))
                .map(tool -> describe(tool.getName()).orElse(tool))
                .toList();
    }

    /** The tool's descriptor with its description enriched by current context values. */
    public Optional<ToolDescriptor> describe(String toolName) {
        syncCatalog();
        ToolDescriptor tool = tools.get(toolName);
        if (tool == null) return Optional.empty();

        List<ContextKind> kinds = enrichmentFor(toolName);
        if (kinds.isEmpty() || !toolProperties.getContext().isEnabled()) {
            return Optional.of(tool);
        }

        StringBuilder description = new StringBuilder(tool.getDescription());
        for (ContextKind kind : kinds) {
            List<String> values = contextValues(kind);
            if (!values.isEmpty()) {
                description.append("\nAvailable ").append(kind.key()).append(" (use exact values): ")
                        .append(String.join(", ", values));
            }
        }
        return Optional.of(tool.toBuilder().description(description.toString()).build());
    }

    public boolean hasTool(String name) {
        syncCatalog();
        return tools.containsKey(name);
    }

    public int toolCount() {
        syncCatalog();
        return tools.size();
    }

    /**
     * Makes sure the worker is running or restarting before a session starts.
     * @throws com.deepansh.billbot.exception.WorkerUnavailableException if it cannot be started
     */
    public void ensureReady() {
        connection.ensureStarted();
    }

    public WorkerState workerState() {
        return connection.state();
    }

    /**
     * Dispatches a call after checking the arguments against the tool's schema.
     * Failures arrive through the returned future.
     */
    public CompletableFuture<JsonNode> call(String toolName, Map<String, Object> arguments) {
        syncCatalog();
        ToolDescriptor tool = tools.get(toolName);
        if (tool == null && !tools.isEmpty()) {
            return CompletableFuture.failedFuture(new ToolCallException(toolName,
                    "Unknown tool '" + toolName + "'. Available tools: " + tools.keySet()));
        }
        if (tool != null) {
            for (String required : tool.requiredArguments()) {
                if (arguments == null || arguments.get(required) == null) {
                    return CompletableFuture.failedFuture(new ValidationException(
                            "Tool '" + toolName + "' requires argument '" + required + "'"));
                }
            }
        }

        log.debug("Executing tool: [{}] with args: {}", toolName, arguments);
        return connection.call(toolName, arguments);
    }

    /** Runs one search round against the tool for the request's content type. */
    public CompletableFuture<SearchToolResult> search(String toolName, SearchToolRequest request) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("query", request.query());
        args.put("searchType", request.searchType());
        Map<String, Object> filters = request.filters() != null
                ? request.filters().forContentType(request.contentType())
                : Map.of();
        if (!filters.isEmpty()) {
            args.put("filters", filters);
        }
        args.put("limit", request.limit());
        args.put("iteration", request.iteration());
        if (request.previousResultIds() != null && !request.previousResultIds().isEmpty()) {
            args.put("previousResults", request.previousResultIds());
        }

        return call(toolName, args).thenApply(node -> parseSearchResult(node, request.contentType()));
    }

    /** Checks the worker through its health tool. Never throws. */
    public Map<String, Object> healthCheck() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("state", connection.state().name());
        status.put("tools", toolCount());
        try {
            JsonNode result = connection.call(toolProperties.getWorker().getHealthCheckTool(), Map.of())
                    .get(toolProperties.getWorker().getCallTimeout().toMillis(), TimeUnit.MILLISECONDS);
            status.put("healthy", true);
            status.put("details", objectMapper.convertValue(result, Object.class));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status.put("healthy", false);
        } catch (ExecutionException | TimeoutException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            status.put("healthy", false);
            status.put("error", cause.getMessage());
        }
        return status;
    }

    // ─── Parsing ──────────────────────────────────────────────────────────────

    SearchToolResult parseSearchResult(JsonNode node, ContentType requestedType) {
        JsonNode results = node.isArray() ? node : node.path("results");
        if (!results.isArray()) {
            log.warn("Search tool returned no results array for {}", requestedType.wireName());
            return SearchToolResult.empty();
        }

        List<ResultRecord> records = new ArrayList<>();
        for (JsonNode item : results) {
            String id = text(item, "id");
            if (id == null) {
                log.debug("Skipping search result without id");
                continue;
            }
            ContentType type = requestedType;
            String declared = text(item, "type");
            if (declared != null) {
                try {
                    type = ContentType.fromValue(declared);
                } catch (IllegalArgumentException e) {
                    log.debug("Unknown result type '{}', assuming {}", declared, requestedType.wireName());
                }
            }

            records.add(ResultRecord.builder()
                    .contentId(id)
                    .contentType(type)
                    .title(Optional.ofNullable(text(item, "title")).orElse(""))
                    .summary(Optional.ofNullable(text(item, "summary")).orElse(""))
                    .relevanceScore(score(item))
                    .date(date(item, type))
                    .sourceMetadata(objectMapper.convertValue(item, new TypeReference<Map<String, Object>>() {}))
                    .build());
        }
        return new SearchToolResult(records, node.path("needsRefinement").asBoolean(false));
    }

    private static double score(JsonNode item) {
        for (String field : List.of("relevanceScore", "relevance_score", "similarity", "score")) {
            JsonNode value = item.get(field);
            if (value != null && value.isNumber()) return value.asDouble();
        }
        return 0.0;
    }

    private static LocalDate date(JsonNode item, ContentType type) {
        List<String> fields = type == ContentType.BILL
                ? List.of("introducedDate", "introduced_date", "lastActionDate")
                : List.of("signedDate", "signed_date", "publicationDate");
        for (String field : fields) {
            String raw = text(item, field);
            if (raw != null && raw.length() >= 10) {
                try {
                    return LocalDate.parse(raw.substring(0, 10));
                } catch (DateTimeParseException e) {
                    log.debug("Unparseable date {}={}", field, raw);
                }
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) return null;
        String s = value.asText();
        return s.isBlank() ? null : s;
    }

    // ─── Context enrichment ───────────────────────────────────────────────────

    private List<ContextKind> enrichmentFor(String toolName) {
        if (toolName.contains("executive")) return EXECUTIVE_CONTEXT;
        if (toolName.contains("bills")) return BILL_CONTEXT;
        return List.of();
    }

    private List<String> contextValues(ContextKind kind) {
        Optional<List<String>> cached = contextCache.get(kind);
        if (cached.isPresent()) return cached.get();

        String toolName = kind.toolName(toolProperties.getContext());
        if (!tools.containsKey(toolName)) return List.of();

        Map<String, Object> args = new LinkedHashMap<>();
        if (kind == ContextKind.SPONSORS) args.put("limit", toolProperties.getContext().getSponsorLimit());
        if (kind == ContextKind.TOPICS) args.put("limit", toolProperties.getContext().getTopicLimit());

        try {
            JsonNode result = connection.call(toolName, args)
                    .get(toolProperties.getWorker().getCallTimeout().toMillis(), TimeUnit.MILLISECONDS);
            List<String> values = extractNames(result, kind);
            contextCache.put(kind, values);
            return values;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Context discovery via [{}] failed: {}", toolName,
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return List.of();
        }
    }

    List<String> extractNames(JsonNode result, ContextKind kind) {
        JsonNode items = result;
        if (result.isObject()) {
            items = result.path(kind.key());
            if (!items.isArray()) {
                items = objectMapper.createArrayNode();
                for (JsonNode child : result) {
                    if (child.isArray()) { items = child; break; }
                }
            }
        }

        List<String> names = new ArrayList<>();
        for (JsonNode item : items) {
            if (item.isTextual()) {
                names.add(item.asText());
                continue;
            }
            for (String field : kind.nameFields()) {
                String value = text(item, field);
                if (value != null) { names.add(value); break; }
            }
        }
        return names;
    }

    private void syncCatalog() {
        if (connection.catalog() != indexedCatalog) {
            refreshCatalog();
        }
    }

    /** Current valid filter values per kind, fetched through the cache. */
    public Map<ContextKind, List<String>> contextSnapshot() {
        Map<ContextKind, List<String>> snapshot = new EnumMap<>(ContextKind.class);
        for (ContextKind kind : ContextKind.values()) {
            snapshot.put(kind, contextValues(kind));
        }
        return snapshot;
    }
}
