package com.deepansh.billbot.llm;

import com.deepansh.billbot.exception.AnswerGenerationException;
import com.deepansh.billbot.model.Citation;
import com.deepansh.billbot.model.ContentType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * OpenAI-compatible streaming chat completion client.
 *
 * Sends the user's question plus the accumulated citations as numbered context
 * and relays every {@code choices[0].delta.content} chunk of the SSE response.
 *
 * Error handling:
 *
 * | Error         | Action                                                  |
 * |---------------|---------------------------------------------------------|
 * | 401 / 403     | AnswerGenerationException (configuration problem)       |
 * | other 4xx     | AnswerGenerationException with the provider's body      |
 * | 5xx / network | AnswerGenerationException, counted by the circuit breaker |
 */
@Component("openAiAnswerGenerator")
@Slf4j
public class OpenAiAnswerGenerator implements AnswerGenerator {

    private static final String DATA_PREFIX = "data:";
    private static final String DONE = "[DONE]";

    private static final String SYSTEM_PROMPT = """
            You are Bill Bot, an assistant that helps users explore U.S. congressional bills \
            and presidential executive actions.

            Answer the user's question using only the numbered sources provided.
            Guidelines:
            - Cite sources inline as [n] using their numbers
            - Mention bill numbers, sponsors, status and executive order numbers where relevant
            - Say clearly when the sources do not answer the question
            - Be concise and factual
            """;

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public OpenAiAnswerGenerator(LlmProviderProperties props,
                                 ObjectMapper objectMapper,
                                 @Qualifier("llmRestClientBuilder") RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder.clone()
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .build();
    }

    @Override
    public boolean isEnabled() {
        return props.isConfigured();
    }

    @Override
    public void streamAnswer(AnswerRequest request, Consumer<String> onChunk) {
        if (!isEnabled()) {
            throw new AnswerGenerationException("Text generation is not configured (llm.api-key is empty)");
        }

        Map<String, Object> body = buildRequestBody(request);
        log.debug("Requesting streamed answer [model={}, citations={}]",
                body.get("model"), request.citations().size());

        try {
            restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .body(body)
                    .exchange((req, res) -> {
                        int status = res.getStatusCode().value();
                        if (status >= 400) {
                            String error = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                            log.error("Text generation failed [{}]: {}", status, error);
                            if (status == 401 || status == 403) {
                                throw new AnswerGenerationException(
                                        "Text generation API key was rejected. Check the LLM_API_KEY environment variable.");
                            }
                            throw new AnswerGenerationException("Text generation failed [" + status + "]: " + error);
                        }
                        relay(new BufferedReader(new InputStreamReader(res.getBody(), StandardCharsets.UTF_8)),
                                request, onChunk);
                        return null;
                    });
        } catch (RestClientException e) {
            throw new AnswerGenerationException("Text generation request failed: " + e.getMessage(), e);
        }
    }

    private void relay(BufferedReader reader, AnswerRequest request, Consumer<String> onChunk) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (request.cancelled().getAsBoolean()) {
                log.debug("Answer generation cancelled mid-stream");
                return;
            }
            if (!line.startsWith(DATA_PREFIX)) continue;

            String payload = line.substring(DATA_PREFIX.length()).trim();
            if (payload.isEmpty()) continue;
            if (DONE.equals(payload)) return;

            String chunk = extractDelta(payload);
            if (chunk != null && !chunk.isEmpty()) {
                onChunk.accept(chunk);
            }
        }
    }

    private String extractDelta(String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node.has("error")) {
                throw new AnswerGenerationException("Text generation stream error: "
                        + node.path("error").path("message").asText(node.path("error").toString()));
            }
            JsonNode content = node.path("choices").path(0).path("delta").path("content");
            return content.isTextual() ? content.asText() : null;
        } catch (JsonProcessingException e) {
            log.debug("Skipping unparseable stream chunk: {}", payload);
            return null;
        }
    }

    private Map<String, Object> buildRequestBody(AnswerRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", request.model() != null ? request.model() : props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", request.temperature() != null ? request.temperature() : props.getTemperature());
        body.put("stream", true);
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", buildUserMessage(request))));
        return body;
    }

    String buildUserMessage(AnswerRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("Question: ").append(request.query()).append("\n\nSources:\n");
        int n = 1;
        for (Citation c : request.citations()) {
            sb.append('[').append(n++).append("] ");
            if (c.getType() == ContentType.BILL && c.getBillNumber() != null) {
                sb.append(c.getBillNumber()).append(" - ");
            } else if (c.getExecutiveOrderNumber() != null) {
                sb.append("Executive Order ").append(c.getExecutiveOrderNumber()).append(" - ");
            }
            sb.append(c.getTitle());
            if (c.getSponsor() != null) sb.append(" (sponsor: ").append(c.getSponsor()).append(')');
            if (c.getStatus() != null) sb.append(" [status: ").append(c.getStatus()).append(']');
            sb.append('\n');
            if (c.getExcerpt() != null && !c.getExcerpt().isBlank()) {
                sb.append("    ").append(c.getExcerpt()).append('\n');
            }
            sb.append("    ").append(c.getUrl()).append('\n');
        }
        return sb.toString();
    }
}
