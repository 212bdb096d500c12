package com.deepansh.billbot.resilience;

import com.deepansh.billbot.exception.AnswerGenerationException;
import com.deepansh.billbot.llm.AnswerGenerator;
import com.deepansh.billbot.llm.AnswerRequest;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Decorator around the raw answer generator that adds a circuit breaker.
 *
 * No retry: chunks may already have reached the client, so a second attempt
 * would duplicate text. A failure surfaces as a recoverable error event and the
 * session still ends normally.
 *
 * Circuit breaker config (application.yml, instance "answerGenerator"):
 * - Opens after 50% failures in a sliding window of 10 calls
 * - Waits 30s before allowing trial calls (half-open state)
 */
@Component
@Primary
@Slf4j
public class ResilientAnswerGenerator implements AnswerGenerator {

    private final AnswerGenerator delegate;

    public ResilientAnswerGenerator(@Qualifier("openAiAnswerGenerator") AnswerGenerator delegate) {
        this.delegate = delegate;
    }

    @Override
    @CircuitBreaker(name = "answerGenerator", fallbackMethod = "circuitBreakerFallback")
    public void streamAnswer(AnswerRequest request, Consumer<String> onChunk) {
        delegate.streamAnswer(request, onChunk);
    }

    @Override
    public boolean isEnabled() {
        return delegate.isEnabled();
    }

    /**
     * Invoked for failures and for calls rejected while the circuit is open.
     */
    public void circuitBreakerFallback(AnswerRequest request, Consumer<String> onChunk, Exception ex) {
        if (ex instanceof AnswerGenerationException age) {
            log.warn("Answer generation failed: {}", age.getMessage());
            throw age;
        }
        log.error("Answer generation circuit breaker is OPEN or call failed: {}", ex.getMessage());
        throw new AnswerGenerationException(
                "The answer service is currently unavailable. Citations above are still valid.", ex);
    }
}
