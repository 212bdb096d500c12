package com.deepansh.billbot.config;

import com.deepansh.billbot.tool.ProcessWorkerLauncher;
import com.deepansh.billbot.tool.StdioToolConnection;
import com.deepansh.billbot.tool.ToolConnection;
import com.deepansh.billbot.tool.WorkerLauncher;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the tool worker connection.
 *
 * The restart breaker is the "toolWorker" Resilience4j instance configured in
 * application.yml; the scheduler drives call timeouts, restart backoff and the
 * stable-uptime check.
 */
@Configuration
@Slf4j
public class ToolConnectionConfig {

    public static final String RESTART_BREAKER = "toolWorker";

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService toolScheduler() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "tool-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public WorkerLauncher workerLauncher(ToolProperties toolProperties) {
        return new ProcessWorkerLauncher(toolProperties.getWorker());
    }

    @Bean(destroyMethod = "close")
    public ToolConnection toolConnection(WorkerLauncher workerLauncher,
                                         ToolProperties toolProperties,
                                         ObjectMapper objectMapper,
                                         ScheduledExecutorService toolScheduler,
                                         CircuitBreakerRegistry circuitBreakerRegistry) {
        log.info("Tool worker command: {}", toolProperties.getWorker().getCommandTokens());
        return new StdioToolConnection(
                workerLauncher,
                toolProperties.getWorker(),
                objectMapper,
                toolScheduler,
                circuitBreakerRegistry.circuitBreaker(RESTART_BREAKER));
    }
}
