package com.deepansh.billbot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Dedicated thread pool for search sessions.
 *
 * Isolated from the web thread pool: a session occupies its thread for the whole
 * loop, mostly waiting on tool calls. A full pool rejects new sessions instead of
 * queueing them behind long-running ones.
 */
@Configuration
public class AsyncConfig {

    @Value("${search.executor.core-size:4}")
    private int coreSize;

    @Value("${search.executor.max-size:16}")
    private int maxSize;

    @Value("${search.executor.queue-capacity:32}")
    private int queueCapacity;

    @Bean(name = "searchTaskExecutor")
    public ThreadPoolTaskExecutor searchTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("search-session-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
