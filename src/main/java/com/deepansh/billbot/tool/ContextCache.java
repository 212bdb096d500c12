package com.deepansh.billbot.tool;

import com.deepansh.billbot.config.ToolProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed cache of discovered context values (sponsors, statuses, topics,
 * administrations).
 *
 * - Key pattern: billbot:context:{kind}
 * - Stored as a JSON array of strings
 * - Short TTL (tools.context.ttl, 5 minutes by default) so new data in the corpus shows up
 *
 * Redis being unavailable is a cache miss, never a failure: enrichment is advisory.
 */
@Component
@Slf4j
public class ContextCache {

    private static final String KEY_PREFIX = "billbot:context:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final ToolProperties toolProperties;

    public ContextCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, ToolProperties toolProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.toolProperties = toolProperties;
    }

    public Optional<List<String>> get(ContextKind kind) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(buildKey(kind));
        } catch (DataAccessException e) {
            log.warn("Context cache read failed for {}: {}", kind.key(), e.getMessage());
            return Optional.empty();
        }
        if (json == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(json, new TypeReference<List<String>>() {}));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable context cache entry for {}", kind.key());
            return Optional.empty();
        }
    }

    public void put(ContextKind kind, List<String> values) {
        try {
            String json = objectMapper.writeValueAsString(values);
            redisTemplate.opsForValue().set(buildKey(kind), json, toolProperties.getContext().getTtl());
            log.debug("Cached {} {} values (TTL: {})", values.size(), kind.key(), toolProperties.getContext().getTtl());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize context values for {}", kind.key(), e);
        } catch (DataAccessException e) {
            log.warn("Context cache write failed for {}: {}", kind.key(), e.getMessage());
        }
    }

    public void evictAll() {
        try {
            redisTemplate.delete(Arrays.stream(ContextKind.values()).map(this::buildKey).toList());
        } catch (DataAccessException e) {
            log.warn("Context cache eviction failed: {}", e.getMessage());
        }
    }

    private String buildKey(ContextKind kind) {
        return KEY_PREFIX + kind.key();
    }
}
