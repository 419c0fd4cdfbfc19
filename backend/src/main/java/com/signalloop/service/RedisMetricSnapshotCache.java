package com.signalloop.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.signalloop.config.SignalLoopProperties;
import com.signalloop.model.CachedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Redis-backed dedupe cache. While Redis is unreachable, reads and writes go
 * to the in-process cache and Redis is retried after a short back-off.
 */
@Service
@Primary
@ConditionalOnProperty(
        prefix = "signalloop.cache",
        name = "mode",
        havingValue = "redis"
)
public class RedisMetricSnapshotCache implements MetricSnapshotCache {

    private static final Logger log = LoggerFactory.getLogger(RedisMetricSnapshotCache.class);
    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private static final Duration REDIS_FAILURE_BACKOFF = Duration.ofSeconds(5);

    private final StringRedisTemplate stringRedisTemplate;
    private final SignalLoopProperties properties;
    private final InMemoryMetricSnapshotCache fallbackCache;

    private volatile boolean fallbackMode;
    private volatile long redisRetryNotBeforeNanos;

    public RedisMetricSnapshotCache(
            StringRedisTemplate stringRedisTemplate,
            SignalLoopProperties properties,
            InMemoryMetricSnapshotCache fallbackCache) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.properties = properties;
        this.fallbackCache = fallbackCache;
    }

    @Override
    public Optional<CachedMetrics> get(String postId, OffsetDateTime now) {
        if (!shouldAttemptRedis()) {
            return fallbackCache.get(postId, now);
        }
        try {
            String payload = stringRedisTemplate.opsForValue().get(resolveKey(postId, now));
            markRedisHealthy();
            if (payload == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(deserialize(payload));
        } catch (RuntimeException ex) {
            markRedisFailure(ex);
            return fallbackCache.get(postId, now);
        }
    }

    @Override
    public void put(CachedMetrics entry, OffsetDateTime now) {
        if (!shouldAttemptRedis()) {
            fallbackCache.put(entry, now);
            return;
        }
        Duration ttl = MetricSnapshotCache.remainingInHour(
                now, Duration.ofSeconds(properties.getCache().getTtlSeconds()));
        try {
            stringRedisTemplate.opsForValue().set(resolveKey(entry.postId(), now), serialize(entry), ttl);
            markRedisHealthy();
        } catch (RuntimeException ex) {
            markRedisFailure(ex);
            fallbackCache.put(entry, now);
        }
    }

    String resolveKey(String postId, OffsetDateTime now) {
        String prefix = properties.getCache().getKeyPrefix();
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalStateException("signalloop.cache.key-prefix must not be blank");
        }
        return prefix.trim() + ":" + postId + ":" + MetricSnapshotCache.hourBucket(now);
    }

    private String serialize(CachedMetrics entry) {
        try {
            return OBJECT_MAPPER.writeValueAsString(entry);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize cached metrics payload", ex);
        }
    }

    private CachedMetrics deserialize(String payload) {
        try {
            return OBJECT_MAPPER.readValue(payload, CachedMetrics.class);
        } catch (JsonProcessingException ex) {
            log.warn("Discarding unreadable cached metrics payload: {}", ex.getOriginalMessage());
            return null;
        }
    }

    private boolean shouldAttemptRedis() {
        return System.nanoTime() >= redisRetryNotBeforeNanos;
    }

    private void markRedisFailure(RuntimeException ex) {
        redisRetryNotBeforeNanos = System.nanoTime() + REDIS_FAILURE_BACKOFF.toNanos();
        if (!fallbackMode) {
            fallbackMode = true;
            log.warn("Redis metrics cache is unavailable ({}); using in-memory cache", resolveSafeMessage(ex));
        }
    }

    private void markRedisHealthy() {
        if (fallbackMode) {
            log.info("Redis metrics cache connection restored");
        }
        fallbackMode = false;
        redisRetryNotBeforeNanos = 0L;
    }

    private String resolveSafeMessage(RuntimeException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }
}
