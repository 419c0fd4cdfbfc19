package com.signalloop.service;

import com.signalloop.config.SignalLoopProperties;
import com.signalloop.model.CachedMetrics;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local dedupe cache. Also the fallback while Redis is unreachable.
 */
@Service
public class InMemoryMetricSnapshotCache implements MetricSnapshotCache {

    private final SignalLoopProperties properties;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public InMemoryMetricSnapshotCache(SignalLoopProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<CachedMetrics> get(String postId, OffsetDateTime now) {
        String key = key(postId, now);
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!now.isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void put(CachedMetrics entry, OffsetDateTime now) {
        Duration ttl = MetricSnapshotCache.remainingInHour(now, Duration.ofSeconds(properties.getCache().getTtlSeconds()));
        entries.put(key(entry.postId(), now), new Entry(entry, now.plus(ttl)));
        evictExpired(now);
    }

    int size() {
        return entries.size();
    }

    private void evictExpired(OffsetDateTime now) {
        entries.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt()));
    }

    private static String key(String postId, OffsetDateTime now) {
        return postId + ":" + MetricSnapshotCache.hourBucket(now);
    }

    private record Entry(CachedMetrics value, OffsetDateTime expiresAt) {
    }
}
