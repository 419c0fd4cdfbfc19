package com.signalloop.service;

import com.signalloop.model.CachedMetrics;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Advisory dedupe cache keyed by (post, UTC hour). Implementations never throw
 * on backend failure; a miss is always an acceptable answer.
 */
public interface MetricSnapshotCache {

    DateTimeFormatter HOUR_BUCKET = DateTimeFormatter.ofPattern("yyyyMMddHH");

    Optional<CachedMetrics> get(String postId, OffsetDateTime now);

    void put(CachedMetrics entry, OffsetDateTime now);

    static String hourBucket(OffsetDateTime now) {
        return now.withOffsetSameInstant(ZoneOffset.UTC).format(HOUR_BUCKET);
    }

    /**
     * Time left in the current UTC hour, capped by {@code maxTtl} and never
     * below one second.
     */
    static Duration remainingInHour(OffsetDateTime now, Duration maxTtl) {
        OffsetDateTime utc = now.withOffsetSameInstant(ZoneOffset.UTC);
        OffsetDateTime nextHour = utc.truncatedTo(ChronoUnit.HOURS).plusHours(1);
        Duration remaining = Duration.between(utc, nextHour);
        if (maxTtl != null && remaining.compareTo(maxTtl) > 0) {
            remaining = maxTtl;
        }
        return remaining.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1) : remaining;
    }
}
