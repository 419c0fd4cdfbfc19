package com.signalloop.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One observation of a post's engagement. Counters stay null when the scraper
 * could not read them.
 */
@Getter
@Setter
@Entity
@Table(name = "metric_snapshots")
public class MetricSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "post_id", nullable = false, length = 64)
    private String postId;

    @Enumerated(EnumType.STRING)
    @Column(name = "collection_phase", nullable = false, length = 32)
    private CollectionPhase collectionPhase;

    @Column(name = "collected_at", nullable = false)
    private OffsetDateTime collectedAt;

    private Long likes;

    private Long retweets;

    @Column(name = "quote_tweets")
    private Long quoteTweets;

    private Long replies;

    private Long bookmarks;

    private Long views;

    @Column(name = "profile_clicks")
    private Long profileClicks;

    @Column(name = "engagement_rate", nullable = false)
    private Double engagementRate = 0.0;

    @Column(nullable = false)
    private Double confidence = 0.0;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private List<String> anomalies = new ArrayList<>();

    @Column(name = "is_verified", nullable = false)
    private boolean verified;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    /**
     * (likes + retweets + replies) / max(1, views); unknown counters count as zero.
     */
    public static double computeEngagementRate(Long likes, Long retweets, Long replies, Long views) {
        long engagement = valueOrZero(likes) + valueOrZero(retweets) + valueOrZero(replies);
        long denominator = Math.max(1L, valueOrZero(views));
        return (double) engagement / denominator;
    }

    public long totalEngagement() {
        return valueOrZero(likes) + valueOrZero(retweets) + valueOrZero(replies);
    }

    private static long valueOrZero(Long value) {
        return value == null ? 0L : value;
    }
}
