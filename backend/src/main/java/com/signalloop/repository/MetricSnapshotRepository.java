package com.signalloop.repository;

import com.signalloop.model.CollectionPhase;
import com.signalloop.model.MetricSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface MetricSnapshotRepository extends JpaRepository<MetricSnapshot, Long> {

    Optional<MetricSnapshot> findFirstByPostIdOrderByCollectedAtDesc(String postId);

    Optional<MetricSnapshot> findByPostIdAndCollectionPhase(String postId, CollectionPhase collectionPhase);

    List<MetricSnapshot> findByPostIdOrderByCollectedAtAsc(String postId);

    boolean existsByPostIdAndCollectedAtAfter(String postId, OffsetDateTime collectedAfter);

    /**
     * Mean of likes + retweets + replies across verified snapshots since the
     * given instant. Null when no verified snapshot exists.
     */
    @Query(value = """
            SELECT AVG(COALESCE(likes, 0) + COALESCE(retweets, 0) + COALESCE(replies, 0))
            FROM metric_snapshots
            WHERE is_verified = TRUE
              AND collected_at >= :since
            """, nativeQuery = true)
    Double averageVerifiedEngagementSince(@Param("since") OffsetDateTime since);

    /**
     * One row per (post, phase): a repeated pass for the same stage overwrites
     * the earlier observation.
     */
    @Modifying
    @Query(value = """
            INSERT INTO metric_snapshots (
                post_id, collection_phase, collected_at,
                likes, retweets, quote_tweets, replies, bookmarks, views, profile_clicks,
                engagement_rate, confidence, anomalies, is_verified, metadata,
                created_at, updated_at)
            VALUES (
                :postId, :collectionPhase, :collectedAt,
                :likes, :retweets, :quoteTweets, :replies, :bookmarks, :views, :profileClicks,
                :engagementRate, :confidence, CAST(:anomalies AS jsonb), :verified, CAST(:metadata AS jsonb),
                :collectedAt, :collectedAt)
            ON CONFLICT (post_id, collection_phase) DO UPDATE SET
                collected_at = EXCLUDED.collected_at,
                likes = EXCLUDED.likes,
                retweets = EXCLUDED.retweets,
                quote_tweets = EXCLUDED.quote_tweets,
                replies = EXCLUDED.replies,
                bookmarks = EXCLUDED.bookmarks,
                views = EXCLUDED.views,
                profile_clicks = EXCLUDED.profile_clicks,
                engagement_rate = EXCLUDED.engagement_rate,
                confidence = EXCLUDED.confidence,
                anomalies = EXCLUDED.anomalies,
                is_verified = EXCLUDED.is_verified,
                metadata = EXCLUDED.metadata,
                updated_at = EXCLUDED.updated_at
            """, nativeQuery = true)
    int upsertSnapshot(@Param("postId") String postId,
                       @Param("collectionPhase") String collectionPhase,
                       @Param("collectedAt") OffsetDateTime collectedAt,
                       @Param("likes") Long likes,
                       @Param("retweets") Long retweets,
                       @Param("quoteTweets") Long quoteTweets,
                       @Param("replies") Long replies,
                       @Param("bookmarks") Long bookmarks,
                       @Param("views") Long views,
                       @Param("profileClicks") Long profileClicks,
                       @Param("engagementRate") double engagementRate,
                       @Param("confidence") double confidence,
                       @Param("anomalies") String anomaliesJson,
                       @Param("verified") boolean verified,
                       @Param("metadata") String metadataJson);
}
