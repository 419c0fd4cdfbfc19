package com.signalloop.model;

/**
 * Raw measurement returned by the metric scraper. Any field may be null when
 * the page did not expose it.
 */
public record ScrapedMetrics(
        Long likes,
        Long retweets,
        Long quoteTweets,
        Long replies,
        Long bookmarks,
        Long views,
        Long profileClicks
) {

    public static ScrapedMetrics of(Long likes, Long retweets, Long replies, Long bookmarks, Long views) {
        return new ScrapedMetrics(likes, retweets, null, replies, bookmarks, views, null);
    }

    public boolean hasAnyMetric() {
        return likes != null || retweets != null || quoteTweets != null || replies != null
                || bookmarks != null || views != null || profileClicks != null;
    }

    /**
     * likes + retweets + replies + bookmarks, unknown counters as zero.
     */
    public long totalInteractions() {
        return orZero(likes) + orZero(retweets) + orZero(replies) + orZero(bookmarks);
    }

    public double engagementRate() {
        return MetricSnapshot.computeEngagementRate(likes, retweets, replies, views);
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
