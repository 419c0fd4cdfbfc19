package com.signalloop.service;

import com.signalloop.config.SignalLoopProperties;
import com.signalloop.model.MetricSnapshot;
import org.springframework.stereotype.Component;

/**
 * Turns a verified snapshot into a bounded scalar reward. Replies weigh most,
 * then retweets and bookmarks, then likes, all normalized by views.
 */
@Component
public class RewardCalculator {

    private final SignalLoopProperties properties;

    public RewardCalculator(SignalLoopProperties properties) {
        this.properties = properties;
    }

    public double compute(MetricSnapshot snapshot) {
        long weighted = orZero(snapshot.getLikes())
                + 2 * orZero(snapshot.getRetweets())
                + 3 * orZero(snapshot.getReplies())
                + 2 * orZero(snapshot.getBookmarks());
        if (weighted == 0) {
            return 0.0;
        }
        double views = Math.max(1L, orZero(snapshot.getViews()));
        double reward = weighted / views * 100.0;
        return Math.min(properties.getRewards().getMaxReward(), reward);
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
