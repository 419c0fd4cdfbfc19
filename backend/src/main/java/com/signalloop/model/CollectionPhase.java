package com.signalloop.model;

import java.time.Duration;

/**
 * Lifecycle stage at which a post's metrics were collected. Snapshots are
 * upserted per (post, phase), so repeated passes within a stage overwrite.
 */
public enum CollectionPhase {
    T_PLUS_1H,
    T_PLUS_6H,
    T_PLUS_24H,
    T_PLUS_72H,
    SCHEDULED;

    public static CollectionPhase forPostAge(Duration age) {
        long minutes = age.toMinutes();
        if (minutes <= 60) {
            return T_PLUS_1H;
        }
        if (minutes <= 6 * 60) {
            return T_PLUS_6H;
        }
        if (minutes <= 24 * 60) {
            return T_PLUS_24H;
        }
        if (minutes <= 72 * 60) {
            return T_PLUS_72H;
        }
        return SCHEDULED;
    }
}
