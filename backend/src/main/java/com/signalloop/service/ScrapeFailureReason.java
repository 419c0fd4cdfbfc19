package com.signalloop.service;

public enum ScrapeFailureReason {
    TIMEOUT(true),
    NOT_FOUND(false),
    BLOCKED(true),
    UNKNOWN(true);

    private final boolean retryable;

    ScrapeFailureReason(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
