package com.signalloop.service;

import lombok.Getter;

/**
 * The metric scraper could not read a post. Never stored; the next collection
 * cycle retries.
 */
@Getter
public class ScrapeFailureException extends RuntimeException {

    private final String postId;
    private final ScrapeFailureReason reason;

    public ScrapeFailureException(String postId, ScrapeFailureReason reason, String message) {
        super(message);
        this.postId = postId;
        this.reason = reason;
    }

    public ScrapeFailureException(String postId, ScrapeFailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.postId = postId;
        this.reason = reason;
    }
}
