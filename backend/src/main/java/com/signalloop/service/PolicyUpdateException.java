package com.signalloop.service;

/**
 * A policy update run did not complete. Surfaced to the caller so a stale
 * policy never goes unnoticed.
 */
public class PolicyUpdateException extends RuntimeException {

    public PolicyUpdateException(String message) {
        super(message);
    }

    public PolicyUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
