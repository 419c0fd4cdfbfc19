package com.signalloop.service;

/**
 * A snapshot could not be written. Raised before any cache or reward side effect.
 */
public class PersistenceFailureException extends RuntimeException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
