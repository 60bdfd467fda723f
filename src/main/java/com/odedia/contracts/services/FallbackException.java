package com.odedia.contracts.services;

/**
 * The fallback model could not fill missing fields: no credential, transport
 * failure or an unusable response after all retries.
 */
public class FallbackException extends Exception {

    public FallbackException(String message) {
        super(message);
    }

    public FallbackException(String message, Throwable cause) {
        super(message, cause);
    }
}
