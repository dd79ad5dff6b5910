package io.kubemcp.auth;

/**
 * Base type of every failure that rejects a request at the HTTP boundary.
 */
public abstract class TokenAuthenticationException extends Exception {

    protected TokenAuthenticationException(String message) {
        super(message);
    }

    protected TokenAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
