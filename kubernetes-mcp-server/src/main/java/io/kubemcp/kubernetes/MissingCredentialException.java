package io.kubemcp.kubernetes;

/**
 * Raised when OAuth is required but the request carried no usable bearer token.
 */
public class MissingCredentialException extends RuntimeException {

    public MissingCredentialException(String message) {
        super(message);
    }
}
