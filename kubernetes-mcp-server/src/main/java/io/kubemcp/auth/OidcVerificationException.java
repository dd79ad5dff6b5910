package io.kubemcp.auth;

public class OidcVerificationException extends TokenAuthenticationException {

    public OidcVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
