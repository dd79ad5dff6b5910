package io.kubemcp.auth;

public class MissingBearerTokenException extends TokenAuthenticationException {

    public MissingBearerTokenException() {
        super("missing or invalid bearer token");
    }
}
