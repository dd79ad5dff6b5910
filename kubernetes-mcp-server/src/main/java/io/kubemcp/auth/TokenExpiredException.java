package io.kubemcp.auth;

public class TokenExpiredException extends TokenAuthenticationException {

    public TokenExpiredException(long expiry) {
        super("token expired at " + expiry);
    }
}
