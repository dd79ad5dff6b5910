package io.kubemcp.auth;

public class TokenStructureInvalidException extends TokenAuthenticationException {

    public TokenStructureInvalidException(String message) {
        super(message);
    }

    public TokenStructureInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
