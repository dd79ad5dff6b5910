package io.kubemcp.auth;

public class RemoteAuthenticationException extends TokenAuthenticationException {

    public RemoteAuthenticationException(String message) {
        super(message);
    }

    public RemoteAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
