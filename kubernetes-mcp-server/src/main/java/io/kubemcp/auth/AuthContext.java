package io.kubemcp.auth;

import java.util.Optional;

/**
 * Per-request authentication input carried explicitly from the HTTP boundary to manager derivation.
 */
public final class AuthContext {

    public static final String ROUTING_CONTEXT_KEY = AuthContext.class.getName();

    static final String BEARER_PREFIX = "Bearer ";

    private static final AuthContext NONE = new AuthContext(null);

    private final String authorizationHeader;

    private AuthContext(String authorizationHeader) {
        this.authorizationHeader = authorizationHeader;
    }

    public static AuthContext none() {
        return NONE;
    }

    public static AuthContext of(String authorizationHeader) {
        return authorizationHeader == null ? NONE : new AuthContext(authorizationHeader);
    }

    public Optional<String> authorizationHeader() {
        return Optional.ofNullable(authorizationHeader);
    }

    /**
     * The token following {@code "Bearer "}, if the header uses that scheme and the token is not blank.
     */
    public Optional<String> bearerToken() {
        return extractBearerToken(authorizationHeader);
    }

    static Optional<String> extractBearerToken(String header) {
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = header.substring(BEARER_PREFIX.length());
        return token.isBlank() ? Optional.empty() : Optional.of(token);
    }

    @Override
    public String toString() {
        return authorizationHeader == null ? "AuthContext[none]" : "AuthContext[present]";
    }
}
