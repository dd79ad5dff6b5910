package io.kubemcp.auth;

import org.jboss.logging.Logger;

/**
 * Bearer authentication: local JWT sanity checks, verification against the OpenID provider when one is
 * configured, then remote token review.
 */
public class BearerTokenAuthenticator {

    public static final String DEFAULT_AUDIENCE = "kubernetes-mcp-server";

    private static final Logger LOG = Logger.getLogger(BearerTokenAuthenticator.class);

    private final JwtClaimsParser parser;
    private final RemoteTokenVerifier verifier;
    private final OidcTokenVerifier oidcVerifier;
    private final String audience;

    public BearerTokenAuthenticator(JwtClaimsParser parser, RemoteTokenVerifier verifier, String serverUrl) {
        this(parser, verifier, null, serverUrl);
    }

    /**
     * @param oidcVerifier may be {@code null} when no authorization server is configured
     */
    public BearerTokenAuthenticator(JwtClaimsParser parser, RemoteTokenVerifier verifier,
            OidcTokenVerifier oidcVerifier, String serverUrl) {
        this.parser = parser;
        this.verifier = verifier;
        this.oidcVerifier = oidcVerifier;
        this.audience = effectiveAudience(serverUrl);
    }

    public static String effectiveAudience(String serverUrl) {
        return serverUrl == null || serverUrl.isBlank() ? DEFAULT_AUDIENCE : serverUrl;
    }

    public String audience() {
        return audience;
    }

    /**
     * Authenticates the raw {@code Authorization} header value and returns the context to thread through the
     * request.
     */
    public AuthContext authenticate(String authorizationHeader) throws TokenAuthenticationException {
        String token = AuthContext.extractBearerToken(authorizationHeader)
                .orElseThrow(MissingBearerTokenException::new);

        JwtClaims claims = parser.parseAndValidate(token, audience);
        if (oidcVerifier != null) {
            oidcVerifier.verify(token);
            LOG.debugf("Token verified by OpenID provider %s", oidcVerifier.issuer());
        }
        LOG.debugf("JWT token validated - scopes: %s", claims.scopes());

        TokenReviewResult review = verifier.verify(token, audience);
        LOG.debugf("Token review succeeded for user '%s' (audiences %s)", review.username(), review.audiences());
        return AuthContext.of(authorizationHeader);
    }
}
