package io.kubemcp.http;

import io.kubemcp.auth.AuthContext;
import io.kubemcp.auth.BearerTokenAuthenticator;
import io.kubemcp.config.KubernetesServiceConfig;
import io.quarkus.vertx.http.runtime.filters.Filters;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Gates every non-public HTTP request behind bearer authentication when OAuth is required.
 * <p>
 * The token is first checked locally, then reviewed by the cluster on a worker thread. Only a request that
 * passes both steps continues, with its {@link AuthContext} stored under {@link AuthContext#ROUTING_CONTEXT_KEY}.
 */
@ApplicationScoped
public class AuthorizationFilter {

    private static final Logger LOG = Logger.getLogger(AuthorizationFilter.class);

    static final String AUTHORIZATION = "Authorization";
    static final String WWW_AUTHENTICATE = "WWW-Authenticate";
    static final String REALM = "Kubernetes MCP Server";
    static final String TOKEN_REQUIRED = "Unauthorized: Bearer token required";
    static final String INVALID_TOKEN = "Unauthorized: Invalid token";

    private static final int FILTER_PRIORITY = 100;

    private static final Set<String> PUBLIC_PATHS = Set.of(PublicRoutes.HEALTH_PATH, ProtectedResourceMetadata.PATH);

    private final BearerTokenAuthenticator authenticator;
    private final boolean requireOAuth;
    private final String challenge;

    @Inject
    public AuthorizationFilter(BearerTokenAuthenticator authenticator, KubernetesServiceConfig config) {
        this(authenticator, config.requireOauth(), config.serverUrl().orElse(null));
    }

    AuthorizationFilter(BearerTokenAuthenticator authenticator, boolean requireOAuth, String serverUrl) {
        this.authenticator = authenticator;
        this.requireOAuth = requireOAuth;
        this.challenge = challenge(authenticator.audience(), serverUrl);
    }

    static String challenge(String audience, String serverUrl) {
        StringBuilder value = new StringBuilder("Bearer realm=\"").append(REALM).append("\", audience=\"")
                .append(audience).append('"');
        if (serverUrl != null && !serverUrl.isBlank()) {
            value.append(", resource_metadata=\"").append(serverUrl).append(ProtectedResourceMetadata.PATH).append('"');
        }
        return value.append(", error=\"invalid_token\"").toString();
    }

    void register(@Observes Filters filters) {
        filters.register(this::filter, FILTER_PRIORITY);
    }

    void filter(RoutingContext ctx) {
        long started = System.nanoTime();
        ctx.addEndHandler(ignored -> LOG.debugf("%s %s %d %dms", ctx.request().method(), ctx.normalizedPath(),
                ctx.response().getStatusCode(), (System.nanoTime() - started) / 1_000_000));

        String path = ctx.normalizedPath();
        if (PUBLIC_PATHS.contains(path) || !requireOAuth) {
            ctx.next();
            return;
        }

        String header = ctx.request().getHeader(AUTHORIZATION);
        if (AuthContext.of(header).bearerToken().isEmpty()) {
            LOG.debugf("Authentication failed - missing or invalid bearer token: %s %s from %s",
                    ctx.request().method(), path, ctx.request().remoteAddress());
            reject(ctx, TOKEN_REQUIRED);
            return;
        }

        ctx.vertx().executeBlocking(() -> authenticator.authenticate(header), false)
                .onComplete(result -> {
                    if (result.succeeded()) {
                        ctx.put(AuthContext.ROUTING_CONTEXT_KEY, result.result());
                        ctx.next();
                        return;
                    }
                    LOG.debugf("Authentication failed - %s: %s %s from %s", result.cause().getMessage(),
                            ctx.request().method(), path, ctx.request().remoteAddress());
                    reject(ctx, INVALID_TOKEN);
                });
    }

    private void reject(RoutingContext ctx, String body) {
        HttpServerResponse response = ctx.response();
        if (response.closed() || response.ended()) {
            return;
        }
        response.setStatusCode(401)
                .putHeader(WWW_AUTHENTICATE, challenge)
                .end(body);
    }
}
