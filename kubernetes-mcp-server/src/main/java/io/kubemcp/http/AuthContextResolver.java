package io.kubemcp.http;

import io.kubemcp.auth.AuthContext;
import io.quarkus.arc.Arc;
import io.quarkus.vertx.http.runtime.CurrentVertxRequest;
import io.vertx.ext.web.RoutingContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

/**
 * Looks up the {@link AuthContext} of the HTTP request currently being served.
 */
@ApplicationScoped
public class AuthContextResolver {

    private final Instance<CurrentVertxRequest> currentRequest;

    @Inject
    public AuthContextResolver(Instance<CurrentVertxRequest> currentRequest) {
        this.currentRequest = currentRequest;
    }

    public AuthContext current() {
        if (!Arc.container().requestContext().isActive()) {
            return AuthContext.none();
        }
        return fromRoutingContext(currentRequest.get().getCurrent());
    }

    static AuthContext fromRoutingContext(RoutingContext ctx) {
        if (ctx == null) {
            return AuthContext.none();
        }
        AuthContext authenticated = ctx.get(AuthContext.ROUTING_CONTEXT_KEY);
        if (authenticated != null) {
            return authenticated;
        }
        return AuthContext.of(ctx.request().getHeader(AuthorizationFilter.AUTHORIZATION));
    }
}
