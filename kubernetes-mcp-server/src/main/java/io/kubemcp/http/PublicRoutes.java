package io.kubemcp.http;

import io.kubemcp.config.KubernetesServiceConfig;
import io.kubemcp.kubernetes.BaseManager;
import io.vertx.ext.web.Router;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

/**
 * Endpoints that are always reachable without a token.
 */
@ApplicationScoped
public class PublicRoutes {

    public static final String HEALTH_PATH = "/healthz";

    private final KubernetesServiceConfig config;
    private final BaseManager manager;

    @Inject
    public PublicRoutes(KubernetesServiceConfig config, BaseManager manager) {
        this.config = config;
        this.manager = manager;
    }

    void register(@Observes Router router) {
        router.get(HEALTH_PATH).handler(ctx -> ctx.response().setStatusCode(200).end());
        router.get(ProtectedResourceMetadata.PATH).handler(ctx -> ctx.response()
                .putHeader("Content-Type", "application/json")
                .end(ProtectedResourceMetadata.document(
                        config.serverUrl().orElse(null),
                        config.authorizationUrl().orElse(null),
                        manager.apiServerHost()).encode()));
    }
}
