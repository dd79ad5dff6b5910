package io.kubemcp.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.kubemcp.auth.AuthContext;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.RoutingContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuthContextResolver")
class AuthContextResolverTest {

    @Test
    @DisplayName("prefers the context stored by the authorization filter")
    void prefersStoredContext() {
        RoutingContext ctx = mock(RoutingContext.class);
        AuthContext authenticated = AuthContext.of("Bearer verified");
        when(ctx.get(AuthContext.ROUTING_CONTEXT_KEY)).thenReturn(authenticated);

        assertThat(AuthContextResolver.fromRoutingContext(ctx)).isSameAs(authenticated);
    }

    @Test
    @DisplayName("reads the raw header when the filter did not run")
    void readsHeader() {
        RoutingContext ctx = mock(RoutingContext.class);
        HttpServerRequest request = mock(HttpServerRequest.class);
        when(ctx.request()).thenReturn(request);
        when(request.getHeader(AuthorizationFilter.AUTHORIZATION)).thenReturn("Bearer raw");

        assertThat(AuthContextResolver.fromRoutingContext(ctx).bearerToken()).contains("raw");
    }

    @Test
    @DisplayName("is empty outside an HTTP request")
    void noRequest() {
        assertThat(AuthContextResolver.fromRoutingContext(null).bearerToken()).isEmpty();
    }
}
