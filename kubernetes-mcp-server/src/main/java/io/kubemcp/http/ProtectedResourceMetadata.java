package io.kubemcp.http;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * OAuth 2.0 protected resource metadata advertised to MCP clients.
 */
public final class ProtectedResourceMetadata {

    public static final String PATH = "/.well-known/oauth-protected-resource";

    private ProtectedResourceMetadata() {
    }

    /**
     * @param serverUrl public URL of this server, advertised as {@code resource} when set
     * @param authorizationUrl authorization server; the API server host is advertised when absent
     * @param apiServerHost API server of the base connection
     */
    public static JsonObject document(String serverUrl, String authorizationUrl, String apiServerHost) {
        JsonArray authorizationServers = new JsonArray();
        if (isSet(authorizationUrl)) {
            authorizationServers.add(authorizationUrl);
        } else if (isSet(apiServerHost)) {
            authorizationServers.add(apiServerHost);
        }
        JsonObject document = new JsonObject()
                .put("authorization_servers", authorizationServers)
                .put("scopes_supported", new JsonArray())
                .put("bearer_methods_supported", new JsonArray().add("header"));
        if (isSet(serverUrl)) {
            document.put("resource", serverUrl);
        }
        return document;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
