package io.kubemcp.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.util.List;
import java.util.Optional;

@ConfigMapping(prefix = "mcp.kubernetes")
public interface KubernetesServiceConfig {

    /**
     * Rejects unauthenticated HTTP requests and forces every cluster call to use the caller's bearer token.
     */
    @WithDefault("false")
    boolean requireOauth();

    /**
     * Public URL of this server. Used as the expected token audience.
     */
    Optional<String> serverUrl();

    Optional<String> authorizationUrl();

    Optional<List<DeniedResource>> deniedResources();

    /**
     * Kubeconfig file to read the server credentials from instead of the client extension's configuration.
     */
    Optional<String> kubeconfig();

    @WithDefault("default")
    String defaultNamespace();

    @WithDefault("100")
    int logTailLines();

    /**
     * Exposes only the tools that never modify the cluster.
     */
    @WithDefault("false")
    boolean readOnly();

    /**
     * Hides the tools that delete or overwrite cluster state.
     */
    @WithDefault("false")
    boolean disableDestructive();

    /**
     * When set, only these tools are exposed.
     */
    Optional<List<String>> enabledTools();

    Optional<List<String>> disabledTools();

    interface DeniedResource {

        Optional<String> group();

        String version();

        /**
         * Omitted to deny every kind of the group/version.
         */
        Optional<String> kind();
    }
}
