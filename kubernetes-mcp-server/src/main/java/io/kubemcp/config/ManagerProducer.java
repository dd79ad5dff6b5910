package io.kubemcp.config;

import io.fabric8.kubernetes.client.Config;
import io.kubemcp.auth.BearerTokenAuthenticator;
import io.kubemcp.auth.JwtClaimsParser;
import io.kubemcp.auth.OidcTokenVerifier;
import io.kubemcp.kubernetes.BaseManager;
import io.kubemcp.kubernetes.ConnectionCredentials;
import io.kubemcp.kubernetes.TokenReviewVerifier;
import io.kubemcp.policy.PolicyConfig;
import io.kubemcp.policy.ResourceTypeDescriptor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Builds the startup-time singletons: the access policy, the base manager and the bearer authenticator.
 */
@ApplicationScoped
public class ManagerProducer {

    private static final Logger LOG = Logger.getLogger(ManagerProducer.class);

    @Produces
    @Singleton
    PolicyConfig policyConfig(KubernetesServiceConfig config) {
        PolicyConfig policy = toPolicy(config.deniedResources().orElse(List.of()), config.requireOauth());
        if (policy.deniedResources().isEmpty()) {
            LOG.info("No denied resources configured, every resource type is reachable");
        } else {
            LOG.infof("Denied resources: %s", policy.deniedResources());
        }
        return policy;
    }

    @Produces
    @Singleton
    BaseManager baseManager(KubernetesServiceConfig config, PolicyConfig policy, Config clientConfig) {
        Config effective = config.kubeconfig().map(ManagerProducer::loadKubeconfig).orElse(clientConfig);
        ConnectionCredentials credentials = ConnectionCredentials.fromConfig(effective);
        LOG.infof("Using Kubernetes API server %s", credentials.host());
        return new BaseManager(credentials, policy, config.defaultNamespace());
    }

    void closeBaseManager(@Disposes BaseManager manager) {
        manager.close();
    }

    @Produces
    @Singleton
    BearerTokenAuthenticator bearerTokenAuthenticator(KubernetesServiceConfig config, BaseManager manager) {
        String serverUrl = config.serverUrl().orElse(null);
        OidcTokenVerifier oidcVerifier = null;
        if (config.requireOauth() && config.authorizationUrl().isPresent()) {
            oidcVerifier = discoverProvider(config.authorizationUrl().get(),
                    BearerTokenAuthenticator.effectiveAudience(serverUrl));
        }
        return new BearerTokenAuthenticator(new JwtClaimsParser(), new TokenReviewVerifier(manager), oidcVerifier,
                serverUrl);
    }

    private static OidcTokenVerifier discoverProvider(String authorizationUrl, String audience) {
        try {
            return OidcTokenVerifier.discover(authorizationUrl, audience);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to set up OpenID provider " + authorizationUrl, e);
        }
    }

    static PolicyConfig toPolicy(List<KubernetesServiceConfig.DeniedResource> denied, boolean requireOAuth) {
        List<ResourceTypeDescriptor> descriptors = denied.stream()
                .map(entry -> ResourceTypeDescriptor.of(
                        entry.group().orElse(""), entry.version(), entry.kind().orElse("")))
                .toList();
        return new PolicyConfig(descriptors, requireOAuth);
    }

    private static Config loadKubeconfig(String path) {
        try {
            return Config.fromKubeconfig(Files.readString(Path.of(path)));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read kubeconfig " + path, e);
        }
    }
}
