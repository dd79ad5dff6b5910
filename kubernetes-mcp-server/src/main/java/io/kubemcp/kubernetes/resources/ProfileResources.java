package io.kubemcp.kubernetes.resources;

import io.kubemcp.config.KubernetesServiceConfig;
import io.kubemcp.policy.PolicyConfig;
import io.kubemcp.policy.ResourceTypeDescriptor;
import io.quarkiverse.mcp.server.Resource;
import io.quarkiverse.mcp.server.TextResourceContents;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.stream.Collectors;

@ApplicationScoped
public class ProfileResources {

    static final String PROFILE_URI = "kubernetes://profile/default";

    private final PolicyConfig policy;
    private final KubernetesServiceConfig config;

    @Inject
    public ProfileResources(PolicyConfig policy, KubernetesServiceConfig config) {
        this.policy = policy;
        this.config = config;
    }

    @Resource(uri = PROFILE_URI)
    public TextResourceContents defaultProfile() {
        return TextResourceContents.create(PROFILE_URI, describe(policy, config.defaultNamespace()));
    }

    static String describe(PolicyConfig policy, String defaultNamespace) {
        String denied = policy.deniedResources().isEmpty() ? "none"
                : policy.deniedResources().stream()
                        .map(ResourceTypeDescriptor::toString)
                        .collect(Collectors.joining("; "));
        return "Default namespace: " + defaultNamespace
                + "\nOAuth required: " + policy.requireOAuth()
                + "\nDenied resources: " + denied;
    }
}
