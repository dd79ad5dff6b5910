package io.kubemcp.policy;

import java.util.List;

/**
 * Immutable access policy loaded once at startup and shared by reference between every manager.
 *
 * @param deniedResources resource types that must never be reachable, in configuration order
 * @param requireOAuth whether callers must present their own bearer token
 */
public record PolicyConfig(List<ResourceTypeDescriptor> deniedResources, boolean requireOAuth) {

    private static final PolicyConfig OPEN = new PolicyConfig(List.of(), false);

    public PolicyConfig {
        deniedResources = deniedResources == null ? List.of() : List.copyOf(deniedResources);
    }

    public static PolicyConfig open() {
        return OPEN;
    }

    public static PolicyConfig denying(ResourceTypeDescriptor... denied) {
        return new PolicyConfig(List.of(denied), false);
    }

    public PolicyConfig withRequireOAuth(boolean required) {
        return new PolicyConfig(deniedResources, required);
    }
}
