package io.kubemcp.policy;

import java.util.Objects;

/**
 * Identifies an API resource type by group, version and kind. An empty kind matches every kind of the
 * group/version when used as a policy entry.
 */
public record ResourceTypeDescriptor(String group, String version, String kind) {

    public ResourceTypeDescriptor {
        group = group == null ? "" : group;
        version = version == null ? "" : version;
        kind = kind == null ? "" : kind;
    }

    public static ResourceTypeDescriptor of(String group, String version, String kind) {
        return new ResourceTypeDescriptor(group, version, kind);
    }

    /**
     * Parses an {@code apiVersion} value such as {@code apps/v1} or {@code v1}.
     */
    public static ResourceTypeDescriptor fromApiVersion(String apiVersion, String kind) {
        Objects.requireNonNull(apiVersion, "apiVersion");
        int slash = apiVersion.indexOf('/');
        if (slash < 0) {
            return new ResourceTypeDescriptor("", apiVersion, kind);
        }
        return new ResourceTypeDescriptor(apiVersion.substring(0, slash), apiVersion.substring(slash + 1), kind);
    }

    public boolean isWildcard() {
        return kind.isEmpty();
    }

    public String apiVersion() {
        return group.isEmpty() ? version : group + "/" + version;
    }

    @Override
    public String toString() {
        return group + "/" + version + ", Kind=" + kind;
    }
}
