package io.kubemcp.kubernetes;

/**
 * An addressable resource collection, e.g. {@code apps/v1 deployments}. Empty fields act as wildcards when the
 * value is used as a lookup key.
 */
public record GroupVersionResource(String group, String version, String resource) {

    public GroupVersionResource {
        group = group == null ? "" : group;
        version = version == null ? "" : version;
        resource = resource == null ? "" : resource;
    }

    public static GroupVersionResource of(String group, String version, String resource) {
        return new GroupVersionResource(group, version, resource);
    }

    public String groupVersion() {
        return group.isEmpty() ? version : group + "/" + version;
    }

    boolean matches(GroupVersionResource candidate) {
        return (group.isEmpty() || group.equals(candidate.group))
                && (version.isEmpty() || version.equals(candidate.version))
                && resource.equals(candidate.resource);
    }

    @Override
    public String toString() {
        return groupVersion() + ", Resource=" + resource;
    }
}
