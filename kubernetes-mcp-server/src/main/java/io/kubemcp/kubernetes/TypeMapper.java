package io.kubemcp.kubernetes;

import io.kubemcp.policy.ResourceTypeDescriptor;
import java.util.List;

/**
 * Resolves between kinds and the resource collections that serve them.
 * <p>
 * Lookups by resource accept partial keys: an empty group or version matches any. Lookups by kind without
 * versions return the server's preferred version first.
 */
public interface TypeMapper {

    ResourceTypeDescriptor kindFor(GroupVersionResource resource);

    List<ResourceTypeDescriptor> kindsFor(GroupVersionResource resource);

    GroupVersionResource resourceFor(GroupVersionResource resource);

    List<GroupVersionResource> resourcesFor(GroupVersionResource resource);

    TypeMapping restMapping(String group, String kind, String... versions);

    List<TypeMapping> restMappings(String group, String kind, String... versions);

    /**
     * Singular name of a plural resource, e.g. {@code pods} to {@code pod}.
     */
    String resourceSingularizer(String resource);

    /**
     * Drops cached discovery data so the next lookup reflects the server's current API surface.
     */
    void reset();
}
