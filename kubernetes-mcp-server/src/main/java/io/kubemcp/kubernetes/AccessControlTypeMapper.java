package io.kubemcp.kubernetes;

import io.kubemcp.policy.PolicyConfig;
import io.kubemcp.policy.ResourceTypeDescriptor;
import io.kubemcp.policy.ResourceTypeMatcher;
import java.util.List;

/**
 * Checks every resolved kind against the policy before handing it out.
 * <p>
 * Resource-only lookups are forwarded unchanged; a kind is checked as soon as it is resolved from a resource.
 */
public class AccessControlTypeMapper implements TypeMapper {

    private final TypeMapper delegate;
    private final PolicyConfig policy;

    public AccessControlTypeMapper(TypeMapper delegate, PolicyConfig policy) {
        this.delegate = delegate;
        this.policy = policy;
    }

    @Override
    public ResourceTypeDescriptor kindFor(GroupVersionResource resource) {
        ResourceTypeDescriptor kind = delegate.kindFor(resource);
        ResourceTypeMatcher.ensureAllowed(policy, kind);
        return kind;
    }

    @Override
    public List<ResourceTypeDescriptor> kindsFor(GroupVersionResource resource) {
        List<ResourceTypeDescriptor> kinds = delegate.kindsFor(resource);
        kinds.forEach(kind -> ResourceTypeMatcher.ensureAllowed(policy, kind));
        return kinds;
    }

    @Override
    public GroupVersionResource resourceFor(GroupVersionResource resource) {
        return delegate.resourceFor(resource);
    }

    @Override
    public List<GroupVersionResource> resourcesFor(GroupVersionResource resource) {
        return delegate.resourcesFor(resource);
    }

    @Override
    public TypeMapping restMapping(String group, String kind, String... versions) {
        TypeMapping mapping = delegate.restMapping(group, kind, versions);
        ResourceTypeMatcher.ensureAllowed(policy, mapping.type());
        return mapping;
    }

    @Override
    public List<TypeMapping> restMappings(String group, String kind, String... versions) {
        List<TypeMapping> mappings = delegate.restMappings(group, kind, versions);
        mappings.forEach(mapping -> ResourceTypeMatcher.ensureAllowed(policy, mapping.type()));
        return mappings;
    }

    @Override
    public String resourceSingularizer(String resource) {
        return delegate.resourceSingularizer(resource);
    }

    @Override
    public void reset() {
        delegate.reset();
    }
}
