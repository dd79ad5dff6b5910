package io.kubemcp.policy;

/**
 * Raised when a resource type is blocked by the configured denylist.
 */
public class PolicyDeniedException extends RuntimeException {

    private final ResourceTypeDescriptor resourceType;

    public PolicyDeniedException(ResourceTypeDescriptor resourceType) {
        super("resource not allowed: " + resourceType);
        this.resourceType = resourceType;
    }

    public ResourceTypeDescriptor resourceType() {
        return resourceType;
    }
}
