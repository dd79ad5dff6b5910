package io.kubemcp.policy;

import org.jboss.logging.Logger;

/**
 * Decides whether a resource type may be reached under a {@link PolicyConfig}.
 */
public final class ResourceTypeMatcher {

    private static final Logger LOG = Logger.getLogger(ResourceTypeMatcher.class);

    private ResourceTypeMatcher() {
    }

    /**
     * Returns {@code false} when the policy holds an entry naming the descriptor's group/version with either
     * an empty kind or the same kind. A missing or empty policy allows everything.
     */
    public static boolean isAllowed(PolicyConfig policy, ResourceTypeDescriptor descriptor) {
        if (policy == null) {
            return true;
        }
        for (ResourceTypeDescriptor denied : policy.deniedResources()) {
            if (!denied.group().equals(descriptor.group()) || !denied.version().equals(descriptor.version())) {
                continue;
            }
            if (denied.isWildcard() || denied.kind().equals(descriptor.kind())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Throws {@link PolicyDeniedException} when the descriptor is denied.
     */
    public static void ensureAllowed(PolicyConfig policy, ResourceTypeDescriptor descriptor) {
        if (!isAllowed(policy, descriptor)) {
            LOG.debugf("Denied access to %s", descriptor);
            throw new PolicyDeniedException(descriptor);
        }
    }
}
