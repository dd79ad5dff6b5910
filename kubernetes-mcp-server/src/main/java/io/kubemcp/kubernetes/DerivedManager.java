package io.kubemcp.kubernetes;

import io.kubemcp.policy.PolicyConfig;

/**
 * Per-request view of a {@link BaseManager}.
 * <p>
 * Either owns a freshly derived manager, closed together with this instance, or borrows the base manager
 * itself when the request carried no token.
 */
public final class DerivedManager implements AutoCloseable {

    private final BaseManager manager;
    private final boolean owned;

    DerivedManager(BaseManager manager, boolean owned) {
        this.manager = manager;
        this.owned = owned;
    }

    BaseManager manager() {
        return manager;
    }

    /**
     * Whether this manager runs with a caller's token instead of the server's credentials.
     */
    public boolean isDerived() {
        return owned;
    }

    public ConnectionCredentials credentials() {
        return manager.credentials();
    }

    public PolicyConfig policy() {
        return manager.policy();
    }

    public AccessControlClientset clientset() {
        return manager.clientset();
    }

    public TypeMapper typeMapper() {
        return manager.typeMapper();
    }

    public ResourceOperations resources() {
        return manager.resources();
    }

    public PodOperations pods() {
        return manager.pods();
    }

    @Override
    public void close() {
        if (owned) {
            manager.close();
        }
    }
}
