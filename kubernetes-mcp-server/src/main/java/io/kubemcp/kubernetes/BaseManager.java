package io.kubemcp.kubernetes;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.kubemcp.auth.AuthContext;
import io.kubemcp.policy.PolicyConfig;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.jboss.logging.Logger;

/**
 * Holds one credential set and the capability clients bound to it.
 * <p>
 * Clients are built on first use and shared by every later caller; construction is synchronized so concurrent
 * first calls produce a single instance. The {@link PolicyConfig} is shared by reference with every manager
 * derived from this one.
 */
public class BaseManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(BaseManager.class);

    public static final String DEFAULT_NAMESPACE = "default";

    private static final Function<Config, KubernetesClient> DEFAULT_CLIENT_FACTORY =
            config -> new KubernetesClientBuilder().withConfig(config).build();

    private final ConnectionCredentials credentials;
    private final PolicyConfig policy;
    private final String defaultNamespace;
    private final Function<Config, KubernetesClient> clientFactory;

    private final Memoized<KubernetesClient> kubernetesClient;
    private final Memoized<AccessControlClientset> clientset;
    private final Memoized<DiscoveryTypeMapper> discovery;
    private final Memoized<TypeMapper> typeMapper;
    private final Memoized<ResourceOperations> resources;

    public BaseManager(ConnectionCredentials credentials, PolicyConfig policy) {
        this(credentials, policy, DEFAULT_NAMESPACE, DEFAULT_CLIENT_FACTORY);
    }

    public BaseManager(ConnectionCredentials credentials, PolicyConfig policy, String defaultNamespace) {
        this(credentials, policy, defaultNamespace, DEFAULT_CLIENT_FACTORY);
    }

    public BaseManager(ConnectionCredentials credentials, PolicyConfig policy, String defaultNamespace,
            Function<Config, KubernetesClient> clientFactory) {
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.policy = policy;
        this.defaultNamespace = defaultNamespace == null || defaultNamespace.isBlank() ? DEFAULT_NAMESPACE : defaultNamespace;
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.kubernetesClient = new Memoized<>(() -> this.clientFactory.apply(this.credentials.toConfig()));
        this.clientset = new Memoized<>(() -> new AccessControlClientset(kubernetesClient.get(), this.policy));
        this.discovery = new Memoized<>(() -> new DiscoveryTypeMapper(kubernetesClient.get()));
        this.typeMapper = new Memoized<>(() -> new AccessControlTypeMapper(discovery.get(), this.policy));
        this.resources = new Memoized<>(() -> new ResourceOperations(
                kubernetesClient.get(), typeMapper.get(), clientset.get(), this.defaultNamespace));
    }

    /**
     * Returns the manager to serve one request with.
     * <p>
     * A bearer token in the context yields a new manager whose credentials carry only that token plus the
     * connection and TLS settings of this one. Without a token this manager itself is reused, unless the policy
     * requires OAuth, in which case {@link MissingCredentialException} is thrown. No network call is made here.
     */
    public DerivedManager derived(AuthContext authContext) {
        Optional<String> token = authContext == null ? Optional.empty() : authContext.bearerToken();
        if (token.isEmpty()) {
            if (policy != null && policy.requireOAuth()) {
                throw new MissingCredentialException("bearer token required");
            }
            LOG.debug("No bearer token in request, using server credentials");
            return new DerivedManager(this, false);
        }
        ConnectionCredentials derivedCredentials = credentials.derive(token.get());
        LOG.debugf("Derived per-request credentials for %s", derivedCredentials.host());
        return new DerivedManager(new BaseManager(derivedCredentials, policy, defaultNamespace, clientFactory), true);
    }

    public ConnectionCredentials credentials() {
        return credentials;
    }

    public PolicyConfig policy() {
        return policy;
    }

    public String defaultNamespace() {
        return defaultNamespace;
    }

    public String apiServerHost() {
        return credentials.host();
    }

    public AccessControlClientset clientset() {
        return clientset.get();
    }

    public TypeMapper typeMapper() {
        return typeMapper.get();
    }

    public ResourceOperations resources() {
        return resources.get();
    }

    public PodOperations pods() {
        return new PodOperations(clientset(), resources());
    }

    KubernetesClient kubernetesClient() {
        return kubernetesClient.get();
    }

    /**
     * Releases the client and any cached discovery data. Clients that were never built stay unbuilt.
     */
    @Override
    public void close() {
        DiscoveryTypeMapper mapper = discovery.getIfBuilt();
        if (mapper != null) {
            mapper.reset();
        }
        KubernetesClient client = kubernetesClient.getIfBuilt();
        if (client != null) {
            LOG.logf(credentials.isDerived() ? Logger.Level.DEBUG : Logger.Level.INFO,
                    "Closing Kubernetes client for %s", credentials.host());
            client.close();
        }
    }
}
