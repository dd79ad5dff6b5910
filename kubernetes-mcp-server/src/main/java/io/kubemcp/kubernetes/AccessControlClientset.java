package io.kubemcp.kubernetes;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceList;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceList;
import io.fabric8.kubernetes.api.model.authentication.TokenReview;
import io.fabric8.kubernetes.api.model.authorization.v1.SelfSubjectAccessReview;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetrics;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetricsList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.ContainerResource;
import io.fabric8.kubernetes.client.dsl.InOutCreateable;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.PodResource;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.ServiceResource;
import io.kubemcp.policy.PolicyConfig;
import io.kubemcp.policy.ResourceTypeDescriptor;
import io.kubemcp.policy.ResourceTypeMatcher;
import java.util.List;

/**
 * Typed client that checks the policy before handing out any operation.
 * <p>
 * A caller never receives a handle for a denied type: the check runs on every accessor call and throws
 * {@link io.kubemcp.policy.PolicyDeniedException} before the delegate is touched.
 */
public class AccessControlClientset {

    static final ResourceTypeDescriptor POD = ResourceTypeDescriptor.of("", "v1", "Pod");
    static final ResourceTypeDescriptor SERVICE = ResourceTypeDescriptor.of("", "v1", "Service");
    static final ResourceTypeDescriptor NAMESPACE = ResourceTypeDescriptor.of("", "v1", "Namespace");
    static final ResourceTypeDescriptor POD_METRICS = ResourceTypeDescriptor.of("metrics.k8s.io", "v1beta1", "PodMetrics");
    static final ResourceTypeDescriptor SELF_SUBJECT_ACCESS_REVIEW =
            ResourceTypeDescriptor.of("authorization.k8s.io", "v1", "SelfSubjectAccessReview");
    static final ResourceTypeDescriptor TOKEN_REVIEW =
            ResourceTypeDescriptor.of("authentication.k8s.io", "v1", "TokenReview");

    private final KubernetesClient delegate;
    private final PolicyConfig policy;

    public AccessControlClientset(KubernetesClient delegate, PolicyConfig policy) {
        this.delegate = delegate;
        this.policy = policy;
    }

    public MixedOperation<Pod, PodList, PodResource> pods() {
        ResourceTypeMatcher.ensureAllowed(policy, POD);
        return delegate.pods();
    }

    public NonNamespaceOperation<Pod, PodList, PodResource> pods(String namespace) {
        return pods().inNamespace(namespace);
    }

    /**
     * Handle for running commands in a container of the pod.
     */
    public ContainerResource podExec(String namespace, String name, String container) {
        ResourceTypeMatcher.ensureAllowed(policy, POD);
        return delegate.pods().inNamespace(namespace).withName(name).inContainer(container);
    }

    public NonNamespaceOperation<Service, ServiceList, ServiceResource<Service>> services(String namespace) {
        ResourceTypeMatcher.ensureAllowed(policy, SERVICE);
        return delegate.services().inNamespace(namespace);
    }

    public NonNamespaceOperation<Namespace, NamespaceList, Resource<Namespace>> namespaces() {
        ResourceTypeMatcher.ensureAllowed(policy, NAMESPACE);
        return delegate.namespaces();
    }

    /**
     * Pod usage from the metrics API. A blank name lists every pod of the namespace.
     */
    public PodMetricsList podMetrics(String namespace, String name) {
        ResourceTypeMatcher.ensureAllowed(policy, POD_METRICS);
        if (name == null || name.isBlank()) {
            return delegate.top().pods().inNamespace(namespace).metrics();
        }
        PodMetrics metrics = delegate.top().pods().inNamespace(namespace).withName(name).metric();
        PodMetricsList list = new PodMetricsList();
        list.setItems(metrics == null ? List.of() : List.of(metrics));
        return list;
    }

    public InOutCreateable<SelfSubjectAccessReview, SelfSubjectAccessReview> selfSubjectAccessReviews() {
        ResourceTypeMatcher.ensureAllowed(policy, SELF_SUBJECT_ACCESS_REVIEW);
        return delegate.authorization().v1().selfSubjectAccessReview();
    }

    public InOutCreateable<TokenReview, TokenReview> tokenReviews() {
        ResourceTypeMatcher.ensureAllowed(policy, TOKEN_REVIEW);
        return delegate.authentication().v1().tokenReviews();
    }
}
