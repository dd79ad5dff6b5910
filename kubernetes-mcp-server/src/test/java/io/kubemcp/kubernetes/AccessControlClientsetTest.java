package io.kubemcp.kubernetes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceList;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.PodResource;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.kubemcp.policy.PolicyConfig;
import io.kubemcp.policy.PolicyDeniedException;
import io.kubemcp.policy.ResourceTypeDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("AccessControlClientset")
class AccessControlClientsetTest {

    @Mock
    KubernetesClient client;

    @Mock
    MixedOperation<Pod, PodList, PodResource> podOperation;

    @Mock
    NonNamespaceOperation<Namespace, NamespaceList, Resource<Namespace>> namespaceOperation;

    @Test
    @DisplayName("hands out the delegate operation for an allowed type")
    void delegatesWhenAllowed() {
        when(client.pods()).thenReturn(podOperation);
        AccessControlClientset clientset = new AccessControlClientset(client,
                PolicyConfig.denying(ResourceTypeDescriptor.of("", "v1", "Secret")));

        assertThat(clientset.pods()).isSameAs(podOperation);
    }

    @Test
    @DisplayName("rejects a denied kind before touching the delegate")
    void rejectsDeniedKind() {
        AccessControlClientset clientset = new AccessControlClientset(client,
                PolicyConfig.denying(ResourceTypeDescriptor.of("", "v1", "Pod")));

        assertThatThrownBy(clientset::pods)
                .isInstanceOf(PolicyDeniedException.class)
                .hasMessage("resource not allowed: /v1, Kind=Pod");
        assertThatThrownBy(() -> clientset.pods("team-a")).isInstanceOf(PolicyDeniedException.class);
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("rejects every kind of a denied group version")
    void rejectsWildcardGroupVersion() {
        AccessControlClientset clientset = new AccessControlClientset(client,
                PolicyConfig.denying(ResourceTypeDescriptor.of("metrics.k8s.io", "v1beta1", "")));

        assertThatThrownBy(() -> clientset.podMetrics("team-a", "web"))
                .isInstanceOf(PolicyDeniedException.class)
                .hasMessageContaining("metrics.k8s.io/v1beta1, Kind=PodMetrics");
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("guards the review APIs like any other type")
    void guardsReviewApis() {
        AccessControlClientset clientset = new AccessControlClientset(client, PolicyConfig.denying(
                ResourceTypeDescriptor.of("authentication.k8s.io", "v1", "TokenReview"),
                ResourceTypeDescriptor.of("authorization.k8s.io", "v1", "SelfSubjectAccessReview")));

        assertThatThrownBy(clientset::tokenReviews).isInstanceOf(PolicyDeniedException.class);
        assertThatThrownBy(clientset::selfSubjectAccessReviews).isInstanceOf(PolicyDeniedException.class);
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("keeps unrelated types reachable under a deny list")
    void unrelatedTypesReachable() {
        when(client.namespaces()).thenReturn(namespaceOperation);
        AccessControlClientset clientset = new AccessControlClientset(client,
                PolicyConfig.denying(ResourceTypeDescriptor.of("", "v1", "Pod")));

        assertThat(clientset.namespaces()).isSameAs(namespaceOperation);
    }

    @Test
    @DisplayName("allows everything without a policy")
    void nullPolicyAllowsEverything() {
        when(client.pods()).thenReturn(podOperation);
        AccessControlClientset clientset = new AccessControlClientset(client, null);

        assertThat(clientset.pods()).isSameAs(podOperation);
    }
}
