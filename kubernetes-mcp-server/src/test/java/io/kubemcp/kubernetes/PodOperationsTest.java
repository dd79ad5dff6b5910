package io.kubemcp.kubernetes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import io.kubemcp.kubernetes.dto.OperationStatus;
import io.kubemcp.policy.PolicyConfig;
import io.kubemcp.policy.PolicyDeniedException;
import io.kubemcp.policy.ResourceTypeDescriptor;
import java.net.HttpURLConnection;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@EnableKubernetesMockClient(https = false, crud = false)
@DisplayName("PodOperations")
class PodOperationsTest {

    private static final String POD_PATH = "/api/v1/namespaces/team-a/pods/web";

    KubernetesMockServer server;
    KubernetesClient client;

    private PodOperations pods(PolicyConfig policy) {
        AccessControlClientset clientset = new AccessControlClientset(client, policy);
        TypeMapper typeMapper = new AccessControlTypeMapper(new DiscoveryTypeMapper(client), policy);
        return new PodOperations(clientset, new ResourceOperations(client, typeMapper, clientset, "team-a"));
    }

    private static Pod web() {
        return new PodBuilder()
                .withNewMetadata().withName("web").withNamespace("team-a").endMetadata()
                .build();
    }

    @Test
    @DisplayName("deletes a pod of the default namespace")
    void deletesPod() {
        server.expect().get().withPath(POD_PATH).andReturn(HttpURLConnection.HTTP_OK, web()).once();
        server.expect().delete().withPath(POD_PATH).andReturn(HttpURLConnection.HTTP_OK, web()).once();

        OperationStatus status = pods(PolicyConfig.open()).delete("", "web");

        assertThat(status.message()).isEqualTo("Pod deleted successfully");
        assertThat(status.target()).isEqualTo("Pod team-a/web");
    }

    @Test
    @DisplayName("reports a missing pod")
    void missingPod() {
        assertThatThrownBy(() -> pods(PolicyConfig.open()).delete("team-a", "web"))
                .isInstanceOf(UpstreamApiException.class)
                .hasMessage("failed to delete pod team-a/web: not found");
    }

    @Test
    @DisplayName("refuses pod operations when pods are denied")
    void deniedPods() {
        PodOperations pods = pods(PolicyConfig.denying(ResourceTypeDescriptor.of("", "v1", "Pod")));

        assertThatThrownBy(() -> pods.delete("team-a", "web")).isInstanceOf(PolicyDeniedException.class);
        assertThatThrownBy(() -> pods.log("team-a", "web", "", 10)).isInstanceOf(PolicyDeniedException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    @DisplayName("refuses to exec into a completed pod")
    void execIntoCompletedPod() {
        server.expect().get().withPath(POD_PATH)
                .andReturn(HttpURLConnection.HTTP_OK, new PodBuilder(web())
                        .withNewSpec().addNewContainer().withName("web").endContainer().endSpec()
                        .withNewStatus().withPhase("Succeeded").endStatus()
                        .build())
                .once();

        assertThatThrownBy(() -> pods(PolicyConfig.open()).exec("team-a", "web", "", List.of("ls")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("cannot exec into a container in a completed pod; current phase is Succeeded");
    }

    @Test
    @DisplayName("reports exec into a missing pod")
    void execIntoMissingPod() {
        assertThatThrownBy(() -> pods(PolicyConfig.open()).exec("team-a", "web", "", List.of("ls")))
                .isInstanceOf(UpstreamApiException.class)
                .hasMessage("failed to get pod team-a/web: not found");
    }

    @Test
    @DisplayName("refuses exec without a command or when pods are denied")
    void execPreconditions() {
        PolicyConfig denyingPods = PolicyConfig.denying(ResourceTypeDescriptor.of("", "v1", "Pod"));
        PodOperations denied = pods(denyingPods);

        assertThatThrownBy(() -> pods(PolicyConfig.open()).exec("team-a", "web", "", List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("command is required");
        assertThatThrownBy(() -> denied.exec("team-a", "web", "", List.of("ls")))
                .isInstanceOf(PolicyDeniedException.class);
        assertThatThrownBy(() -> new AccessControlClientset(client, denyingPods).podExec("team-a", "web", "web"))
                .isInstanceOf(PolicyDeniedException.class);
        assertThat(server.getRequestCount()).isZero();
    }
}
