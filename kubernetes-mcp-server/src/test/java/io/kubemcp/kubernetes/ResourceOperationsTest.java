package io.kubemcp.kubernetes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.EventListBuilder;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.NamespaceListBuilder;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.api.model.authorization.v1.SelfSubjectAccessReviewBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import io.kubemcp.kubernetes.dto.EventInfo;
import io.kubemcp.policy.PolicyConfig;
import io.kubemcp.policy.PolicyDeniedException;
import io.kubemcp.policy.ResourceTypeDescriptor;
import java.net.HttpURLConnection;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@EnableKubernetesMockClient(https = false, crud = false)
@DisplayName("ResourceOperations")
class ResourceOperationsTest {

    private static final String SSAR_PATH = "/apis/authorization.k8s.io/v1/selfsubjectaccessreviews";
    private static final ResourceTypeDescriptor DEPLOYMENT = ResourceTypeDescriptor.of("apps", "v1", "Deployment");

    KubernetesMockServer server;
    KubernetesClient client;

    @BeforeEach
    void setUp() {
        DiscoveryTypeMapperTest.expectDiscovery(server);
    }

    private ResourceOperations operations(PolicyConfig policy) {
        TypeMapper typeMapper = new AccessControlTypeMapper(new DiscoveryTypeMapper(client), policy);
        return new ResourceOperations(client, typeMapper, new AccessControlClientset(client, policy), "default");
    }

    private void expectAccessReview(boolean allowed) {
        server.expect().post().withPath(SSAR_PATH)
                .andReturn(HttpURLConnection.HTTP_CREATED, new SelfSubjectAccessReviewBuilder()
                        .withNewStatus().withAllowed(allowed).endStatus()
                        .build())
                .once();
    }

    static Event backOff(String namespace) {
        return new EventBuilder()
                .withNewMetadata().withName("web.17a").withNamespace(namespace).endMetadata()
                .withType("Warning")
                .withReason("BackOff")
                .withMessage("  Back-off restarting failed container\n")
                .withNewInvolvedObject().withApiVersion("v1").withKind("Pod").withName("web").endInvolvedObject()
                .withFirstTimestamp("2025-06-01T10:00:00Z")
                .withCount(1)
                .build();
    }

    @Test
    @DisplayName("summarizes the events of a namespace")
    void listsNamespaceEvents() {
        server.expect().get().withPath("/api/v1/namespaces/team-a/events")
                .andReturn(HttpURLConnection.HTTP_OK, new EventListBuilder().addToItems(backOff("team-a")).build())
                .once();

        List<EventInfo> events = operations(PolicyConfig.open()).eventsList("team-a");

        assertThat(events).containsExactly(new EventInfo("team-a", "2025-06-01T10:00:00Z", "Warning", "BackOff",
                "v1", "Pod", "web", "Back-off restarting failed container"));
    }

    @Test
    @DisplayName("lists every namespace when the caller may list cluster-wide")
    void listsAllNamespaces() {
        expectAccessReview(true);
        server.expect().get().withPath("/api/v1/events")
                .andReturn(HttpURLConnection.HTTP_OK, new EventListBuilder()
                        .addToItems(backOff("team-a"), backOff("team-b"))
                        .build())
                .once();

        List<EventInfo> events = operations(PolicyConfig.open()).eventsList("");

        assertThat(events).extracting(EventInfo::namespace).containsExactly("team-a", "team-b");
    }

    @Test
    @DisplayName("falls back to the default namespace when cluster-wide listing is not permitted")
    void fallsBackToDefaultNamespace() {
        expectAccessReview(false);
        server.expect().get().withPath("/api/v1/namespaces/default/events")
                .andReturn(HttpURLConnection.HTTP_OK, new EventListBuilder().addToItems(backOff("default")).build())
                .once();

        List<EventInfo> events = operations(PolicyConfig.open()).eventsList("");

        assertThat(events).extracting(EventInfo::namespace).containsExactly("default");
    }

    @Test
    @DisplayName("is rejected without listing anything when events are denied")
    void deniedEvents() throws Exception {
        ResourceOperations operations = operations(PolicyConfig.denying(ResourceTypeDescriptor.of("", "v1", "Event")));

        assertThatThrownBy(() -> operations.eventsList("team-a"))
                .isInstanceOf(PolicyDeniedException.class)
                .hasMessage("resource not allowed: /v1, Kind=Event");
        assertThat(server.getLastRequest().getPath()).doesNotContain("/events");
    }

    @Test
    @DisplayName("lists namespaces as a cluster-scoped type")
    void listsNamespaces() {
        server.expect().get().withPath("/api/v1/namespaces")
                .andReturn(HttpURLConnection.HTTP_OK, new NamespaceListBuilder()
                        .addToItems(new NamespaceBuilder().withNewMetadata().withName("team-a").endMetadata().build())
                        .build())
                .once();

        assertThat(operations(PolicyConfig.open()).namespacesList().getItems())
                .extracting(item -> item.getMetadata().getName())
                .containsExactly("team-a");
    }

    @Test
    @DisplayName("reads a namespaced resource from the default namespace")
    void getsFromDefaultNamespace() {
        server.expect().get().withPath("/apis/apps/v1/namespaces/default/deployments/web")
                .andReturn(HttpURLConnection.HTTP_OK, new DeploymentBuilder()
                        .withNewMetadata().withName("web").withNamespace("default").endMetadata()
                        .build())
                .once();

        GenericKubernetesResource deployment = operations(PolicyConfig.open()).resourcesGet(DEPLOYMENT, "", "web");

        assertThat(deployment.getKind()).isEqualTo("Deployment");
        assertThat(deployment.getMetadata().getName()).isEqualTo("web");
    }

    @Test
    @DisplayName("reports a missing resource with the operation and target")
    void missingResource() {
        ResourceOperations operations = operations(PolicyConfig.open());

        assertThatThrownBy(() -> operations.resourcesGet(DEPLOYMENT, "team-a", "missing"))
                .isInstanceOf(UpstreamApiException.class)
                .hasMessage("failed to get Deployment team-a/missing: not found");
    }

    @Test
    @DisplayName("rejects an empty manifest")
    void emptyManifest() {
        assertThatThrownBy(() -> operations(PolicyConfig.open()).resourcesCreateOrUpdate("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("rejects a document without a kind before applying anything")
    void missingKind() {
        String manifest = String.join("\n",
                "apiVersion: apps/v1",
                "kind: Deployment",
                "metadata:",
                "  name: web",
                "---",
                "apiVersion: v1",
                "metadata:",
                "  name: orphan");

        assertThatThrownBy(() -> operations(PolicyConfig.open()).resourcesCreateOrUpdate(manifest))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("every document must declare apiVersion and kind");
    }

    @Test
    @DisplayName("rejects a denied kind")
    void deniedKind() {
        String manifest = String.join("\n",
                "apiVersion: apps/v1",
                "kind: Deployment",
                "metadata:",
                "  name: web");
        ResourceOperations operations = operations(PolicyConfig.denying(ResourceTypeDescriptor.of("apps", "v1", "")));

        assertThatThrownBy(() -> operations.resourcesCreateOrUpdate(manifest))
                .isInstanceOf(PolicyDeniedException.class)
                .hasMessage("resource not allowed: apps/v1, Kind=Deployment");
    }

    @Test
    @DisplayName("rejects a document without metadata before applying anything")
    void missingMetadata() {
        ResourceOperations operations = operations(PolicyConfig.open());

        assertThatThrownBy(() -> operations.resourcesCreateOrUpdate("apiVersion: v1\nkind: Pod\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("every document must declare metadata.name");
        assertThatThrownBy(() -> operations.resourcesCreateOrUpdate("apiVersion: v1\nkind: Pod\nmetadata:\n  namespace: x\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("every document must declare metadata.name");
    }
}
