package io.kubemcp.kubernetes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fabric8.kubernetes.api.model.authentication.TokenReviewBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import io.kubemcp.auth.RemoteAuthenticationException;
import io.kubemcp.auth.TokenReviewResult;
import io.kubemcp.policy.PolicyConfig;
import io.kubemcp.policy.PolicyDeniedException;
import io.kubemcp.policy.ResourceTypeDescriptor;
import java.net.HttpURLConnection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@EnableKubernetesMockClient(https = false, crud = false)
@DisplayName("TokenReviewVerifier")
class TokenReviewVerifierTest {

    private static final String TOKEN_REVIEW_PATH = "/apis/authentication.k8s.io/v1/tokenreviews";

    KubernetesMockServer server;
    KubernetesClient client;

    private TokenReviewVerifier verifier(PolicyConfig policy) {
        BaseManager manager = new BaseManager(ConnectionCredentials.fromConfig(client.getConfiguration()), policy,
                BaseManager.DEFAULT_NAMESPACE, config -> client);
        return new TokenReviewVerifier(manager);
    }

    @Test
    @DisplayName("returns the reviewed identity of an authenticated token")
    void authenticated() throws Exception {
        server.expect().post().withPath(TOKEN_REVIEW_PATH)
                .andReturn(HttpURLConnection.HTTP_CREATED, new TokenReviewBuilder()
                        .withNewStatus()
                        .withAuthenticated(true)
                        .withAudiences("kubernetes-mcp-server")
                        .withNewUser().withUsername("alice").withGroups("system:authenticated").endUser()
                        .endStatus()
                        .build())
                .once();

        TokenReviewResult result = verifier(PolicyConfig.open()).verify("caller-token", "kubernetes-mcp-server");

        assertThat(result.authenticated()).isTrue();
        assertThat(result.username()).isEqualTo("alice");
        assertThat(result.audiences()).containsExactly("kubernetes-mcp-server");
        assertThat(server.getLastRequest().getPath()).isEqualTo(TOKEN_REVIEW_PATH);
    }

    @Test
    @DisplayName("fails with the server's reason when the token is not authenticated")
    void notAuthenticated() {
        server.expect().post().withPath(TOKEN_REVIEW_PATH)
                .andReturn(HttpURLConnection.HTTP_CREATED, new TokenReviewBuilder()
                        .withNewStatus()
                        .withAuthenticated(false)
                        .withError("token audiences [other] is invalid for the target audience")
                        .endStatus()
                        .build())
                .once();

        assertThatThrownBy(() -> verifier(PolicyConfig.open()).verify("caller-token", "kubernetes-mcp-server"))
                .isInstanceOf(RemoteAuthenticationException.class)
                .hasMessage("token audiences [other] is invalid for the target audience");
    }

    @Test
    @DisplayName("fails with a generic reason when the server gives none")
    void notAuthenticatedWithoutReason() {
        server.expect().post().withPath(TOKEN_REVIEW_PATH)
                .andReturn(HttpURLConnection.HTTP_CREATED, new TokenReviewBuilder()
                        .withNewStatus().withAuthenticated(false).endStatus()
                        .build())
                .once();

        assertThatThrownBy(() -> verifier(PolicyConfig.open()).verify("caller-token", "kubernetes-mcp-server"))
                .isInstanceOf(RemoteAuthenticationException.class)
                .hasMessage("token authentication failed");
    }

    @Test
    @DisplayName("wraps a failed review request")
    void requestFailure() {
        server.expect().post().withPath(TOKEN_REVIEW_PATH)
                .andReturn(HttpURLConnection.HTTP_FORBIDDEN, "forbidden")
                .once();

        assertThatThrownBy(() -> verifier(PolicyConfig.open()).verify("caller-token", "kubernetes-mcp-server"))
                .isInstanceOf(RemoteAuthenticationException.class)
                .hasMessage("failed to create token review");
    }

    @Test
    @DisplayName("fails without calling the server when token reviews are denied")
    void deniedByPolicy() {
        PolicyConfig policy = PolicyConfig.denying(ResourceTypeDescriptor.of("authentication.k8s.io", "v1", "TokenReview"));

        assertThatThrownBy(() -> verifier(policy).verify("caller-token", "kubernetes-mcp-server"))
                .isInstanceOf(RemoteAuthenticationException.class)
                .hasCauseInstanceOf(PolicyDeniedException.class);
        assertThat(server.getRequestCount()).isZero();
    }
}
