package io.kubemcp.kubernetes.resources;

import static org.assertj.core.api.Assertions.assertThat;

import io.kubemcp.policy.PolicyConfig;
import io.kubemcp.policy.ResourceTypeDescriptor;
import org.junit.jupiter.api.Test;

class ProfileResourcesTest {

    @Test
    void describesOpenPolicy() {
        assertThat(ProfileResources.describe(PolicyConfig.open(), "default"))
                .isEqualTo("Default namespace: default\nOAuth required: false\nDenied resources: none");
    }

    @Test
    void listsDeniedResources() {
        PolicyConfig policy = PolicyConfig.denying(
                ResourceTypeDescriptor.of("", "v1", "Secret"),
                ResourceTypeDescriptor.of("rbac.authorization.k8s.io", "v1", "")).withRequireOAuth(true);

        assertThat(ProfileResources.describe(policy, "team-a"))
                .isEqualTo("Default namespace: team-a\nOAuth required: true\n"
                        + "Denied resources: /v1, Kind=Secret; rbac.authorization.k8s.io/v1, Kind=");
    }
}
