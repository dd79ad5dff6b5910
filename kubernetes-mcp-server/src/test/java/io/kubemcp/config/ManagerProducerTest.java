package io.kubemcp.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.kubemcp.policy.PolicyConfig;
import io.kubemcp.policy.ResourceTypeDescriptor;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ManagerProducer")
class ManagerProducerTest {

    private static KubernetesServiceConfig.DeniedResource denied(String group, String version, String kind) {
        return new KubernetesServiceConfig.DeniedResource() {
            @Override
            public Optional<String> group() {
                return Optional.ofNullable(group);
            }

            @Override
            public String version() {
                return version;
            }

            @Override
            public Optional<String> kind() {
                return Optional.ofNullable(kind);
            }
        };
    }

    @Test
    @DisplayName("maps configured entries in order, treating a missing group as core and a missing kind as every kind")
    void mapsDeniedResources() {
        PolicyConfig policy = ManagerProducer.toPolicy(List.of(
                denied(null, "v1", "Secret"),
                denied("rbac.authorization.k8s.io", "v1", null)), true);

        assertThat(policy.deniedResources()).containsExactly(
                ResourceTypeDescriptor.of("", "v1", "Secret"),
                ResourceTypeDescriptor.of("rbac.authorization.k8s.io", "v1", ""));
        assertThat(policy.deniedResources().get(1).isWildcard()).isTrue();
        assertThat(policy.requireOAuth()).isTrue();
    }

    @Test
    @DisplayName("allows everything without configured entries")
    void emptyPolicy() {
        PolicyConfig policy = ManagerProducer.toPolicy(List.of(), false);

        assertThat(policy.deniedResources()).isEmpty();
        assertThat(policy.requireOAuth()).isFalse();
    }
}
