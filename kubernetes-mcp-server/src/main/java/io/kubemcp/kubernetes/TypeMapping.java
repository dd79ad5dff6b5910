package io.kubemcp.kubernetes;

import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import io.kubemcp.policy.ResourceTypeDescriptor;

/**
 * Resolution of a kind to the collection that serves it.
 */
public record TypeMapping(ResourceTypeDescriptor type, GroupVersionResource resource, boolean namespaced,
        String singularName) {

    public ResourceDefinitionContext toResourceDefinitionContext() {
        return new ResourceDefinitionContext.Builder()
                .withGroup(resource.group())
                .withVersion(resource.version())
                .withKind(type.kind())
                .withPlural(resource.resource())
                .withNamespaced(namespaced)
                .build();
    }
}
