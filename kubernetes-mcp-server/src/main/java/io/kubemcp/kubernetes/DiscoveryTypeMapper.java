package io.kubemcp.kubernetes;

import io.fabric8.kubernetes.api.model.APIGroup;
import io.fabric8.kubernetes.api.model.APIGroupList;
import io.fabric8.kubernetes.api.model.APIResource;
import io.fabric8.kubernetes.api.model.APIResourceList;
import io.fabric8.kubernetes.api.model.GroupVersionForDiscovery;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.kubemcp.policy.ResourceTypeDescriptor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * {@link TypeMapper} backed by the API server's discovery endpoints.
 * <p>
 * The whole API surface is read on first use and cached until {@link #reset()}. Entries are kept in server
 * order: the core group first, then every group with its preferred version ahead of the others.
 */
public class DiscoveryTypeMapper implements TypeMapper {

    private static final Logger LOG = Logger.getLogger(DiscoveryTypeMapper.class);

    private static final String CORE_VERSION = "v1";

    private final KubernetesClient client;
    private volatile List<TypeMapping> mappings;

    public DiscoveryTypeMapper(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public ResourceTypeDescriptor kindFor(GroupVersionResource resource) {
        return kindsFor(resource).get(0);
    }

    @Override
    public List<ResourceTypeDescriptor> kindsFor(GroupVersionResource resource) {
        List<ResourceTypeDescriptor> kinds = matchingResource(resource).stream()
                .map(TypeMapping::type)
                .toList();
        if (kinds.isEmpty()) {
            throw new TypeNotFoundException("no matches for " + resource);
        }
        return kinds;
    }

    @Override
    public GroupVersionResource resourceFor(GroupVersionResource resource) {
        return resourcesFor(resource).get(0);
    }

    @Override
    public List<GroupVersionResource> resourcesFor(GroupVersionResource resource) {
        List<GroupVersionResource> resources = matchingResource(resource).stream()
                .map(TypeMapping::resource)
                .toList();
        if (resources.isEmpty()) {
            throw new TypeNotFoundException("no matches for " + resource);
        }
        return resources;
    }

    @Override
    public TypeMapping restMapping(String group, String kind, String... versions) {
        return restMappings(group, kind, versions).get(0);
    }

    @Override
    public List<TypeMapping> restMappings(String group, String kind, String... versions) {
        String normalizedGroup = group == null ? "" : group;
        List<TypeMapping> candidates = mappings().stream()
                .filter(mapping -> mapping.type().group().equals(normalizedGroup))
                .filter(mapping -> mapping.type().kind().equals(kind))
                .toList();
        List<String> requested = versions == null ? List.of()
                : Arrays.stream(versions).filter(v -> v != null && !v.isEmpty()).toList();
        List<TypeMapping> result;
        if (requested.isEmpty()) {
            result = candidates;
        } else {
            result = new ArrayList<>();
            for (String version : requested) {
                candidates.stream()
                        .filter(mapping -> mapping.type().version().equals(version))
                        .forEach(result::add);
            }
        }
        if (result.isEmpty()) {
            String gk = normalizedGroup.isEmpty() ? kind : kind + "." + normalizedGroup;
            throw new TypeNotFoundException("no matches for kind \"" + gk + "\" in versions " + requested);
        }
        return List.copyOf(result);
    }

    @Override
    public String resourceSingularizer(String resource) {
        return mappings().stream()
                .filter(mapping -> mapping.resource().resource().equals(resource))
                .map(TypeMapping::singularName)
                .filter(singular -> singular != null && !singular.isEmpty())
                .findFirst()
                .orElseGet(() -> mappings().stream()
                        .filter(mapping -> mapping.resource().resource().equals(resource))
                        .findFirst()
                        .map(mapping -> mapping.type().kind().toLowerCase(Locale.ROOT))
                        .orElseThrow(() -> new TypeNotFoundException("no matches for resource " + resource)));
    }

    @Override
    public void reset() {
        LOG.debug("Resetting discovery cache");
        mappings = null;
    }

    /**
     * Whether the server exposes the given group/version.
     */
    public boolean supportsGroupVersion(String groupVersion) {
        return mappings().stream().anyMatch(mapping -> mapping.resource().groupVersion().equals(groupVersion));
    }

    private List<TypeMapping> matchingResource(GroupVersionResource key) {
        return mappings().stream()
                .filter(mapping -> key.matches(mapping.resource()))
                .toList();
    }

    private List<TypeMapping> mappings() {
        List<TypeMapping> current = mappings;
        if (current == null) {
            synchronized (this) {
                current = mappings;
                if (current == null) {
                    current = discover();
                    mappings = current;
                }
            }
        }
        return current;
    }

    private List<TypeMapping> discover() {
        List<TypeMapping> discovered = new ArrayList<>();
        try {
            addGroupVersion(discovered, "", CORE_VERSION);
            APIGroupList groups = client.getApiGroups();
            List<APIGroup> items = groups == null || groups.getGroups() == null ? List.of() : groups.getGroups();
            for (APIGroup group : items) {
                for (String version : versionsPreferredFirst(group)) {
                    addGroupVersion(discovered, group.getName(), version);
                }
            }
        } catch (KubernetesClientException e) {
            LOG.warnf("API discovery failed: %s", e.getMessage());
            throw new UpstreamApiException("discover API resources", "", e);
        }
        LOG.debugf("Discovered %d resource types", discovered.size());
        return List.copyOf(discovered);
    }

    private static List<String> versionsPreferredFirst(APIGroup group) {
        List<String> versions = new ArrayList<>();
        Optional.ofNullable(group.getPreferredVersion())
                .map(GroupVersionForDiscovery::getVersion)
                .ifPresent(versions::add);
        if (group.getVersions() != null) {
            for (GroupVersionForDiscovery version : group.getVersions()) {
                if (version.getVersion() != null && !versions.contains(version.getVersion())) {
                    versions.add(version.getVersion());
                }
            }
        }
        return versions;
    }

    private void addGroupVersion(List<TypeMapping> target, String group, String version) {
        String groupVersion = group.isEmpty() ? version : group + "/" + version;
        APIResourceList resources;
        try {
            resources = client.getApiResources(groupVersion);
        } catch (KubernetesClientException e) {
            if (group.isEmpty()) {
                throw e;
            }
            // aggregated APIs (e.g. metrics) can be temporarily unavailable
            LOG.debugf("Skipping %s: %s", groupVersion, e.getMessage());
            return;
        }
        if (resources == null || resources.getResources() == null) {
            return;
        }
        for (APIResource resource : resources.getResources()) {
            if (resource.getName() == null || resource.getName().contains("/")) {
                continue;
            }
            target.add(new TypeMapping(
                    ResourceTypeDescriptor.of(group, version, resource.getKind()),
                    GroupVersionResource.of(group, version, resource.getName()),
                    Boolean.TRUE.equals(resource.getNamespaced()),
                    resource.getSingularName()));
        }
    }
}
