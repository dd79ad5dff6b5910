package io.kubemcp.kubernetes;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.api.model.authorization.v1.SelfSubjectAccessReview;
import io.fabric8.kubernetes.api.model.authorization.v1.SelfSubjectAccessReviewBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.utils.Serialization;
import io.kubemcp.kubernetes.dto.EventInfo;
import io.kubemcp.policy.PolicyDeniedException;
import io.kubemcp.policy.ResourceTypeDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Generic resource operations routed through the access-controlled type mapper.
 * <p>
 * Every call first resolves the requested kind with {@link TypeMapper#restMapping}, so a denied kind fails with
 * {@link PolicyDeniedException} before any request for the resource itself leaves the process.
 */
public class ResourceOperations {

    private static final Logger LOG = Logger.getLogger(ResourceOperations.class);

    static final ResourceTypeDescriptor EVENT = ResourceTypeDescriptor.of("", "v1", "Event");
    static final ResourceTypeDescriptor NAMESPACE = ResourceTypeDescriptor.of("", "v1", "Namespace");

    private static final Pattern DOCUMENT_SEPARATOR = Pattern.compile("\\r?\\n---\\r?\\n");
    private static final String CUSTOM_RESOURCE_DEFINITION = "CustomResourceDefinition";

    private final KubernetesClient client;
    private final TypeMapper typeMapper;
    private final AccessControlClientset clientset;
    private final String defaultNamespace;

    ResourceOperations(KubernetesClient client, TypeMapper typeMapper, AccessControlClientset clientset,
            String defaultNamespace) {
        this.client = client;
        this.typeMapper = typeMapper;
        this.clientset = clientset;
        this.defaultNamespace = defaultNamespace;
    }

    /**
     * Lists resources of the given type. An empty namespace lists across all namespaces, unless the caller may not
     * list cluster-wide, in which case the default namespace is used.
     */
    public GenericKubernetesResourceList resourcesList(ResourceTypeDescriptor type, String namespace, String labelSelector) {
        TypeMapping mapping = typeMapper.restMapping(type.group(), type.kind(), type.version());
        String ns = namespace == null ? "" : namespace.trim();
        if (mapping.namespaced() && ns.isEmpty() && !canIUse(mapping.resource(), "", "list")) {
            ns = defaultNamespace;
        }
        boolean filtered = labelSelector != null && !labelSelector.isBlank();
        var operation = generic(mapping);
        try {
            if (!mapping.namespaced()) {
                return filtered ? operation.withLabelSelector(labelSelector).list() : operation.list();
            }
            if (ns.isEmpty()) {
                var anyNamespace = operation.inAnyNamespace();
                return filtered ? anyNamespace.withLabelSelector(labelSelector).list() : anyNamespace.list();
            }
            var inNamespace = operation.inNamespace(ns);
            return filtered ? inNamespace.withLabelSelector(labelSelector).list() : inNamespace.list();
        } catch (KubernetesClientException e) {
            throw upstream("list " + mapping.resource().resource(), ns, null, e);
        }
    }

    public GenericKubernetesResource resourcesGet(ResourceTypeDescriptor type, String namespace, String name) {
        TypeMapping mapping = typeMapper.restMapping(type.group(), type.kind(), type.version());
        String ns = mapping.namespaced() ? namespaceOrDefault(namespace) : "";
        GenericKubernetesResource resource;
        try {
            resource = mapping.namespaced()
                    ? generic(mapping).inNamespace(ns).withName(name).get()
                    : generic(mapping).withName(name).get();
        } catch (KubernetesClientException e) {
            throw upstream("get " + type.kind(), ns, name, e);
        }
        if (resource == null) {
            throw new UpstreamApiException("get " + type.kind(), UpstreamApiException.target(ns, name), "not found");
        }
        return resource;
    }

    public void resourcesDelete(ResourceTypeDescriptor type, String namespace, String name) {
        TypeMapping mapping = typeMapper.restMapping(type.group(), type.kind(), type.version());
        String ns = mapping.namespaced() ? namespaceOrDefault(namespace) : "";
        List<StatusDetails> deleted;
        try {
            deleted = mapping.namespaced()
                    ? generic(mapping).inNamespace(ns).withName(name).delete()
                    : generic(mapping).withName(name).delete();
        } catch (KubernetesClientException e) {
            throw upstream("delete " + type.kind(), ns, name, e);
        }
        if (deleted == null || deleted.isEmpty()) {
            throw new UpstreamApiException("delete " + type.kind(), UpstreamApiException.target(ns, name), "not found");
        }
    }

    /**
     * Applies every document of a (possibly multi-document) YAML or JSON manifest with server-side apply.
     */
    public List<GenericKubernetesResource> resourcesCreateOrUpdate(String manifest) {
        if (manifest == null || manifest.isBlank()) {
            throw new IllegalArgumentException("resource manifest is empty");
        }
        List<GenericKubernetesResource> parsed = new ArrayList<>();
        for (String document : DOCUMENT_SEPARATOR.split(manifest)) {
            if (document.isBlank()) {
                continue;
            }
            GenericKubernetesResource resource = Serialization.unmarshal(document, GenericKubernetesResource.class);
            if (resource == null || resource.getApiVersion() == null || resource.getKind() == null) {
                throw new IllegalArgumentException("every document must declare apiVersion and kind");
            }
            if (resource.getMetadata() == null || resource.getMetadata().getName() == null
                    || resource.getMetadata().getName().isBlank()) {
                throw new IllegalArgumentException("every document must declare metadata.name");
            }
            parsed.add(resource);
        }
        return resourcesCreateOrUpdate(parsed);
    }

    /**
     * Applies already-built resources in order, stopping at the first failure.
     */
    public List<GenericKubernetesResource> resourcesCreateOrUpdate(List<GenericKubernetesResource> resources) {
        List<GenericKubernetesResource> applied = new ArrayList<>(resources.size());
        for (GenericKubernetesResource resource : resources) {
            applied.add(apply(resource));
        }
        return applied;
    }

    private GenericKubernetesResource apply(GenericKubernetesResource resource) {
        ResourceTypeDescriptor type = ResourceTypeDescriptor.fromApiVersion(resource.getApiVersion(), resource.getKind());
        TypeMapping mapping = typeMapper.restMapping(type.group(), type.kind(), type.version());
        String name = resource.getMetadata().getName();
        String ns = "";
        if (mapping.namespaced()) {
            ns = namespaceOrDefault(resource.getMetadata().getNamespace());
            resource.getMetadata().setNamespace(ns);
        }
        GenericKubernetesResource result;
        try {
            result = mapping.namespaced()
                    ? generic(mapping).inNamespace(ns).resource(resource).serverSideApply()
                    : generic(mapping).resource(resource).serverSideApply();
        } catch (KubernetesClientException e) {
            throw upstream("apply " + type.kind(), ns, name, e);
        }
        if (CUSTOM_RESOURCE_DEFINITION.equals(type.kind())) {
            typeMapper.reset();
        }
        return result;
    }

    /**
     * Events of a namespace, or of every namespace when {@code namespace} is empty.
     */
    public List<EventInfo> eventsList(String namespace) {
        GenericKubernetesResourceList list = resourcesList(EVENT, namespace, null);
        List<EventInfo> events = new ArrayList<>();
        for (GenericKubernetesResource item : Optional.ofNullable(list.getItems()).orElse(List.of())) {
            events.add(toEventInfo(Serialization.unmarshal(Serialization.asJson(item), Event.class)));
        }
        return events;
    }

    public GenericKubernetesResourceList namespacesList() {
        return resourcesList(NAMESPACE, "", null);
    }

    /**
     * Asks the API server whether the current identity may perform {@code verb} on the resource. Any failure,
     * including a denied access review type, is treated as "no".
     */
    boolean canIUse(GroupVersionResource resource, String namespace, String verb) {
        SelfSubjectAccessReview review = new SelfSubjectAccessReviewBuilder()
                .withNewSpec()
                .withNewResourceAttributes()
                .withNamespace(namespace)
                .withVerb(verb)
                .withGroup(resource.group())
                .withVersion(resource.version())
                .withResource(resource.resource())
                .endResourceAttributes()
                .endSpec()
                .build();
        try {
            SelfSubjectAccessReview response = clientset.selfSubjectAccessReviews().create(review);
            return response != null && response.getStatus() != null && Boolean.TRUE.equals(response.getStatus().getAllowed());
        } catch (KubernetesClientException | PolicyDeniedException e) {
            LOG.debugf("Access review for %s %s failed: %s", verb, resource, e.getMessage());
            return false;
        }
    }

    String namespaceOrDefault(String namespace) {
        return namespace == null || namespace.isBlank() ? defaultNamespace : namespace.trim();
    }

    private MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> generic(
            TypeMapping mapping) {
        return client.genericKubernetesResources(mapping.toResourceDefinitionContext());
    }

    private static UpstreamApiException upstream(String operation, String namespace, String name,
            KubernetesClientException cause) {
        LOG.warnf("Failed to %s (%s): %s", operation, UpstreamApiException.target(namespace, name), cause.getMessage());
        return new UpstreamApiException(operation, UpstreamApiException.target(namespace, name), cause);
    }

    static EventInfo toEventInfo(Event event) {
        ObjectReference involved = event.getInvolvedObject();
        return new EventInfo(
                Optional.ofNullable(event.getMetadata()).map(meta -> meta.getNamespace()).orElse(""),
                eventTimestamp(event),
                event.getType(),
                event.getReason(),
                involved != null ? involved.getApiVersion() : "",
                involved != null ? involved.getKind() : "",
                involved != null ? involved.getName() : "",
                event.getMessage() == null ? "" : event.getMessage().trim());
    }

    static String eventTimestamp(Event event) {
        String eventTime = event.getEventTime() == null ? null : event.getEventTime().getTime();
        if (eventTime != null && !eventTime.isEmpty()) {
            return eventTime;
        }
        if (event.getSeries() != null && event.getSeries().getLastObservedTime() != null) {
            return event.getSeries().getLastObservedTime().getTime();
        }
        if (event.getCount() != null && event.getCount() > 1) {
            return event.getLastTimestamp();
        }
        return event.getFirstTimestamp();
    }
}
