package io.kubemcp.kubernetes;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetricsList;
import io.fabric8.kubernetes.client.utils.Serialization;
import io.kubemcp.config.KubernetesServiceConfig;
import io.kubemcp.http.AuthContextResolver;
import io.kubemcp.kubernetes.dto.EventInfo;
import io.kubemcp.kubernetes.dto.OperationStatus;
import io.kubemcp.policy.PolicyDeniedException;
import io.kubemcp.policy.ResourceTypeDescriptor;
import io.quarkiverse.mcp.server.Tool;
import io.quarkiverse.mcp.server.ToolArg;
import io.quarkiverse.mcp.server.ToolCallException;
import io.smallrye.common.annotation.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.function.Function;

@ApplicationScoped
public class KubernetesTools {

    private final BaseManager manager;
    private final KubernetesServiceConfig config;
    private final AuthContextResolver authContexts;
    private final ToolAvailability availability;

    @Inject
    public KubernetesTools(BaseManager manager, KubernetesServiceConfig config, AuthContextResolver authContexts) {
        this.manager = manager;
        this.config = config;
        this.authContexts = authContexts;
        this.availability = ToolAvailability.fromConfig(config);
    }

    /**
     * Runs the action with a manager derived for the current request and turns access, credential and API
     * failures into tool errors. Tools switched off by configuration fail before any manager is derived.
     */
    private <T> T withManager(String tool, ToolAvailability.Kind kind, Function<DerivedManager, T> action) {
        if (!availability.isApplicable(tool, kind)) {
            throw new ToolCallException("tool " + tool + " is not enabled on this server");
        }
        try (DerivedManager derived = manager.derived(authContexts.current())) {
            return action.apply(derived);
        } catch (PolicyDeniedException | MissingCredentialException | UpstreamApiException | TypeNotFoundException
                | IllegalArgumentException e) {
            throw new ToolCallException(e.getMessage());
        }
    }

    private static ResourceTypeDescriptor resourceType(String apiVersion, String kind) {
        if (apiVersion == null || apiVersion.isBlank()) {
            throw new ToolCallException("apiVersion is required");
        }
        if (kind == null || kind.isBlank()) {
            throw new ToolCallException("kind is required");
        }
        return ResourceTypeDescriptor.fromApiVersion(apiVersion.trim(), kind.trim());
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ToolCallException("name is required");
        }
    }

    @Tool(name = "events_list", description = "Lists Kubernetes events (warnings, errors, state changes) for debugging. Leave the namespace empty to list events in every namespace.")
    @Blocking
    public String eventsList(
            @ToolArg(description = "Namespace to read events from.", defaultValue = "") String namespace) {
        List<EventInfo> events = withManager("events_list", ToolAvailability.Kind.READ_ONLY,
                derived -> derived.resources().eventsList(namespace));
        if (events.isEmpty()) {
            return "No events found";
        }
        return "The following events (YAML format) were found:\n" + Serialization.asYaml(events);
    }

    @Tool(name = "namespaces_list", description = "Lists every namespace in the cluster.")
    @Blocking
    public String namespacesList() {
        GenericKubernetesResourceList namespaces = withManager("namespaces_list", ToolAvailability.Kind.READ_ONLY,
                derived -> derived.resources().namespacesList());
        return Serialization.asYaml(namespaces);
    }

    @Tool(name = "resources_list", description = "Lists resources of any kind, e.g. apiVersion=apps/v1 kind=Deployment.")
    @Blocking
    public String resourcesList(
            @ToolArg(description = "apiVersion of the resources (e.g. v1, apps/v1, networking.k8s.io/v1).") String apiVersion,
            @ToolArg(description = "Kind of the resources (e.g. Pod, Service, Deployment).") String kind,
            @ToolArg(description = "Namespace to list from; empty lists every namespace.", defaultValue = "") String namespace,
            @ToolArg(description = "Optional label selector (e.g. app=api,tier!=dev).", defaultValue = "") String labelSelector) {
        ResourceTypeDescriptor type = resourceType(apiVersion, kind);
        GenericKubernetesResourceList list = withManager("resources_list", ToolAvailability.Kind.READ_ONLY,
                derived -> derived.resources().resourcesList(type, namespace, labelSelector));
        return Serialization.asYaml(list);
    }

    @Tool(name = "resources_get", description = "Returns a single resource of any kind by name.")
    @Blocking
    public String resourcesGet(
            @ToolArg(description = "apiVersion of the resource.") String apiVersion,
            @ToolArg(description = "Kind of the resource.") String kind,
            @ToolArg(description = "Namespace of the resource; defaults to the configured namespace.", defaultValue = "") String namespace,
            @ToolArg(description = "Name of the resource.") String name) {
        ResourceTypeDescriptor type = resourceType(apiVersion, kind);
        requireName(name);
        GenericKubernetesResource resource = withManager("resources_get", ToolAvailability.Kind.READ_ONLY,
                derived -> derived.resources().resourcesGet(type, namespace, name));
        return Serialization.asYaml(resource);
    }

    @Tool(name = "resources_delete", description = "Deletes a resource of any kind by name.")
    @Blocking
    public String resourcesDelete(
            @ToolArg(description = "apiVersion of the resource.") String apiVersion,
            @ToolArg(description = "Kind of the resource.") String kind,
            @ToolArg(description = "Namespace of the resource; defaults to the configured namespace.", defaultValue = "") String namespace,
            @ToolArg(description = "Name of the resource.") String name) {
        ResourceTypeDescriptor type = resourceType(apiVersion, kind);
        requireName(name);
        withManager("resources_delete", ToolAvailability.Kind.DESTRUCTIVE, derived -> {
            derived.resources().resourcesDelete(type, namespace, name);
            return null;
        });
        return "Resource deleted successfully";
    }

    @Tool(name = "resources_create_or_update", description = "Creates or updates resources from a YAML or JSON manifest using server-side apply. Separate several documents with ---.")
    @Blocking
    public String resourcesCreateOrUpdate(
            @ToolArg(description = "YAML or JSON manifest.") String resource) {
        List<GenericKubernetesResource> applied = withManager("resources_create_or_update", ToolAvailability.Kind.DESTRUCTIVE,
                derived -> derived.resources().resourcesCreateOrUpdate(resource));
        return "The following resources (YAML) have been created or updated successfully\n" + Serialization.asYaml(applied);
    }

    @Tool(name = "pods_list", description = "Lists pods. Leave the namespace empty to list pods in every namespace.")
    @Blocking
    public String podsList(
            @ToolArg(description = "Namespace to list pods from.", defaultValue = "") String namespace,
            @ToolArg(description = "Optional label selector.", defaultValue = "") String labelSelector) {
        GenericKubernetesResourceList pods = withManager("pods_list", ToolAvailability.Kind.READ_ONLY,
                derived -> derived.pods().list(namespace, labelSelector));
        return Serialization.asYaml(pods);
    }

    @Tool(name = "pods_get", description = "Returns a pod by name.")
    @Blocking
    public String podsGet(
            @ToolArg(description = "Namespace of the pod; defaults to the configured namespace.", defaultValue = "") String namespace,
            @ToolArg(description = "Pod name.") String name) {
        requireName(name);
        GenericKubernetesResource pod = withManager("pods_get", ToolAvailability.Kind.READ_ONLY,
                derived -> derived.pods().get(namespace, name));
        return Serialization.asYaml(pod);
    }

    @Tool(name = "pods_delete", description = "Deletes a pod, along with the services this server created for it.")
    @Blocking
    public String podsDelete(
            @ToolArg(description = "Namespace of the pod; defaults to the configured namespace.", defaultValue = "") String namespace,
            @ToolArg(description = "Pod name.") String name) {
        requireName(name);
        OperationStatus status = withManager("pods_delete", ToolAvailability.Kind.DESTRUCTIVE,
                derived -> derived.pods().delete(namespace, name));
        return Serialization.asYaml(status);
    }

    @Tool(name = "pods_log", description = "Returns the most recent log lines of a pod.")
    @Blocking
    public String podsLog(
            @ToolArg(description = "Namespace of the pod; defaults to the configured namespace.", defaultValue = "") String namespace,
            @ToolArg(description = "Pod name.") String name,
            @ToolArg(description = "Container name (required for multi-container pods).", defaultValue = "") String container,
            @ToolArg(description = "How many log lines to read (defaults to config).", defaultValue = "0") int tailLines) {
        requireName(name);
        int lines = tailLines > 0 ? tailLines : config.logTailLines();
        String log = withManager("pods_log", ToolAvailability.Kind.READ_ONLY,
                derived -> derived.pods().log(namespace, name, container, lines));
        return log.isEmpty() ? "The pod " + name + " has not logged any message yet" : log;
    }

    @Tool(name = "pods_top", description = "Returns CPU and memory usage of pods from the metrics API.")
    @Blocking
    public String podsTop(
            @ToolArg(description = "Namespace of the pods; defaults to the configured namespace.", defaultValue = "") String namespace,
            @ToolArg(description = "Pod name; empty returns every pod of the namespace.", defaultValue = "") String name) {
        PodMetricsList metrics = withManager("pods_top", ToolAvailability.Kind.READ_ONLY,
                derived -> derived.pods().top(namespace, name));
        return Serialization.asYaml(metrics);
    }

    @Tool(name = "pods_exec", description = "Runs a command in a pod container and returns its output, like kubectl exec.")
    @Blocking
    public String podsExec(
            @ToolArg(description = "Namespace of the pod; defaults to the configured namespace.", defaultValue = "") String namespace,
            @ToolArg(description = "Pod name.") String name,
            @ToolArg(description = "Command and its arguments, e.g. [\"ls\", \"-l\", \"/tmp\"].") List<String> command,
            @ToolArg(description = "Container name; defaults to the first container.", defaultValue = "") String container) {
        requireName(name);
        String output = withManager("pods_exec", ToolAvailability.Kind.DESTRUCTIVE,
                derived -> derived.pods().exec(namespace, name, container, command));
        return output.isEmpty() ? "The executed command didn't produce any output" : output;
    }

    @Tool(name = "pods_run", description = "Runs a pod with the given container image, optionally exposing a port through a service.")
    @Blocking
    public String podsRun(
            @ToolArg(description = "Namespace to run the pod in; defaults to the configured namespace.", defaultValue = "") String namespace,
            @ToolArg(description = "Pod name; a random name is generated when empty.", defaultValue = "") String name,
            @ToolArg(description = "Container image to run.") String image,
            @ToolArg(description = "TCP port to expose; 0 exposes none.", defaultValue = "0") int port) {
        if (image == null || image.isBlank()) {
            throw new ToolCallException("image is required");
        }
        List<GenericKubernetesResource> created = withManager("pods_run", ToolAvailability.Kind.MUTATING,
                derived -> derived.pods().run(namespace, name, image, port));
        return "The following resources (YAML) have been created or updated successfully\n" + Serialization.asYaml(created);
    }
}
