package io.kubemcp.kubernetes;

import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetricsList;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.ExecWatch;
import io.fabric8.kubernetes.client.dsl.PodResource;
import io.fabric8.kubernetes.client.utils.Serialization;
import io.kubemcp.kubernetes.dto.OperationStatus;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jboss.logging.Logger;

/**
 * Pod operations. Listing and reading go through the generic resource path, everything else through the
 * access-controlled clientset.
 */
public class PodOperations {

    private static final Logger LOG = Logger.getLogger(PodOperations.class);

    static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";
    static final String NAME_LABEL = "app.kubernetes.io/name";
    static final String COMPONENT_LABEL = "app.kubernetes.io/component";
    static final String PART_OF_LABEL = "app.kubernetes.io/part-of";
    static final String MANAGED_BY_VALUE = "kubernetes-mcp-server";
    static final String RUN_PREFIX = MANAGED_BY_VALUE + "-run-";
    static final String PART_OF_VALUE = MANAGED_BY_VALUE + "-run-sandbox";

    private static final String NAME_ALPHABET = "bcdfghjklmnpqrstvwxz2456789";
    private static final Duration EXEC_TIMEOUT = Duration.ofMinutes(1);

    private final AccessControlClientset clientset;
    private final ResourceOperations resources;

    PodOperations(AccessControlClientset clientset, ResourceOperations resources) {
        this.clientset = clientset;
        this.resources = resources;
    }

    public GenericKubernetesResourceList list(String namespace, String labelSelector) {
        return resources.resourcesList(AccessControlClientset.POD, namespace, labelSelector);
    }

    public GenericKubernetesResource get(String namespace, String name) {
        return resources.resourcesGet(AccessControlClientset.POD, namespace, name);
    }

    /**
     * Deletes the pod together with the services this server created for it.
     */
    public OperationStatus delete(String namespace, String name) {
        String ns = resources.namespaceOrDefault(namespace);
        String target = UpstreamApiException.target(ns, name);
        try {
            PodResource podResource = clientset.pods(ns).withName(name);
            Pod pod = podResource.get();
            if (pod == null) {
                throw new UpstreamApiException("delete pod", target, "not found");
            }
            Map<String, String> labels = Optional.ofNullable(pod.getMetadata().getLabels()).orElse(Map.of());
            if (MANAGED_BY_VALUE.equals(labels.get(MANAGED_BY_LABEL))) {
                String appName = labels.getOrDefault(NAME_LABEL, "");
                clientset.services(ns)
                        .withLabels(Map.of(MANAGED_BY_LABEL, MANAGED_BY_VALUE, NAME_LABEL, appName))
                        .delete();
                LOG.debugf("Deleted managed services of pod %s", target);
            }
            podResource.delete();
        } catch (KubernetesClientException e) {
            LOG.warnf("Failed to delete pod %s: %s", target, e.getMessage());
            throw new UpstreamApiException("delete pod", target, e);
        }
        return OperationStatus.completed("delete", "Pod " + target, "Pod deleted successfully");
    }

    /**
     * Recent log lines of the pod. A blank container reads the pod's only container.
     */
    public String log(String namespace, String name, String container, int tailLines) {
        String ns = resources.namespaceOrDefault(namespace);
        PodResource podResource = clientset.pods(ns).withName(name);
        try {
            String log = container != null && !container.isBlank()
                    ? podResource.inContainer(container).tailingLines(tailLines).getLog()
                    : podResource.tailingLines(tailLines).getLog();
            return log == null ? "" : log;
        } catch (KubernetesClientException e) {
            String target = UpstreamApiException.target(ns, name);
            LOG.warnf("Failed to read log of pod %s: %s", target, e.getMessage());
            throw new UpstreamApiException("get log of pod", target, e);
        }
    }

    /**
     * Runs a command in a container and returns its standard output, or its standard error when nothing was
     * written to standard output. A blank container targets the pod's first container.
     */
    public String exec(String namespace, String name, String container, List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command is required");
        }
        String ns = resources.namespaceOrDefault(namespace);
        String target = UpstreamApiException.target(ns, name);
        Pod pod;
        try {
            pod = clientset.pods(ns).withName(name).get();
        } catch (KubernetesClientException e) {
            throw new UpstreamApiException("get pod", target, e);
        }
        if (pod == null) {
            throw new UpstreamApiException("get pod", target, "not found");
        }
        String phase = pod.getStatus() == null ? null : pod.getStatus().getPhase();
        if ("Succeeded".equals(phase) || "Failed".equals(phase)) {
            throw new IllegalArgumentException(
                    "cannot exec into a container in a completed pod; current phase is " + phase);
        }
        String containerName = container != null && !container.isBlank()
                ? container
                : pod.getSpec().getContainers().get(0).getName();

        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        try (ExecWatch watch = clientset.podExec(ns, name, containerName)
                .writingOutput(stdout)
                .writingError(stderr)
                .exec(command.toArray(String[]::new))) {
            watch.exitCode().get(EXEC_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (KubernetesClientException | ExecutionException | TimeoutException e) {
            LOG.warnf("Failed to exec in pod %s: %s", target, e.getMessage());
            throw new UpstreamApiException("exec in pod", target, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamApiException("exec in pod", target, e);
        }
        if (stdout.size() > 0) {
            return stdout.toString(StandardCharsets.UTF_8);
        }
        return stderr.toString(StandardCharsets.UTF_8);
    }

    /**
     * Starts a pod running the image, plus a ClusterIP service when a port is given. A blank name gets a
     * generated one.
     */
    public List<GenericKubernetesResource> run(String namespace, String name, String image, int port) {
        if (image == null || image.isBlank()) {
            throw new IllegalArgumentException("image is required");
        }
        String ns = resources.namespaceOrDefault(namespace);
        String podName = name == null || name.isBlank() ? RUN_PREFIX + randomSuffix() : name;
        Map<String, String> labels = Map.of(
                NAME_LABEL, podName,
                COMPONENT_LABEL, podName,
                MANAGED_BY_LABEL, MANAGED_BY_VALUE,
                PART_OF_LABEL, PART_OF_VALUE);

        ContainerBuilder containerBuilder = new ContainerBuilder()
                .withName(podName)
                .withImage(image)
                .withImagePullPolicy("Always");
        if (port > 0) {
            containerBuilder.addNewPort().withContainerPort(port).endPort();
        }
        List<HasMetadata> toApply = new ArrayList<>();
        toApply.add(new PodBuilder()
                .withNewMetadata().withName(podName).withNamespace(ns).withLabels(labels).endMetadata()
                .withNewSpec().withContainers(containerBuilder.build()).endSpec()
                .build());
        if (port > 0) {
            toApply.add(new ServiceBuilder()
                    .withNewMetadata().withName(podName).withNamespace(ns).withLabels(labels).endMetadata()
                    .withNewSpec()
                    .withSelector(labels)
                    .withType("ClusterIP")
                    .addNewPort().withPort(port).withTargetPort(new IntOrString(port)).endPort()
                    .endSpec()
                    .build());
        }
        List<GenericKubernetesResource> generic = new ArrayList<>(toApply.size());
        for (HasMetadata resource : toApply) {
            generic.add(Serialization.unmarshal(Serialization.asJson(resource), GenericKubernetesResource.class));
        }
        LOG.debugf("Running image %s as pod %s", image, UpstreamApiException.target(ns, podName));
        return resources.resourcesCreateOrUpdate(generic);
    }

    private static String randomSuffix() {
        StringBuilder suffix = new StringBuilder(5);
        for (int i = 0; i < 5; i++) {
            suffix.append(NAME_ALPHABET.charAt(ThreadLocalRandom.current().nextInt(NAME_ALPHABET.length())));
        }
        return suffix.toString();
    }

    public PodMetricsList top(String namespace, String name) {
        String ns = resources.namespaceOrDefault(namespace);
        try {
            return clientset.podMetrics(ns, name);
        } catch (KubernetesClientException e) {
            String target = UpstreamApiException.target(ns, name);
            LOG.warnf("Failed to read metrics of %s: %s", target, e.getMessage());
            throw new UpstreamApiException("get pod metrics", target, e);
        }
    }
}
