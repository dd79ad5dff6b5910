package io.kubemcp.kubernetes;

import io.fabric8.kubernetes.client.KubernetesClientException;

/**
 * Failure of a cluster API call, prefixed with the operation and the object it targeted.
 */
public class UpstreamApiException extends RuntimeException {

    private final String operation;
    private final int code;

    public UpstreamApiException(String operation, String target, Throwable cause) {
        super(describe(operation, target) + ": " + reason(cause), cause);
        this.operation = operation;
        this.code = cause instanceof KubernetesClientException kce ? kce.getCode() : 0;
    }

    public UpstreamApiException(String operation, String target, String reason) {
        super(describe(operation, target) + ": " + reason);
        this.operation = operation;
        this.code = 0;
    }

    private static String reason(Throwable cause) {
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }

    private static String describe(String operation, String target) {
        return target == null || target.isEmpty() ? "failed to " + operation : "failed to " + operation + " " + target;
    }

    public String operation() {
        return operation;
    }

    /**
     * HTTP status reported by the API server, or {@code 0} when none was received.
     */
    public int code() {
        return code;
    }

    static String target(String namespace, String name) {
        if (namespace == null || namespace.isEmpty()) {
            return name == null ? "" : name;
        }
        return name == null || name.isEmpty() ? "in namespace " + namespace : namespace + "/" + name;
    }
}
