package io.kubemcp.kubernetes.dto;

import java.time.Instant;

public record OperationStatus(
        String action,
        String target,
        String message,
        String timestamp) {

    public static OperationStatus completed(String action, String target, String message) {
        return new OperationStatus(action, target, message, Instant.now().toString());
    }
}
