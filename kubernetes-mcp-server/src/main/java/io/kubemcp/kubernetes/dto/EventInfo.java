package io.kubemcp.kubernetes.dto;

public record EventInfo(
        String namespace,
        String timestamp,
        String type,
        String reason,
        String involvedApiVersion,
        String involvedKind,
        String involvedName,
        String message) {
}
