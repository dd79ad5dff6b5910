package io.kubemcp.kubernetes;

import java.util.List;
import java.util.Map;

/**
 * Impersonation settings of a full credential set.
 */
public record Impersonation(String username, List<String> groups, Map<String, List<String>> extras) {

    private static final Impersonation NONE = new Impersonation(null, List.of(), Map.of());

    public Impersonation {
        groups = groups == null ? List.of() : List.copyOf(groups);
        extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    public static Impersonation none() {
        return NONE;
    }

    public boolean isEmpty() {
        return (username == null || username.isEmpty()) && groups.isEmpty() && extras.isEmpty();
    }
}
