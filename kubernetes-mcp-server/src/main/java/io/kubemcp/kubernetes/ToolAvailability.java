package io.kubemcp.kubernetes;

import io.kubemcp.config.KubernetesServiceConfig;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Decides which tools are exposed, from the read-only and destructive switches and the explicit allow and
 * deny lists. The deny list wins over the allow list.
 */
public final class ToolAvailability {

    private static final Logger LOG = Logger.getLogger(ToolAvailability.class);

    public enum Kind {
        READ_ONLY,
        MUTATING,
        DESTRUCTIVE
    }

    private final boolean readOnly;
    private final boolean disableDestructive;
    private final Optional<Set<String>> enabledTools;
    private final Set<String> disabledTools;

    public ToolAvailability(boolean readOnly, boolean disableDestructive, Optional<? extends List<String>> enabledTools,
            Optional<? extends List<String>> disabledTools) {
        this.readOnly = readOnly;
        this.disableDestructive = disableDestructive;
        this.enabledTools = enabledTools.map(Set::copyOf);
        this.disabledTools = disabledTools.map(Set::copyOf).orElse(Set.of());
    }

    public static ToolAvailability fromConfig(KubernetesServiceConfig config) {
        ToolAvailability availability = new ToolAvailability(config.readOnly(), config.disableDestructive(),
                config.enabledTools(), config.disabledTools());
        if (availability.readOnly) {
            LOG.info("Read-only mode: only tools that do not modify the cluster are available");
        } else if (availability.disableDestructive) {
            LOG.info("Destructive tools are disabled");
        }
        return availability;
    }

    public static ToolAvailability all() {
        return new ToolAvailability(false, false, Optional.empty(), Optional.empty());
    }

    public boolean isApplicable(String tool, Kind kind) {
        if (readOnly && kind != Kind.READ_ONLY) {
            return false;
        }
        if (disableDestructive && kind == Kind.DESTRUCTIVE) {
            return false;
        }
        if (enabledTools.isPresent() && !enabledTools.get().contains(tool)) {
            return false;
        }
        return !disabledTools.contains(tool);
    }
}
