package io.kubemcp.auth;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The subset of JWT claims checked before remote token review.
 */
public record JwtClaims(String issuer, Set<String> audience, Optional<Long> expiry, String scope) {

    public JwtClaims {
        audience = audience == null ? Set.of() : Set.copyOf(audience);
        expiry = expiry == null ? Optional.empty() : expiry;
        scope = scope == null ? "" : scope;
    }

    public boolean containsAudience(String candidate) {
        return audience.contains(candidate);
    }

    public boolean isExpiredAt(Instant now) {
        return expiry.map(exp -> now.getEpochSecond() > exp).orElse(false);
    }

    /**
     * Scope values split on whitespace; blank scope yields an empty list.
     */
    public List<String> scopes() {
        String trimmed = scope.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(trimmed.split("\\s+")).filter(part -> !part.isEmpty()).toList();
    }
}
