package io.kubemcp.auth;

import io.fabric8.kubernetes.api.model.authentication.UserInfo;
import java.util.List;

/**
 * Outcome of a cluster token review.
 */
public record TokenReviewResult(boolean authenticated, UserInfo userInfo, List<String> audiences, String error) {

    public TokenReviewResult {
        audiences = audiences == null ? List.of() : List.copyOf(audiences);
        error = error == null ? "" : error;
    }

    public String username() {
        return userInfo == null || userInfo.getUsername() == null ? "" : userInfo.getUsername();
    }
}
