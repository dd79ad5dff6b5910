package io.kubemcp.kubernetes;

import io.fabric8.kubernetes.api.model.authentication.TokenReview;
import io.fabric8.kubernetes.api.model.authentication.TokenReviewBuilder;
import io.fabric8.kubernetes.api.model.authentication.TokenReviewStatus;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.kubemcp.auth.RemoteAuthenticationException;
import io.kubemcp.auth.RemoteTokenVerifier;
import io.kubemcp.auth.TokenReviewResult;
import io.kubemcp.policy.PolicyDeniedException;
import org.jboss.logging.Logger;

/**
 * Verifies bearer tokens with a {@code TokenReview} issued through the server's own credentials.
 */
public class TokenReviewVerifier implements RemoteTokenVerifier {

    private static final Logger LOG = Logger.getLogger(TokenReviewVerifier.class);

    private final BaseManager manager;

    public TokenReviewVerifier(BaseManager manager) {
        this.manager = manager;
    }

    @Override
    public TokenReviewResult verify(String token, String audience) throws RemoteAuthenticationException {
        TokenReview request = new TokenReviewBuilder()
                .withNewSpec()
                .withToken(token)
                .addToAudiences(audience)
                .endSpec()
                .build();
        TokenReview response;
        try {
            response = manager.clientset().tokenReviews().create(request);
        } catch (KubernetesClientException | PolicyDeniedException e) {
            LOG.debugf("Token review request failed: %s", e.getMessage());
            throw new RemoteAuthenticationException("failed to create token review", e);
        }
        TokenReviewStatus status = response == null ? null : response.getStatus();
        if (status == null || !Boolean.TRUE.equals(status.getAuthenticated())) {
            String error = status == null ? null : status.getError();
            throw new RemoteAuthenticationException(
                    error != null && !error.isEmpty() ? error : "token authentication failed");
        }
        return new TokenReviewResult(true, status.getUser(), status.getAudiences(), status.getError());
    }
}
