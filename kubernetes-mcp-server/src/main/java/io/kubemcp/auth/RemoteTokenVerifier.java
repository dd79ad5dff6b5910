package io.kubemcp.auth;

/**
 * Authoritative token check performed by the cluster's authentication API.
 */
public interface RemoteTokenVerifier {

    /**
     * Reviews the token for the given audience. Implementations do not retry and fail with
     * {@link RemoteAuthenticationException} both for transport errors and for unauthenticated reviews.
     */
    TokenReviewResult verify(String token, String audience) throws RemoteAuthenticationException;
}
