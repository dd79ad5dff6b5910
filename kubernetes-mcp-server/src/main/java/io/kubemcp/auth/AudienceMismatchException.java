package io.kubemcp.auth;

import java.util.Collection;
import java.util.List;

public class AudienceMismatchException extends TokenAuthenticationException {

    private final List<String> tokenAudiences;

    public AudienceMismatchException(String requiredAudience, Collection<String> tokenAudiences) {
        super("token audience mismatch: required " + requiredAudience + " but token has "
                + tokenAudiences.stream().sorted().toList());
        this.tokenAudiences = tokenAudiences.stream().sorted().toList();
    }

    public List<String> tokenAudiences() {
        return tokenAudiences;
    }
}
