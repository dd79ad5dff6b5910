package io.kubemcp.auth;

import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jwt.JWTClaimsSet;
import java.text.ParseException;
import java.time.Clock;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decodes the payload of a JWT and checks expiry and audience locally.
 * <p>
 * The signature is not verified here. This is only a cheap structural filter that runs before the cluster's
 * token review, which remains the sole authority on whether a token is genuine.
 */
public class JwtClaimsParser {

    private static final Pattern BASE64URL = Pattern.compile("[A-Za-z0-9_-]*={0,2}");

    private final Clock clock;

    public JwtClaimsParser() {
        this(Clock.systemUTC());
    }

    public JwtClaimsParser(Clock clock) {
        this.clock = clock;
    }

    public JwtClaims parse(String token) throws TokenStructureInvalidException {
        if (token == null) {
            throw new TokenStructureInvalidException("invalid JWT token format");
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new TokenStructureInvalidException("invalid JWT token format");
        }
        JWTClaimsSet claims = decodePayload(parts[1]);
        try {
            return new JwtClaims(
                    Objects.toString(claims.getIssuer(), ""),
                    new LinkedHashSet<>(claims.getAudience()),
                    expiry(claims.getExpirationTime()),
                    Objects.toString(claims.getStringClaim("scope"), ""));
        } catch (ParseException e) {
            throw new TokenStructureInvalidException("failed to unmarshal JWT claims: " + e.getMessage(), e);
        }
    }

    /**
     * Checks expiry first, then audience membership.
     */
    public void validate(JwtClaims claims, String requiredAudience) throws TokenExpiredException, AudienceMismatchException {
        if (claims.isExpiredAt(clock.instant())) {
            throw new TokenExpiredException(claims.expiry().orElse(0L));
        }
        if (!claims.containsAudience(requiredAudience)) {
            throw new AudienceMismatchException(requiredAudience, claims.audience());
        }
    }

    public JwtClaims parseAndValidate(String token, String requiredAudience) throws TokenAuthenticationException {
        JwtClaims claims = parse(token);
        validate(claims, requiredAudience);
        return claims;
    }

    public static List<String> getScopes(JwtClaims claims) {
        return claims.scopes();
    }

    private static JWTClaimsSet decodePayload(String segment) throws TokenStructureInvalidException {
        if (!BASE64URL.matcher(segment).matches()) {
            throw new TokenStructureInvalidException("failed to decode JWT payload");
        }
        try {
            return JWTClaimsSet.parse(new Base64URL(segment).decodeToString());
        } catch (ParseException e) {
            throw new TokenStructureInvalidException("failed to unmarshal JWT claims", e);
        }
    }

    // exp of zero is treated as absent
    private static Optional<Long> expiry(Date expirationTime) {
        if (expirationTime == null) {
            return Optional.empty();
        }
        long exp = expirationTime.getTime() / 1000L;
        return exp > 0 ? Optional.of(exp) : Optional.empty();
    }
}
