package io.kubemcp.auth;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.jwk.source.JWKSourceBuilder;
import com.nimbusds.jose.proc.BadJOSEException;
import com.nimbusds.jose.proc.JWSVerificationKeySelector;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jose.util.DefaultResourceRetriever;
import com.nimbusds.jose.util.JSONObjectUtils;
import com.nimbusds.jose.util.ResourceRetriever;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.proc.DefaultJWTClaimsVerifier;
import com.nimbusds.jwt.proc.DefaultJWTProcessor;
import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.text.ParseException;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Verifies a bearer token against an OpenID Connect provider: signature against the provider's published keys,
 * issuer, audience and expiry.
 */
public class OidcTokenVerifier {

    private static final Logger LOG = Logger.getLogger(OidcTokenVerifier.class);

    static final String DISCOVERY_PATH = "/.well-known/openid-configuration";

    private static final int CONNECT_TIMEOUT_MS = 5_000;
    private static final int READ_TIMEOUT_MS = 5_000;

    private final String issuer;
    private final DefaultJWTProcessor<SecurityContext> processor;

    public OidcTokenVerifier(String issuer, String audience, JWKSource<SecurityContext> keySource) {
        this.issuer = issuer;
        Set<JWSAlgorithm> algorithms = new LinkedHashSet<>(JWSAlgorithm.Family.RSA);
        algorithms.addAll(JWSAlgorithm.Family.EC);
        this.processor = new DefaultJWTProcessor<>();
        processor.setJWSKeySelector(new JWSVerificationKeySelector<>(algorithms, keySource));
        processor.setJWTClaimsSetVerifier(new DefaultJWTClaimsVerifier<>(audience,
                new JWTClaimsSet.Builder().issuer(issuer).build(), Set.of()));
    }

    /**
     * Reads the provider metadata published under {@code issuerUrl} and verifies tokens against its key set.
     * The metadata must name {@code issuerUrl} as its issuer.
     */
    public static OidcTokenVerifier discover(String issuerUrl, String audience) throws IOException {
        return discover(issuerUrl, audience, new DefaultResourceRetriever(CONNECT_TIMEOUT_MS, READ_TIMEOUT_MS));
    }

    static OidcTokenVerifier discover(String issuerUrl, String audience, ResourceRetriever retriever)
            throws IOException {
        String base = issuerUrl.endsWith("/") ? issuerUrl.substring(0, issuerUrl.length() - 1) : issuerUrl;
        URL discovery = URI.create(base + DISCOVERY_PATH).toURL();
        Map<String, Object> metadata;
        String issuer;
        URI jwksUri;
        try {
            metadata = JSONObjectUtils.parse(retriever.retrieveResource(discovery).getContent());
            issuer = JSONObjectUtils.getString(metadata, "issuer");
            jwksUri = JSONObjectUtils.getURI(metadata, "jwks_uri");
        } catch (ParseException e) {
            throw new IOException("invalid OpenID provider metadata at " + discovery + ": " + e.getMessage(), e);
        }
        if (issuer == null || jwksUri == null) {
            throw new IOException("OpenID provider metadata at " + discovery + " lacks issuer or jwks_uri");
        }
        if (!issuer.equals(issuerUrl)) {
            throw new IOException("OpenID provider issuer did not match: expected " + issuerUrl + " got " + issuer);
        }
        LOG.infof("Verifying tokens against OpenID provider %s (keys at %s)", issuer, jwksUri);
        JWKSource<SecurityContext> keys = JWKSourceBuilder.<SecurityContext>create(jwksUri.toURL(), retriever).build();
        return new OidcTokenVerifier(issuer, audience, keys);
    }

    public String issuer() {
        return issuer;
    }

    public JWTClaimsSet verify(String token) throws OidcVerificationException {
        try {
            return processor.process(token, null);
        } catch (ParseException | BadJOSEException | JOSEException e) {
            throw new OidcVerificationException("OIDC token validation failed: " + e.getMessage(), e);
        }
    }
}
