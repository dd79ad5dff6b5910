package io.kubemcp.kubernetes;

import io.fabric8.kubernetes.api.model.AuthProviderConfig;
import io.fabric8.kubernetes.api.model.ExecConfig;
import io.fabric8.kubernetes.client.Config;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Describes how to reach the cluster API: endpoint, TLS trust and authentication material.
 * <p>
 * A credential set is either <em>full</em>, as loaded from a kubeconfig or in-cluster configuration, or
 * <em>derived</em> through {@link #derive(String)}. A derived set only ever carries the connection coordinates,
 * TLS trust settings, client tuning and a bearer token; every other authentication field is empty.
 */
public final class ConnectionCredentials {

    public static final String USER_AGENT = "kubernetes-mcp-server";

    private final String host;
    private final String apiPath;
    private final String caCertData;
    private final String caCertFile;
    private final boolean insecureSkipVerify;
    private final String serverName;
    private final Duration timeout;
    private final float qps;
    private final int burst;
    private final String bearerToken;
    private final String bearerTokenFile;
    private final String clientCertFile;
    private final String clientCertData;
    private final String clientKeyFile;
    private final String clientKeyData;
    private final String username;
    private final String password;
    private final AuthProviderConfig authProvider;
    private final ExecConfig execProvider;
    private final Impersonation impersonation;
    private final boolean derived;
    // fabric8 configuration this full set was read from; keeps token refresh behaviour of the ambient config
    private final Config origin;

    private ConnectionCredentials(Builder builder, boolean derived, Config origin) {
        this.host = builder.host;
        this.apiPath = builder.apiPath;
        this.caCertData = builder.caCertData;
        this.caCertFile = builder.caCertFile;
        this.insecureSkipVerify = builder.insecureSkipVerify;
        this.serverName = builder.serverName;
        this.timeout = builder.timeout;
        this.qps = builder.qps;
        this.burst = builder.burst;
        this.bearerToken = builder.bearerToken;
        this.bearerTokenFile = builder.bearerTokenFile;
        this.clientCertFile = builder.clientCertFile;
        this.clientCertData = builder.clientCertData;
        this.clientKeyFile = builder.clientKeyFile;
        this.clientKeyData = builder.clientKeyData;
        this.username = builder.username;
        this.password = builder.password;
        this.authProvider = builder.authProvider;
        this.execProvider = builder.execProvider;
        this.impersonation = builder.impersonation == null ? Impersonation.none() : builder.impersonation;
        this.derived = derived;
        this.origin = origin;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a full credential set from a fabric8 client configuration.
     */
    public static ConnectionCredentials fromConfig(Config config) {
        Objects.requireNonNull(config, "config");
        String token = config.getOauthToken() != null ? config.getOauthToken() : config.getAutoOAuthToken();
        String[] groups = config.getImpersonateGroups();
        Integer requestTimeout = config.getRequestTimeout();
        Integer maxConcurrentRequests = config.getMaxConcurrentRequests();
        Builder builder = builder()
                .host(config.getMasterUrl())
                .apiPath("/api")
                .caCertData(config.getCaCertData())
                .caCertFile(config.getCaCertFile())
                .insecureSkipVerify(Boolean.TRUE.equals(config.isTrustCerts()))
                .timeout(requestTimeout == null ? null : Duration.ofMillis(requestTimeout))
                .burst(maxConcurrentRequests == null ? 0 : maxConcurrentRequests)
                .bearerToken(token)
                .clientCertFile(config.getClientCertFile())
                .clientCertData(config.getClientCertData())
                .clientKeyFile(config.getClientKeyFile())
                .clientKeyData(config.getClientKeyData())
                .username(config.getUsername())
                .password(config.getPassword())
                .authProvider(config.getAuthProvider())
                .impersonation(new Impersonation(
                        config.getImpersonateUsername(),
                        groups == null ? List.of() : Arrays.asList(groups),
                        config.getImpersonateExtras()));
        return new ConnectionCredentials(builder, false, config);
    }

    /**
     * Builds a derived set: copies the connection coordinates, TLS trust and tuning fields and sets the given
     * bearer token. Certificates, keys, basic credentials, auth/exec providers, token files and impersonation are
     * never copied. This instance is left untouched.
     */
    public ConnectionCredentials derive(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("bearer token must not be blank");
        }
        Builder builder = builder()
                .host(host)
                .apiPath(apiPath)
                .caCertData(caCertData)
                .caCertFile(caCertFile)
                .insecureSkipVerify(insecureSkipVerify)
                .serverName(serverName)
                .timeout(timeout)
                .qps(qps)
                .burst(burst)
                .bearerToken(token);
        return new ConnectionCredentials(builder, true, null);
    }

    /**
     * The fabric8 configuration capability clients are built from.
     */
    public Config toConfig() {
        if (origin != null) {
            return origin;
        }
        Config config = Config.empty();
        config.setMasterUrl(host);
        config.setCaCertData(caCertData);
        config.setCaCertFile(caCertFile);
        config.setTrustCerts(insecureSkipVerify);
        config.setDisableHostnameVerification(insecureSkipVerify);
        if (timeout != null && !timeout.isZero()) {
            config.setRequestTimeout((int) timeout.toMillis());
        }
        if (burst > 0) {
            config.setMaxConcurrentRequests(burst);
        }
        config.setOauthToken(bearerToken);
        config.setClientCertFile(clientCertFile);
        config.setClientCertData(clientCertData);
        config.setClientKeyFile(clientKeyFile);
        config.setClientKeyData(clientKeyData);
        config.setUsername(username);
        config.setPassword(password);
        config.setAuthProvider(authProvider);
        if (!impersonation.isEmpty()) {
            config.setImpersonateUsername(impersonation.username());
            config.setImpersonateGroups(impersonation.groups().toArray(new String[0]));
            config.setImpersonateExtras(impersonation.extras());
        }
        config.setUserAgent(USER_AGENT);
        return config;
    }

    public boolean isDerived() {
        return derived;
    }

    public String host() {
        return host;
    }

    public String apiPath() {
        return apiPath;
    }

    public String caCertData() {
        return caCertData;
    }

    public String caCertFile() {
        return caCertFile;
    }

    public boolean insecureSkipVerify() {
        return insecureSkipVerify;
    }

    public String serverName() {
        return serverName;
    }

    public Duration timeout() {
        return timeout;
    }

    public float qps() {
        return qps;
    }

    public int burst() {
        return burst;
    }

    public String bearerToken() {
        return bearerToken;
    }

    public String bearerTokenFile() {
        return bearerTokenFile;
    }

    public String clientCertFile() {
        return clientCertFile;
    }

    public String clientCertData() {
        return clientCertData;
    }

    public String clientKeyFile() {
        return clientKeyFile;
    }

    public String clientKeyData() {
        return clientKeyData;
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    public AuthProviderConfig authProvider() {
        return authProvider;
    }

    public ExecConfig execProvider() {
        return execProvider;
    }

    public Impersonation impersonation() {
        return impersonation;
    }

    @Override
    public String toString() {
        return "ConnectionCredentials[host=" + host + ", derived=" + derived + "]";
    }

    public static final class Builder {

        private String host;
        private String apiPath;
        private String caCertData;
        private String caCertFile;
        private boolean insecureSkipVerify;
        private String serverName;
        private Duration timeout;
        private float qps;
        private int burst;
        private String bearerToken;
        private String bearerTokenFile;
        private String clientCertFile;
        private String clientCertData;
        private String clientKeyFile;
        private String clientKeyData;
        private String username;
        private String password;
        private AuthProviderConfig authProvider;
        private ExecConfig execProvider;
        private Impersonation impersonation;

        private Builder() {
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder apiPath(String apiPath) {
            this.apiPath = apiPath;
            return this;
        }

        public Builder caCertData(String caCertData) {
            this.caCertData = caCertData;
            return this;
        }

        public Builder caCertFile(String caCertFile) {
            this.caCertFile = caCertFile;
            return this;
        }

        public Builder insecureSkipVerify(boolean insecureSkipVerify) {
            this.insecureSkipVerify = insecureSkipVerify;
            return this;
        }

        public Builder serverName(String serverName) {
            this.serverName = serverName;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder qps(float qps) {
            this.qps = qps;
            return this;
        }

        public Builder burst(int burst) {
            this.burst = burst;
            return this;
        }

        public Builder bearerToken(String bearerToken) {
            this.bearerToken = bearerToken;
            return this;
        }

        public Builder bearerTokenFile(String bearerTokenFile) {
            this.bearerTokenFile = bearerTokenFile;
            return this;
        }

        public Builder clientCertFile(String clientCertFile) {
            this.clientCertFile = clientCertFile;
            return this;
        }

        public Builder clientCertData(String clientCertData) {
            this.clientCertData = clientCertData;
            return this;
        }

        public Builder clientKeyFile(String clientKeyFile) {
            this.clientKeyFile = clientKeyFile;
            return this;
        }

        public Builder clientKeyData(String clientKeyData) {
            this.clientKeyData = clientKeyData;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder authProvider(AuthProviderConfig authProvider) {
            this.authProvider = authProvider;
            return this;
        }

        public Builder execProvider(ExecConfig execProvider) {
            this.execProvider = execProvider;
            return this;
        }

        public Builder impersonation(Impersonation impersonation) {
            this.impersonation = impersonation;
            return this;
        }

        /**
         * Builds a full credential set.
         */
        public ConnectionCredentials build() {
            return new ConnectionCredentials(this, false, null);
        }
    }
}
