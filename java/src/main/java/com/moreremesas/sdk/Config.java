package com.moreremesas.sdk;

import com.moreremesas.sdk.internal.Redaction;
import com.moreremesas.sdk.xml.ForceListRegistry;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link RemesasClient} instances.
 */
public final class Config {

    public static final String DEFAULT_HOST = "https://www.moresistemas.com:7002";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_RETRIES = 3;
    public static final Duration DEFAULT_BACKOFF = Duration.ofMillis(500);

    private final String host;
    private final boolean sandbox;
    private final String loginUser;
    private final String loginPass;
    private final String accessKey;
    private final boolean autoAuth;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final Integer retries;
    private final Duration backoff;
    private final EndpointPaths paths;
    private final ForceListRegistry forceList;
    private final Clock clock;

    private Config(Builder builder) {
        this.host = builder.host;
        this.sandbox = builder.sandbox;
        this.loginUser = builder.loginUser;
        this.loginPass = builder.loginPass;
        this.accessKey = builder.accessKey;
        this.autoAuth = builder.autoAuth;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.retries = builder.retries;
        this.backoff = builder.backoff;
        this.paths = builder.paths;
        this.forceList = builder.forceList;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves every unset option to its default and validates the rest.
     *
     * @throws IllegalArgumentException when the host is not an absolute URL, retries is below one or the backoff is
     *                                  negative.
     */
    public Config withDefaults() {
        String resolvedHost = sanitizeUrl(Optional.ofNullable(host).orElse(DEFAULT_HOST));

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        int resolvedRetries = Optional.ofNullable(retries).orElse(DEFAULT_RETRIES);
        if (resolvedRetries < 1) {
            throw new IllegalArgumentException("Retries must be at least 1");
        }

        Duration resolvedBackoff = Optional.ofNullable(backoff).orElse(DEFAULT_BACKOFF);
        if (resolvedBackoff.isNegative()) {
            throw new IllegalArgumentException("Backoff cannot be negative");
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        EndpointPaths resolvedPaths = paths;
        if (resolvedPaths == null) {
            resolvedPaths = sandbox ? EndpointPaths.sandbox() : EndpointPaths.production();
        }

        return new Builder()
            .host(resolvedHost)
            .sandbox(sandbox)
            .loginUser(loginUser)
            .loginPass(loginPass)
            .accessKey(accessKey)
            .autoAuth(autoAuth)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .retries(resolvedRetries)
            .backoff(resolvedBackoff)
            .paths(resolvedPaths)
            .forceList(Optional.ofNullable(forceList).orElseGet(ForceListRegistry::defaults))
            .clock(Optional.ofNullable(clock).orElseGet(Clock::systemUTC))
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Host must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("Host must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid host URL: " + trimmed, ex);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getHost() {
        return host;
    }

    public boolean isSandbox() {
        return sandbox;
    }

    public String getLoginUser() {
        return loginUser;
    }

    public String getLoginPass() {
        return loginPass;
    }

    public String getAccessKey() {
        return accessKey;
    }

    public boolean isAutoAuth() {
        return autoAuth;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public int getRetries() {
        return retries == null ? DEFAULT_RETRIES : retries;
    }

    public Duration getBackoff() {
        return backoff;
    }

    public EndpointPaths getPaths() {
        return paths;
    }

    public ForceListRegistry getForceList() {
        return forceList;
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public String toString() {
        return "Config{host=" + host
            + ", sandbox=" + sandbox
            + ", loginUser=" + Redaction.redact(loginUser)
            + ", loginPass=" + (loginPass == null ? null : "******")
            + ", accessKey=" + Redaction.redact(accessKey)
            + ", autoAuth=" + autoAuth
            + ", httpTimeout=" + httpTimeout
            + ", retries=" + retries
            + ", backoff=" + backoff + "}";
    }

    public static final class Builder {
        private String host;
        private boolean sandbox = true;
        private String loginUser;
        private String loginPass;
        private String accessKey;
        private boolean autoAuth = true;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private Integer retries;
        private Duration backoff;
        private EndpointPaths paths;
        private ForceListRegistry forceList;
        private Clock clock;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /**
         * Selects the homologation path table (the default) or the production one. Ignored when {@link #paths} is set.
         */
        public Builder sandbox(boolean sandbox) {
            this.sandbox = sandbox;
            return this;
        }

        public Builder loginUser(String loginUser) {
            this.loginUser = loginUser;
            return this;
        }

        public Builder loginPass(String loginPass) {
            this.loginPass = loginPass;
            return this;
        }

        /**
         * Operator supplied {@code AccessKey}. When unset the session token is sent as the key.
         */
        public Builder accessKey(String accessKey) {
            this.accessKey = accessKey;
            return this;
        }

        public Builder autoAuth(boolean autoAuth) {
            this.autoAuth = autoAuth;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        /**
         * Total number of attempts per request, including the first.
         */
        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder backoff(Duration backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder paths(EndpointPaths paths) {
            this.paths = paths;
            return this;
        }

        public Builder forceList(ForceListRegistry forceList) {
            this.forceList = forceList;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
