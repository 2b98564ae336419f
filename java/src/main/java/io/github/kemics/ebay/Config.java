package io.github.kemics.ebay;

import io.github.kemics.ebay.auth.OAuth2Endpoint;
import io.github.kemics.ebay.auth.Scopes;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link EbayClient} instances.
 *
 * <p>
 * Client credentials are optional. When both {@code clientId} and {@code clientSecret} are set the client
 * authenticates every call with an application token from the client credentials grant; otherwise requests are sent
 * as-is, which suits callers plugging in their own authenticated transport.
 * </p>
 */
public final class Config {

    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TOKEN_LEEWAY = Duration.ofSeconds(30);

    private final String baseUrl;
    private final boolean sandbox;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final List<String> scopes;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final Duration tokenLeeway;

    private Config(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.sandbox = builder.sandbox;
        this.tokenUrl = builder.tokenUrl;
        this.clientId = builder.clientId;
        this.clientSecret = builder.clientSecret;
        this.scopes = builder.scopes == null ? null : new ArrayList<>(builder.scopes);
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.tokenLeeway = builder.tokenLeeway;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String defaultBaseUrl = sandbox ? EbayClient.SANDBOX_BASE_URL : EbayClient.BASE_URL;
        String resolvedBaseUrl = validateBaseUrl(Optional.ofNullable(trimToNull(baseUrl)).orElse(defaultBaseUrl));

        OAuth2Endpoint endpoint = sandbox ? OAuth2Endpoint.SANDBOX : OAuth2Endpoint.PRODUCTION;
        String resolvedTokenUrl = validateUrl(Optional.ofNullable(trimToNull(tokenUrl)).orElse(endpoint.tokenUrl()));

        String resolvedClientId = trimToNull(clientId);
        String resolvedClientSecret = trimToNull(clientSecret);
        if (resolvedClientId == null && resolvedClientSecret != null) {
            throw new IllegalArgumentException("ClientID is required when ClientSecret is set");
        }
        if (resolvedClientId != null && resolvedClientSecret == null) {
            throw new IllegalArgumentException("ClientSecret is required when ClientID is set");
        }

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        Duration resolvedLeeway = Optional.ofNullable(tokenLeeway).orElse(DEFAULT_TOKEN_LEEWAY);
        if (resolvedLeeway.isNegative() || resolvedLeeway.isZero()) {
            resolvedLeeway = DEFAULT_TOKEN_LEEWAY;
        }

        List<String> resolvedScopes;
        if (scopes == null) {
            resolvedScopes = List.of(Scopes.ROOT);
        } else {
            resolvedScopes = scopes.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .baseUrl(resolvedBaseUrl)
            .sandbox(sandbox)
            .tokenUrl(resolvedTokenUrl)
            .clientId(resolvedClientId)
            .clientSecret(resolvedClientSecret)
            .scopes(resolvedScopes)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .tokenLeeway(resolvedLeeway)
            .buildInternal();
    }

    /**
     * Validates a client base URL: absolute, with a host, and ending in {@code /} so relative paths append to it.
     */
    static String validateBaseUrl(String url) {
        String validated = validateUrl(url);
        if (!validated.endsWith("/")) {
            throw new IllegalArgumentException("BaseURL " + validated + " must have a trailing slash");
        }
        return validated;
    }

    private static String validateUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host: " + trimmed);
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public boolean isSandbox() {
        return sandbox;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public boolean hasClientCredentials() {
        return clientId != null && clientSecret != null;
    }

    public List<String> getScopes() {
        return scopes == null ? List.of() : Collections.unmodifiableList(scopes);
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public Duration getTokenLeeway() {
        return tokenLeeway;
    }

    public static final class Builder {
        private String baseUrl;
        private boolean sandbox;
        private String tokenUrl;
        private String clientId;
        private String clientSecret;
        private List<String> scopes;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private Duration tokenLeeway;

        /**
         * Overrides the API base URL. Must end with a trailing slash.
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        /**
         * Targets the eBay sandbox: switches the default base URL and token URL.
         */
        public Builder sandbox(boolean sandbox) {
            this.sandbox = sandbox;
            return this;
        }

        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder scopes(List<String> scopes) {
            this.scopes = scopes == null ? null : new ArrayList<>(scopes);
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

        public Builder tokenLeeway(Duration tokenLeeway) {
            this.tokenLeeway = tokenLeeway;
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
