package io.github.kemics.ebay.auth;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TokenProvider implementation for the OAuth2 authorization code grant, which yields user access tokens.
 *
 * <p>
 * The consent redirect itself happens outside the SDK: send the user to {@link #authorizationUrl(String)}, capture
 * the {@code code} eBay appends to the redirect (the RuName's accept URL), then call {@link #exchange(String)}. From
 * then on {@link #token()} keeps the access token fresh through the refresh token grant. A previously persisted token
 * can be restored with {@link #restore(Token)}.
 * </p>
 */
public final class AuthorizationCodeManager implements TokenProvider {

    private static final Duration DEFAULT_LEEWAY = Duration.ofSeconds(30);

    private final TokenEndpointClient endpoint;
    private final OAuth2Endpoint urls;
    private final String redirectUri;
    private final List<String> scopes;
    private final Duration leeway;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Token cached;
    private volatile boolean stale;

    /**
     * @param redirectUri eBay RuName registered for the application.
     */
    public AuthorizationCodeManager(
        HttpClient httpClient,
        OAuth2Endpoint urls,
        String clientId,
        String clientSecret,
        String redirectUri,
        List<String> scopes,
        Duration leeway,
        Duration requestTimeout
    ) {
        this.urls = Objects.requireNonNull(urls, "urls");
        this.endpoint = new TokenEndpointClient(httpClient, urls.tokenUrl(), clientId, clientSecret, requestTimeout);
        this.redirectUri = Objects.requireNonNull(redirectUri, "redirectUri");
        this.scopes = scopes == null ? Collections.emptyList() : List.copyOf(scopes);
        this.leeway = leeway == null || leeway.isZero() || leeway.isNegative() ? DEFAULT_LEEWAY : leeway;
    }

    /**
     * Builds the consent page URL the user must visit.
     *
     * @param state opaque value echoed back on the redirect; may be {@code null}.
     */
    public String authorizationUrl(String state) {
        StringBuilder url = new StringBuilder(urls.authUrl());
        url.append(urls.authUrl().contains("?") ? '&' : '?')
            .append("client_id=").append(encode(endpoint.clientId()))
            .append("&redirect_uri=").append(encode(redirectUri))
            .append("&response_type=code");
        String scope = ClientCredentialsManager.joinScopes(scopes);
        if (!scope.isEmpty()) {
            url.append("&scope=").append(encode(scope));
        }
        if (state != null && !state.isBlank()) {
            url.append("&state=").append(encode(state));
        }
        return url.toString();
    }

    /**
     * Exchanges an authorization code for an access and refresh token, replacing any token held so far.
     */
    public Token exchange(String code) throws TokenException {
        if (code == null || code.isBlank()) {
            throw new TokenException("authorization code is required");
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("code", code.trim());
        form.put("redirect_uri", redirectUri);

        lock.lock();
        try {
            Token fresh = endpoint.request(form, null);
            cached = fresh;
            stale = false;
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Seeds the manager with a token obtained earlier, typically loaded from the application's own storage.
     */
    public void restore(Token token) {
        lock.lock();
        try {
            cached = Objects.requireNonNull(token, "token");
            stale = false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Token token() throws TokenException {
        Token current = cached;
        if (current != null && !stale && current.isFresh(leeway)) {
            return current;
        }

        lock.lock();
        try {
            current = cached;
            if (current != null && !stale && current.isFresh(leeway)) {
                return current;
            }
            return refresh(current);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the access token as stale. The refresh token is kept so the next call can renew it.
     */
    @Override
    public void invalidate() {
        stale = true;
    }

    @Override
    public Token forceRefresh() throws TokenException {
        lock.lock();
        try {
            return refresh(cached);
        } finally {
            lock.unlock();
        }
    }

    private Token refresh(Token current) throws TokenException {
        if (current == null) {
            throw new TokenException("no token available: exchange an authorization code first");
        }
        if (!current.canRefresh()) {
            throw new TokenException("token expired and no valid refresh token is available");
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", current.getRefreshToken());
        form.put("scope", ClientCredentialsManager.joinScopes(scopes));

        Token fresh = endpoint.request(form, current);
        cached = fresh;
        stale = false;
        return fresh;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
