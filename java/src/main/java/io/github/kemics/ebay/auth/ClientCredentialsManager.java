package io.github.kemics.ebay.auth;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TokenProvider implementation performing the OAuth2 client credentials grant, which yields an application access
 * token (no end user involved).
 *
 * <p>
 * Tokens are cached and refreshed once they come within {@code leeway} of their expiry. Concurrent callers hitting
 * an expired token trigger a single request to the token endpoint.
 * </p>
 */
public final class ClientCredentialsManager implements TokenProvider {

    private static final Duration DEFAULT_LEEWAY = Duration.ofSeconds(30);

    private final TokenEndpointClient endpoint;
    private final List<String> scopes;
    private final Duration leeway;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Token cached;

    public ClientCredentialsManager(
        HttpClient httpClient,
        String tokenUrl,
        String clientId,
        String clientSecret,
        List<String> scopes,
        Duration leeway,
        Duration requestTimeout
    ) {
        this.endpoint = new TokenEndpointClient(httpClient, tokenUrl, clientId, clientSecret, requestTimeout);
        this.scopes = scopes == null ? Collections.emptyList() : List.copyOf(scopes);
        this.leeway = leeway == null || leeway.isZero() || leeway.isNegative() ? DEFAULT_LEEWAY : leeway;
    }

    @Override
    public Token token() throws TokenException {
        Token current = cached;
        if (current != null && current.isFresh(leeway)) {
            return current;
        }

        lock.lock();
        try {
            current = cached;
            if (current != null && current.isFresh(leeway)) {
                return current;
            }

            Token fresh = fetchToken();
            cached = fresh;
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidate() {
        cached = null;
    }

    @Override
    public Token forceRefresh() throws TokenException {
        lock.lock();
        try {
            Token fresh = fetchToken();
            cached = fresh;
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    private Token fetchToken() throws TokenException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "client_credentials");
        form.put("scope", joinScopes(scopes));
        return endpoint.request(form, null);
    }

    static String joinScopes(List<String> scopes) {
        return String.join(" ", scopes.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .distinct()
            .toList());
    }
}
