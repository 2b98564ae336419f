package io.github.kemics.ebay.transport;

import io.github.kemics.ebay.auth.Token;
import io.github.kemics.ebay.auth.TokenException;
import io.github.kemics.ebay.auth.TokenProvider;
import io.github.kemics.ebay.auth.TokenSource;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Transport decorator authenticating every request with an OAuth2 bearer token.
 *
 * <p>
 * Tokens come from the supplied provider, wrapped in a {@link TokenSource}; a provider failure completes the returned
 * future exceptionally with a {@link TokenException} and nothing is sent. A 401 response invalidates the provider's
 * token so the next call fetches a new one; the failed call itself is not retried.
 * </p>
 */
public final class OAuth2Transport implements HttpTransport {

    private static final Logger LOGGER = Logger.getLogger(OAuth2Transport.class.getName());

    private final HttpTransport delegate;
    private final TokenSource tokens;

    public OAuth2Transport(HttpTransport delegate, TokenProvider tokens) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.tokens = TokenSource.wrap(tokens);
    }

    @Override
    public CompletableFuture<HttpResponse<byte[]>> sendAsync(HttpRequest request) {
        Token token;
        try {
            token = tokens.token();
        } catch (TokenException ex) {
            return CompletableFuture.failedFuture(ex);
        }

        HttpRequest authenticated = HttpRequest.newBuilder(request, (name, value) -> !"Authorization".equalsIgnoreCase(name))
            .header("Authorization", "Bearer " + token.getAccessToken())
            .build();

        CompletableFuture<HttpResponse<byte[]>> exchange = delegate.sendAsync(authenticated);
        CompletableFuture<HttpResponse<byte[]>> result = exchange.thenApply(response -> {
            if (response.statusCode() == 401) {
                LOGGER.info(() -> "[ebay-sdk] 401 from " + request.uri() + "; invalidating cached token");
                tokens.invalidate();
            }
            return response;
        });
        // cancelling the returned stage must abort the delegate's exchange
        result.whenComplete((response, error) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }
}
