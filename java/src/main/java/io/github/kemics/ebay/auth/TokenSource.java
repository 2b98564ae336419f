package io.github.kemics.ebay.auth;

import io.github.kemics.ebay.EbayException;

import java.util.Objects;

/**
 * Wraps a {@link TokenProvider} so every failure to obtain a token surfaces as a {@link TokenException}.
 *
 * <p>
 * The wrapper holds no token of its own: caching and refresh stay with the wrapped provider. Its only job is to let
 * callers tell "could not authenticate" apart from "the authenticated call failed".
 * </p>
 */
public final class TokenSource implements TokenProvider {

    private final TokenProvider delegate;

    private TokenSource(TokenProvider delegate) {
        this.delegate = delegate;
    }

    public static TokenSource wrap(TokenProvider provider) {
        Objects.requireNonNull(provider, "provider");
        if (provider instanceof TokenSource source) {
            return source;
        }
        return new TokenSource(provider);
    }

    @Override
    public Token token() throws TokenException {
        Token token;
        try {
            token = delegate.token();
        } catch (TokenException ex) {
            throw ex;
        } catch (EbayException | RuntimeException ex) {
            throw new TokenException("oauth2: cannot fetch token: " + ex.getMessage(), ex);
        }
        if (token == null || token.getAccessToken() == null || token.getAccessToken().isBlank()) {
            throw new TokenException("oauth2: token provider returned no access token");
        }
        return token;
    }

    @Override
    public void invalidate() {
        delegate.invalidate();
    }

    @Override
    public Token forceRefresh() throws TokenException {
        try {
            return delegate.forceRefresh();
        } catch (TokenException ex) {
            throw ex;
        } catch (EbayException | RuntimeException ex) {
            throw new TokenException("oauth2: cannot refresh token: " + ex.getMessage(), ex);
        }
    }
}
