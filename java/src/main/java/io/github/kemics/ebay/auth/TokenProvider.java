package io.github.kemics.ebay.auth;

import io.github.kemics.ebay.EbayException;

/**
 * Contract for obtaining access tokens. Implementations own caching and refresh policy.
 */
public interface TokenProvider {

    Token token() throws EbayException;

    default void invalidate() {
        // default no-op
    }

    default Token forceRefresh() throws EbayException {
        invalidate();
        return token();
    }
}
