package io.github.kemics.ebay.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * Represents an issued OAuth2 access token, with the refresh token eBay hands out for the authorization-code grant.
 */
public final class Token {
    private final String accessToken;
    private final String tokenType;
    private final String refreshToken;
    private final Instant expiry;
    private final Instant refreshTokenExpiry;

    public Token(String accessToken, String tokenType, String refreshToken, Instant expiry, Instant refreshTokenExpiry) {
        this.accessToken = accessToken;
        this.tokenType = tokenType;
        this.refreshToken = refreshToken;
        this.expiry = expiry;
        this.refreshTokenExpiry = refreshTokenExpiry;
    }

    public String getAccessToken() {
        return accessToken;
    }

    /**
     * eBay reports descriptive types such as {@code User Access Token}; requests always use the Bearer scheme.
     */
    public String getTokenType() {
        return tokenType;
    }

    /**
     * @return refresh token, or {@code null} for client-credentials tokens.
     */
    public String getRefreshToken() {
        return refreshToken;
    }

    public Instant getExpiry() {
        return expiry;
    }

    public Instant getRefreshTokenExpiry() {
        return refreshTokenExpiry;
    }

    /**
     * @return {@code true} while the access token stays valid for longer than {@code leeway}.
     */
    public boolean isFresh(Duration leeway) {
        if (accessToken == null || accessToken.isBlank()) {
            return false;
        }
        if (expiry == null) {
            return true;
        }
        return Instant.now().isBefore(expiry.minus(leeway));
    }

    public boolean canRefresh() {
        if (refreshToken == null || refreshToken.isBlank()) {
            return false;
        }
        return refreshTokenExpiry == null || Instant.now().isBefore(refreshTokenExpiry);
    }
}
