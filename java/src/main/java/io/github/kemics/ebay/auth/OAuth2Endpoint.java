package io.github.kemics.ebay.auth;

/**
 * Authorization and token URLs of an eBay environment.
 *
 * <p>eBay API docs: https://developer.ebay.com/api-docs/static/oauth-tokens.html</p>
 */
public record OAuth2Endpoint(String authUrl, String tokenUrl) {

    public static final OAuth2Endpoint PRODUCTION = new OAuth2Endpoint(
        "https://auth.ebay.com/oauth2/authorize",
        "https://api.ebay.com/identity/v1/oauth2/token"
    );

    public static final OAuth2Endpoint SANDBOX = new OAuth2Endpoint(
        "https://auth.sandbox.ebay.com/oauth2/authorize",
        "https://api.sandbox.ebay.com/identity/v1/oauth2/token"
    );
}
