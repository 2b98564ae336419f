package io.github.kemics.ebay.auth;

import io.github.kemics.ebay.EbayException;

/**
 * Raised when an access token cannot be obtained or refreshed. Keeps "could not authenticate" apart from failures
 * of the authenticated API call itself.
 */
public final class TokenException extends EbayException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String errorCode;

    public TokenException(String message) {
        this(message, null);
    }

    public TokenException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.errorCode = null;
    }

    public TokenException(int statusCode, String errorCode, String description) {
        super(defaultMessage(statusCode, errorCode, description));
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    /**
     * @return HTTP status returned by the token endpoint, or {@code 0} when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return OAuth2 error code such as {@code invalid_client} (nullable).
     */
    public String getErrorCode() {
        return errorCode;
    }

    private static String defaultMessage(int status, String code, String description) {
        StringBuilder message = new StringBuilder("oauth2: cannot fetch token: status ").append(status);
        if (code != null && !code.isBlank()) {
            message.append(" (").append(code).append(')');
        }
        if (description != null && !description.isBlank()) {
            message.append(": ").append(description);
        }
        return message.toString();
    }
}
