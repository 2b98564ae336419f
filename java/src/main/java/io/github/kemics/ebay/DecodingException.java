package io.github.kemics.ebay;

/**
 * Raised when a successful response body does not parse into the expected type. This is a client-side failure,
 * not an API error, even though the HTTP status signalled success.
 */
public final class DecodingException extends EbayException {

    private static final long serialVersionUID = 1L;

    public DecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
