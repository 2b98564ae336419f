package io.github.kemics.ebay;

/**
 * Raised when a relative path cannot be resolved against the client base URL.
 */
public final class RequestUrlException extends EbayException {

    private static final long serialVersionUID = 1L;

    public RequestUrlException(String message, Throwable cause) {
        super(message, cause);
    }
}
