package io.github.kemics.ebay;

/**
 * Raised when a request body cannot be serialized to JSON.
 */
public final class EncodingException extends EbayException {

    private static final long serialVersionUID = 1L;

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
