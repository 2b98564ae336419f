package io.github.kemics.ebay;

/**
 * Base exception thrown by the eBay Java SDK.
 */
public class EbayException extends Exception {

    private static final long serialVersionUID = 1L;

    public EbayException(String message) {
        super(message);
    }

    public EbayException(String message, Throwable cause) {
        super(message, cause);
    }
}
