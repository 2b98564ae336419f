package io.github.kemics.ebay;

/**
 * Raised when a relative request path starts with a separator. Resolving such a path against the base URL would
 * silently drop the base path prefix.
 */
public final class InvalidPathException extends EbayException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public InvalidPathException(String path) {
        super("url should always be specified without a preceding slash: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
