package io.github.kemics.ebay;

/**
 * Raised when a request never produced a response: network failures, cancellation of the call context, or an
 * expired deadline.
 */
public final class TransportException extends EbayException {

    private static final long serialVersionUID = 1L;

    /**
     * Why the exchange did not complete.
     */
    public enum Reason {
        IO,
        CANCELED,
        DEADLINE_EXCEEDED
    }

    private final Reason reason;

    public TransportException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static TransportException canceled(String message) {
        return new TransportException(Reason.CANCELED, message + ": context canceled", null);
    }

    public static TransportException deadlineExceeded(String message) {
        return new TransportException(Reason.DEADLINE_EXCEEDED, message + ": context deadline exceeded", null);
    }

    public Reason reason() {
        return reason;
    }

    public boolean isCanceled() {
        return reason == Reason.CANCELED;
    }

    public boolean isDeadlineExceeded() {
        return reason == Reason.DEADLINE_EXCEEDED;
    }
}
