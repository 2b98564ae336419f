package io.github.kemics.ebay;

import java.util.List;

/**
 * Exception representing a non-2xx response from the eBay API. It carries the HTTP status, the structured error
 * entries decoded from the body (possibly none), and a dump of the originating request for post-mortem logging.
 *
 * <p>Note that the request dump includes every header the client set, so treat it as sensitive.</p>
 */
public final class EbayApiException extends EbayException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final List<ErrorDetail> errors;
    private final String requestDump;

    public EbayApiException(int statusCode, List<ErrorDetail> errors, String requestDump) {
        super(formatMessage(statusCode, errors, requestDump));
        this.statusCode = statusCode;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.requestDump = requestDump == null ? "" : requestDump;
    }

    /**
     * Reports whether {@code err} is an {@link EbayApiException} holding at least one entry whose
     * {@code errorId} matches one of {@code codes}.
     *
     * <p>eBay API docs: https://developer.ebay.com/devzone/xml/docs/Reference/ebay/Errors/errormessages.htm</p>
     *
     * @param err any failure, possibly {@code null}.
     * @param codes eBay error ids to look for.
     * @return {@code false} for {@code null}, for other exception types, and for an empty error list.
     */
    public static boolean isError(Throwable err, int... codes) {
        if (!(err instanceof EbayApiException apiError) || codes == null) {
            return false;
        }
        for (ErrorDetail detail : apiError.errors) {
            for (int code : codes) {
                if (detail.errorId() == code) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * @return HTTP status code returned by the eBay API.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return decoded error entries; empty when the body was missing or not the expected JSON.
     */
    public List<ErrorDetail> getErrors() {
        return errors;
    }

    public String getRequestDump() {
        return requestDump;
    }

    private static String formatMessage(int statusCode, List<ErrorDetail> errors, String requestDump) {
        return statusCode + "\n" + (requestDump == null ? "" : requestDump) + "\n" + (errors == null ? List.of() : errors);
    }
}
