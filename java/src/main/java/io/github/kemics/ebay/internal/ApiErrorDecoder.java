package io.github.kemics.ebay.internal;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.kemics.ebay.ApiRequest;
import io.github.kemics.ebay.EbayApiException;
import io.github.kemics.ebay.ErrorDetail;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Utility for decoding error payloads from eBay services.
 *
 * <p>
 * Decoding never fails: a body that is empty or not the expected JSON still yields an {@link EbayApiException}
 * carrying the status code and request dump, only with an empty error list.
 * </p>
 */
public final class ApiErrorDecoder {

    private static final Logger LOGGER = Logger.getLogger(ApiErrorDecoder.class.getName());

    private ApiErrorDecoder() {
    }

    /**
     * Checks the API response for errors.
     *
     * @return empty for status codes in [200, 300); the decoded failure otherwise.
     */
    public static Optional<EbayApiException> check(ApiRequest request, HttpResponse<byte[]> response, String requestDump) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return Optional.empty();
        }
        LOGGER.fine(() -> "[ebay-sdk] " + request.method() + " " + request.uri() + " failed with status " + status);
        return Optional.of(decode(status, response.body(), requestDump));
    }

    public static EbayApiException decode(int statusCode, byte[] body, String requestDump) {
        if (body == null || body.length == 0) {
            return new EbayApiException(statusCode, List.of(), requestDump);
        }
        try {
            ErrorResponse payload = Json.mapper().readValue(body, ErrorResponse.class);
            List<ErrorDetail> errors = payload == null || payload.errors() == null
                ? List.of()
                : payload.errors().stream().filter(Objects::nonNull).toList();
            return new EbayApiException(statusCode, errors, requestDump);
        } catch (IOException ex) {
            LOGGER.fine(() -> "[ebay-sdk] error body for status " + statusCode + " is not an eBay error payload: "
                + ex.getMessage());
            return new EbayApiException(statusCode, List.of(), requestDump);
        }
    }

    record ErrorResponse(@JsonProperty("errors") List<ErrorDetail> errors) {
    }
}
