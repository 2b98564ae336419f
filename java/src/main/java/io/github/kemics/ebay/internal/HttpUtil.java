package io.github.kemics.ebay.internal;

import io.github.kemics.ebay.ApiRequest;

import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Helper methods for turning {@link ApiRequest} values into JDK HTTP requests.
 */
public final class HttpUtil {

    private static final Logger LOGGER = Logger.getLogger(HttpUtil.class.getName());

    // Managed by java.net.http itself; setting them throws IllegalArgumentException.
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private HttpUtil() {
    }

    public static HttpRequest toHttpRequest(ApiRequest request, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(request.uri());

        if (request.hasBody()) {
            builder.method(request.method(), HttpRequest.BodyPublishers.ofByteArray(request.body()));
        } else {
            builder.method(request.method(), HttpRequest.BodyPublishers.noBody());
        }

        for (Map.Entry<String, List<String>> entry : request.headers().entrySet()) {
            if (RESTRICTED_HEADERS.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                LOGGER.fine(() -> "[ebay-sdk] dropping restricted header " + entry.getKey());
                continue;
            }
            for (String value : entry.getValue()) {
                builder.header(entry.getKey(), value);
            }
        }

        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            builder.timeout(timeout);
        }
        return builder.build();
    }
}
