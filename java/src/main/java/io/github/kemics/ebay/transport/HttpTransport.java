package io.github.kemics.ebay.transport;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

/**
 * Sends HTTP requests on behalf of the client. Implementations must be safe for concurrent use.
 *
 * <p>
 * The returned future completes once the whole response body has been read, so cancelling it aborts the exchange
 * and nothing is left holding a connection. Decorators such as {@link OAuth2Transport} can add credentials.
 * </p>
 */
@FunctionalInterface
public interface HttpTransport {

    CompletableFuture<HttpResponse<byte[]>> sendAsync(HttpRequest request);
}
