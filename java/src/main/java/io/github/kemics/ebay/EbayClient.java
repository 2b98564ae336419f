package io.github.kemics.ebay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import io.github.kemics.ebay.auth.ClientCredentialsManager;
import io.github.kemics.ebay.auth.TokenException;
import io.github.kemics.ebay.auth.TokenSource;
import io.github.kemics.ebay.internal.ApiErrorDecoder;
import io.github.kemics.ebay.internal.HttpUtil;
import io.github.kemics.ebay.internal.Json;
import io.github.kemics.ebay.internal.RequestDump;
import io.github.kemics.ebay.transport.HttpTransport;
import io.github.kemics.ebay.transport.JdkHttpTransport;
import io.github.kemics.ebay.transport.OAuth2Transport;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * <p>
 * Manages communication with the eBay API. The client is immutable and thread-safe: create one per process and share
 * it. All per-call state lives in the {@link ApiRequest} and the {@link CallContext} of each call.
 * </p>
 *
 * <h2>Request pipeline</h2>
 * <ol>
 *   <li>{@link #newRequest} resolves a relative path against the base URL, encodes the JSON body and applies
 *       {@link Opt options}.</li>
 *   <li>{@link #execute} dumps the request, sends it through the configured {@link HttpTransport} under the call
 *       context, checks the status and decodes the body.</li>
 * </ol>
 *
 * <p>
 * Authentication is the transport's business. Pass an {@link OAuth2Transport} to the factory methods, or build the
 * client from a {@link Config} carrying client credentials.
 * </p>
 */
public final class EbayClient {

    public static final String BASE_URL = "https://api.ebay.com/";
    public static final String SANDBOX_BASE_URL = "https://api.sandbox.ebay.com/";

    private static final Logger LOGGER = Logger.getLogger(EbayClient.class.getName());

    private final HttpTransport transport;
    private final URI baseUri;
    private final Duration requestTimeout;
    private final BuyApi buy;

    /**
     * Builds a client from configuration. With client credentials present, calls are authenticated through a
     * {@link ClientCredentialsManager}, wrapped in a {@link TokenSource}, behind an {@link OAuth2Transport}.
     */
    public EbayClient(Config config) {
        Objects.requireNonNull(config, "config");
        Config resolved = config.withDefaults();
        HttpTransport base = new JdkHttpTransport(resolved.getHttpClient());
        if (resolved.hasClientCredentials()) {
            ClientCredentialsManager credentials = new ClientCredentialsManager(
                resolved.getHttpClient(),
                resolved.getTokenUrl(),
                resolved.getClientId(),
                resolved.getClientSecret(),
                resolved.getScopes(),
                resolved.getTokenLeeway(),
                resolved.getHttpTimeout()
            );
            base = new OAuth2Transport(base, TokenSource.wrap(credentials));
        }
        this.transport = base;
        this.baseUri = URI.create(resolved.getBaseUrl());
        this.requestTimeout = resolved.getHttpTimeout();
        this.buy = new BuyApi(this);
    }

    private EbayClient(HttpTransport transport, String baseUrl) {
        this.transport = transport == null ? new JdkHttpTransport() : transport;
        this.baseUri = URI.create(baseUrl);
        this.requestTimeout = null;
        this.buy = new BuyApi(this);
    }

    /**
     * Returns a client for the production API. A {@code null} transport falls back to an unauthenticated
     * {@link JdkHttpTransport}.
     */
    public static EbayClient production(HttpTransport transport) {
        return new EbayClient(transport, BASE_URL);
    }

    /**
     * Returns a client for the sandbox API.
     */
    public static EbayClient sandbox(HttpTransport transport) {
        return new EbayClient(transport, SANDBOX_BASE_URL);
    }

    /**
     * Returns a client for a custom base URL, typically a mock server.
     *
     * @throws IllegalArgumentException when {@code baseUrl} is not absolute or lacks the trailing slash.
     */
    public static EbayClient custom(HttpTransport transport, String baseUrl) {
        return new EbayClient(transport, Config.validateBaseUrl(baseUrl));
    }

    /**
     * @return the eBay Buy APIs.
     */
    public BuyApi buy() {
        return buy;
    }

    public URI baseUri() {
        return baseUri;
    }

    /**
     * Creates an API request. {@code path} is resolved against the base URL and must not start with a slash.
     *
     * @param body serialized as JSON when non-null.
     * @throws InvalidPathException when {@code path} starts with a slash; checked before anything else.
     * @throws RequestUrlException when {@code path} is not a valid URI reference.
     * @throws EncodingException when {@code body} cannot be serialized.
     */
    public ApiRequest newRequest(String method, String path, Object body, Opt... opts) throws EbayException {
        return newRequest(method, path, body, opts == null ? List.of() : Arrays.asList(opts));
    }

    public ApiRequest newRequest(String method, String path, Object body, List<Opt> opts) throws EbayException {
        Objects.requireNonNull(path, "path");
        if (path.startsWith("/")) {
            throw new InvalidPathException(path);
        }

        URI resolved;
        try {
            resolved = baseUri.resolve(new URI(path));
        } catch (URISyntaxException | IllegalArgumentException ex) {
            throw new RequestUrlException("resolve " + path + " against " + baseUri + ": " + ex.getMessage(), ex);
        }

        byte[] encoded = null;
        if (body != null) {
            try {
                encoded = Json.mapper().writeValueAsBytes(body);
            } catch (JsonProcessingException ex) {
                throw new EncodingException("encode request body: " + ex.getOriginalMessage(), ex);
            }
        }

        ApiRequest.Builder builder = ApiRequest.newBuilder(method, resolved, encoded)
            .setHeader("Accept", "application/json");
        if (encoded != null) {
            builder.setHeader("Content-Type", "application/json");
        }
        return builder.apply(opts).build();
    }

    /**
     * Sends the request and decodes a successful JSON response into {@code type}.
     *
     * @return the decoded body, or {@code null} when {@code type} is {@code null}.
     * @throws TransportException when no response was received, including cancellation and deadline expiry.
     * @throws EbayApiException when eBay answers with a non-2xx status.
     * @throws DecodingException when a successful body does not match {@code type}.
     * @throws TokenException when an authenticating transport cannot obtain a token.
     */
    public <T> T execute(CallContext ctx, ApiRequest request, Class<T> type) throws EbayException {
        return execute(ctx, request, type == null ? null : Json.mapper().constructType(type));
    }

    public <T> T execute(CallContext ctx, ApiRequest request, TypeReference<T> type) throws EbayException {
        return execute(ctx, request, type == null ? null : Json.mapper().constructType(type));
    }

    /**
     * Sends the request without decoding the body. The body is still read in full.
     */
    public void execute(CallContext ctx, ApiRequest request) throws EbayException {
        execute(ctx, request, (JavaType) null);
    }

    private <T> T execute(CallContext ctx, ApiRequest request, JavaType type) throws EbayException {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(request, "request");

        String dump = RequestDump.of(request);
        HttpResponse<byte[]> response = send(ctx, request);

        Optional<EbayApiException> failure = ApiErrorDecoder.check(request, response, dump);
        if (failure.isPresent()) {
            throw failure.get();
        }
        if (type == null) {
            return null;
        }

        try {
            return Json.mapper().readValue(response.body(), type);
        } catch (IOException ex) {
            throw new DecodingException("decode " + request.method() + " " + request.uri() + " response: "
                + ex.getMessage(), ex);
        }
    }

    private HttpResponse<byte[]> send(CallContext ctx, ApiRequest request) throws EbayException {
        String operation = request.method() + " " + request.uri();
        ctx.throwIfDone(operation);

        HttpRequest httpRequest = HttpUtil.toHttpRequest(request, requestTimeout);
        LOGGER.fine(() -> "[ebay-sdk] " + operation);

        CompletableFuture<HttpResponse<byte[]>> exchange = transport.sendAsync(httpRequest);
        try {
            CompletableFuture<Object> race = CompletableFuture.anyOf(exchange, ctx.cancellation());
            Duration remaining = ctx.remaining();
            if (remaining == null) {
                race.get();
            } else {
                race.get(remaining.toNanos(), TimeUnit.NANOSECONDS);
            }
        } catch (TimeoutException ex) {
            exchange.cancel(true);
            throw TransportException.deadlineExceeded(operation);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            exchange.cancel(true);
            throw new TransportException(TransportException.Reason.CANCELED, operation + " interrupted", ex);
        } catch (CancellationException ex) {
            throw TransportException.canceled(operation);
        } catch (ExecutionException ex) {
            throw translate(operation, ex.getCause());
        }

        if (!exchange.isDone()) {
            exchange.cancel(true);
            throw TransportException.canceled(operation);
        }

        HttpResponse<byte[]> response;
        try {
            response = exchange.getNow(null);
        } catch (CompletionException ex) {
            throw translate(operation, ex.getCause());
        } catch (CancellationException ex) {
            throw TransportException.canceled(operation);
        }
        LOGGER.fine(() -> "[ebay-sdk] " + operation + " -> " + response.statusCode());
        return response;
    }

    private static EbayException translate(String operation, Throwable cause) {
        if (cause instanceof TokenException tokenError) {
            return tokenError;
        }
        if (cause instanceof HttpTimeoutException) {
            return new TransportException(TransportException.Reason.DEADLINE_EXCEEDED,
                operation + ": " + cause.getMessage(), cause);
        }
        if (cause instanceof CancellationException) {
            return new TransportException(TransportException.Reason.CANCELED, operation + ": exchange canceled", cause);
        }
        String detail = cause == null ? "unknown failure" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new TransportException(TransportException.Reason.IO, operation + ": " + detail, cause);
    }
}
