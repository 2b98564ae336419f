package io.github.kemics.ebay.transport;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.github.kemics.ebay.CallContext;
import io.github.kemics.ebay.Config;
import io.github.kemics.ebay.EbayApiException;
import io.github.kemics.ebay.EbayClient;
import io.github.kemics.ebay.TransportException;
import io.github.kemics.ebay.auth.Token;
import io.github.kemics.ebay.auth.TokenException;
import io.github.kemics.ebay.auth.TokenProvider;
import io.github.kemics.ebay.browse.Item;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OAuth2TransportTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicInteger apiCalls = new AtomicInteger();
    private final AtomicInteger tokenCalls = new AtomicInteger();
    private volatile String lastAuthorization;
    private volatile int apiStatus = 200;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/buy/browse/v1/item/", exchange -> {
            apiCalls.incrementAndGet();
            lastAuthorization = exchange.getRequestHeaders().getFirst("Authorization");
            if (apiStatus == 200) {
                respond(exchange, 200, "{\"itemId\":\"v1|1|0\"}");
            } else {
                respond(exchange, apiStatus,
                    "{\"errors\":[{\"errorId\":1001,\"domain\":\"OAuth\",\"message\":\"Invalid access token\"}]}");
            }
        });
        server.createContext("/identity/v1/oauth2/token", exchange -> {
            int call = tokenCalls.incrementAndGet();
            exchange.getRequestBody().readAllBytes();
            respond(exchange, 200, "{\"access_token\":\"app-token-" + call + "\",\"expires_in\":7200,"
                + "\"token_type\":\"Application Access Token\"}");
        });
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort() + "/";
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void addsBearerTokenToEveryRequest() throws Exception {
        EbayClient client = EbayClient.custom(new OAuth2Transport(new JdkHttpTransport(), () -> token("abc")), baseUrl);

        fetchItem(client);
        fetchItem(client);

        assertEquals("Bearer abc", lastAuthorization);
        assertEquals(2, apiCalls.get());
    }

    @Test
    void replacesCallerSuppliedAuthorization() throws Exception {
        EbayClient client = EbayClient.custom(new OAuth2Transport(new JdkHttpTransport(), () -> token("abc")), baseUrl);

        client.execute(CallContext.background(),
            client.newRequest("GET", "buy/browse/v1/item/v1%7C1%7C0", null, r -> r.setHeader("Authorization", "Basic x")),
            Item.class);

        assertEquals("Bearer abc", lastAuthorization);
    }

    @Test
    void tokenFailureSurfacesWithoutCallingApi() {
        TokenProvider failing = () -> {
            throw new TokenException(401, "invalid_client", "client authentication failed");
        };
        EbayClient client = EbayClient.custom(new OAuth2Transport(new JdkHttpTransport(), failing), baseUrl);

        TokenException ex = assertThrows(TokenException.class, () -> fetchItem(client));

        assertEquals("invalid_client", ex.getErrorCode());
        assertEquals(0, apiCalls.get());
    }

    @Test
    void unauthorizedResponseInvalidatesToken() {
        AtomicInteger invalidations = new AtomicInteger();
        TokenProvider provider = new TokenProvider() {
            @Override
            public Token token() {
                return OAuth2TransportTest.token("stale");
            }

            @Override
            public void invalidate() {
                invalidations.incrementAndGet();
            }
        };
        apiStatus = 401;
        EbayClient client = EbayClient.custom(new OAuth2Transport(new JdkHttpTransport(), provider), baseUrl);

        EbayApiException ex = assertThrows(EbayApiException.class, () -> fetchItem(client));

        assertEquals(401, ex.getStatusCode());
        assertTrue(EbayApiException.isError(ex, 1001));
        assertEquals(1, invalidations.get());
        assertEquals(1, apiCalls.get());
    }

    @Test
    void configuredClientAuthenticatesWithClientCredentials() throws Exception {
        EbayClient client = new EbayClient(Config.builder()
            .baseUrl(baseUrl)
            .tokenUrl(baseUrl + "identity/v1/oauth2/token")
            .clientId("client-id")
            .clientSecret("client-secret")
            .scopes(List.of("https://api.ebay.com/oauth/api_scope"))
            .build());

        fetchItem(client);
        fetchItem(client);

        assertEquals("Bearer app-token-1", lastAuthorization);
        assertEquals(1, tokenCalls.get());
        assertEquals(2, apiCalls.get());
    }

    @Test
    void configuredClientRefetchesTokenAfterUnauthorized() throws Exception {
        EbayClient client = new EbayClient(Config.builder()
            .baseUrl(baseUrl)
            .tokenUrl(baseUrl + "identity/v1/oauth2/token")
            .clientId("client-id")
            .clientSecret("client-secret")
            .build());

        apiStatus = 401;
        assertThrows(EbayApiException.class, () -> fetchItem(client));
        apiStatus = 200;
        fetchItem(client);

        assertEquals(2, tokenCalls.get());
        assertEquals("Bearer app-token-2", lastAuthorization);
    }

    @Test
    void cancelingCallAbortsDelegateExchange() throws Exception {
        CompletableFuture<HttpResponse<byte[]>> pending = new CompletableFuture<>();
        EbayClient client = EbayClient.custom(new OAuth2Transport(request -> pending, () -> token("abc")), baseUrl);
        CallContext ctx = CallContext.background();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(ctx::cancel, 200, TimeUnit.MILLISECONDS);

            TransportException ex = assertThrows(TransportException.class,
                () -> client.buy().browse().getItem(ctx, "v1|1|0"));

            assertTrue(ex.isCanceled());
            assertTrue(pending.isCancelled());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void cancelingReturnedFutureCancelsDelegate() {
        CompletableFuture<HttpResponse<byte[]>> pending = new CompletableFuture<>();
        OAuth2Transport transport = new OAuth2Transport(request -> pending, () -> token("abc"));

        transport.sendAsync(HttpRequest.newBuilder(URI.create(baseUrl)).build()).cancel(true);

        assertTrue(pending.isCancelled());
    }

    private static Token token(String value) {
        return new Token(value, "Application Access Token", null, Instant.now().plusSeconds(3600), null);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static Item fetchItem(EbayClient client) throws Exception {
        return client.buy().browse().getItem(CallContext.background(), "v1|1|0");
    }
}
