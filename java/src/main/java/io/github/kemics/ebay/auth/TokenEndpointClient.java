package io.github.kemics.ebay.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.kemics.ebay.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Performs form-encoded token requests against an eBay token endpoint using HTTP Basic client authentication.
 */
final class TokenEndpointClient {

    private static final Logger LOGGER = Logger.getLogger(TokenEndpointClient.class.getName());

    private final HttpClient httpClient;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final Duration requestTimeout;

    TokenEndpointClient(HttpClient httpClient, String tokenUrl, String clientId, String clientSecret, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.tokenUrl = Objects.requireNonNull(tokenUrl, "tokenUrl");
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.clientSecret = Objects.requireNonNull(clientSecret, "clientSecret");
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Duration.ofSeconds(30) : requestTimeout;
    }

    String clientId() {
        return clientId;
    }

    /**
     * Posts {@code form} to the token endpoint.
     *
     * @param previous token being refreshed; its refresh token is kept when the response omits a new one.
     */
    Token request(Map<String, String> form, Token previous) throws TokenException {
        String grantType = form.get("grant_type");
        LOGGER.info(() -> "[ebay-sdk] requesting " + grantType + " token from " + tokenUrl);

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(buildRequest(form), HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TokenException("request token interrupted", ex);
        } catch (IOException ex) {
            throw new TokenException("request token: " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            byte[] body = bodyStream.readAllBytes();
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw decodeError(response.statusCode(), body);
            }

            JsonNode node = Json.mapper().readTree(body);
            String accessToken = node.path("access_token").asText();
            if (accessToken == null || accessToken.isBlank()) {
                throw new TokenException("token response missing access_token");
            }

            int expiresIn = node.path("expires_in").isInt() ? node.path("expires_in").asInt() : 60;
            if (expiresIn <= 0) {
                expiresIn = 60;
            }
            Instant now = Instant.now();

            String refreshToken = text(node, "refresh_token");
            Instant refreshExpiry = node.path("refresh_token_expires_in").isNumber()
                ? now.plusSeconds(node.path("refresh_token_expires_in").asLong()) : null;
            if (refreshToken == null && previous != null) {
                refreshToken = previous.getRefreshToken();
                refreshExpiry = previous.getRefreshTokenExpiry();
            }

            int lifetime = expiresIn;
            LOGGER.info(() -> "[ebay-sdk] obtained " + grantType + " token valid for " + lifetime + "s");
            return new Token(accessToken, text(node, "token_type"), refreshToken, now.plusSeconds(expiresIn), refreshExpiry);
        } catch (IOException ex) {
            throw new TokenException("decode token response: " + ex.getMessage(), ex);
        }
    }

    private HttpRequest buildRequest(Map<String, String> form) {
        StringBuilder body = new StringBuilder();
        for (Map.Entry<String, String> entry : form.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                continue;
            }
            if (body.length() > 0) {
                body.append('&');
            }
            body.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }

        String credentials = Base64.getEncoder()
            .encodeToString((clientId + ":" + clientSecret).getBytes(StandardCharsets.UTF_8));

        return HttpRequest.newBuilder()
            .uri(URI.create(tokenUrl))
            .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .header("Authorization", "Basic " + credentials)
            .timeout(requestTimeout)
            .build();
    }

    private static TokenException decodeError(int status, byte[] body) {
        if (body.length == 0) {
            return new TokenException(status, null, null);
        }
        try {
            JsonNode node = Json.mapper().readTree(body);
            return new TokenException(status, text(node, "error"), text(node, "error_description"));
        } catch (IOException ex) {
            return new TokenException(status, null, new String(body, StandardCharsets.UTF_8));
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
