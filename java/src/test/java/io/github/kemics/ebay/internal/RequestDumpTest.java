package io.github.kemics.ebay.internal;

import io.github.kemics.ebay.ApiRequest;
import io.github.kemics.ebay.EbayClient;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RequestDumpTest {

    @Test
    void rendersRequestLineHeadersAndBody() throws Exception {
        EbayClient client = EbayClient.custom(null, "https://api.ebay.com/");
        ApiRequest request = client.newRequest("POST", "buy/order/v1/checkout?x=1", Map.of("note", "a&b"),
            r -> r.setHeader("X-EBAY-C-MARKETPLACE-ID", "EBAY_US"));

        String expected = "POST /buy/order/v1/checkout?x=1 HTTP/1.1\r\n"
            + "Host: api.ebay.com\r\n"
            + "Accept: application/json\r\n"
            + "Content-Type: application/json\r\n"
            + "X-EBAY-C-MARKETPLACE-ID: EBAY_US\r\n"
            + "\r\n"
            + "{\"note\":\"a&b\"}";
        assertEquals(expected, RequestDump.of(request));
    }

    @Test
    void usesRootPathWhenUrlHasNone() {
        ApiRequest request = ApiRequest.newBuilder("GET", URI.create("http://localhost:8080")).build();
        assertEquals("GET / HTTP/1.1\r\nHost: localhost:8080\r\n\r\n", RequestDump.of(request));
    }
}
