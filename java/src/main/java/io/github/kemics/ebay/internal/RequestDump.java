package io.github.kemics.ebay.internal;

import io.github.kemics.ebay.ApiRequest;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Renders a request in HTTP/1.1 wire form (request line, Host, headers, blank line, body) for error reports.
 */
public final class RequestDump {

    private RequestDump() {
    }

    public static String of(ApiRequest request) {
        URI uri = request.uri();
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }

        StringBuilder dump = new StringBuilder();
        dump.append(request.method()).append(' ').append(path).append(" HTTP/1.1\r\n");
        dump.append("Host: ").append(uri.getRawAuthority()).append("\r\n");
        for (Map.Entry<String, List<String>> entry : request.headers().entrySet()) {
            for (String value : entry.getValue()) {
                dump.append(entry.getKey()).append(": ").append(value).append("\r\n");
            }
        }
        dump.append("\r\n");
        if (request.hasBody()) {
            dump.append(new String(request.body(), StandardCharsets.UTF_8));
        }
        return dump.toString();
    }
}
