package io.github.kemics.ebay;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Fully-formed outgoing request: method, absolute URL, optional JSON body and headers.
 *
 * <p>
 * Instances are immutable and built once per call by {@link EbayClient#newRequest}. Per-request {@link Opt options}
 * only ever see the {@link Builder}, which exposes header and query mutators but no way to change the method, the
 * resolved URL or the body.
 * </p>
 */
public final class ApiRequest {

    private final String method;
    private final URI uri;
    private final byte[] body;
    private final Map<String, List<String>> headers;

    private ApiRequest(Builder builder) {
        this.method = builder.method;
        this.uri = builder.resolveUri();
        this.body = builder.body;
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        builder.headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        this.headers = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a builder for an arbitrary request. Mostly useful to exercise options in isolation; API calls should go
     * through {@link EbayClient#newRequest}.
     */
    public static Builder newBuilder(String method, URI uri) {
        return new Builder(method, uri, null);
    }

    static Builder newBuilder(String method, URI uri, byte[] body) {
        return new Builder(method, uri, body);
    }

    public String method() {
        return method;
    }

    /**
     * @return absolute URL including any query parameters added by options.
     */
    public URI uri() {
        return uri;
    }

    /**
     * @return a copy of the encoded body, or {@code null} when the request has none.
     */
    public byte[] body() {
        return body == null ? null : body.clone();
    }

    public boolean hasBody() {
        return body != null;
    }

    /**
     * @return header values keyed case-insensitively, in header-name order.
     */
    public Map<String, List<String>> headers() {
        return headers;
    }

    /**
     * @return first value of the named header or {@code null}.
     */
    public String header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * Mutable view of a request under construction. Only headers and query parameters can be changed.
     */
    public static final class Builder {
        private final String method;
        private final URI uri;
        private final byte[] body;
        private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, List<String>> query = new LinkedHashMap<>();

        private Builder(String method, URI uri, byte[] body) {
            this.method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
            this.uri = Objects.requireNonNull(uri, "uri");
            this.body = body;
        }

        public String method() {
            return method;
        }

        /**
         * @return first value of the named header or {@code null}.
         */
        public String header(String name) {
            List<String> values = headers.get(name);
            return values == null || values.isEmpty() ? null : values.get(0);
        }

        public Builder setHeader(String name, String value) {
            List<String> values = new ArrayList<>();
            values.add(Objects.requireNonNull(value, "value"));
            headers.put(Objects.requireNonNull(name, "name"), values);
            return this;
        }

        public Builder addHeader(String name, String value) {
            headers.computeIfAbsent(Objects.requireNonNull(name, "name"), key -> new ArrayList<>())
                .add(Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder removeHeader(String name) {
            headers.remove(name);
            return this;
        }

        /**
         * @return first value of the named query parameter added through this builder, or {@code null}.
         */
        public String queryParam(String name) {
            List<String> values = query.get(name);
            return values == null || values.isEmpty() ? null : values.get(0);
        }

        public Builder setQueryParam(String name, String value) {
            List<String> values = new ArrayList<>();
            values.add(Objects.requireNonNull(value, "value"));
            query.put(Objects.requireNonNull(name, "name"), values);
            return this;
        }

        public Builder addQueryParam(String name, String value) {
            query.computeIfAbsent(Objects.requireNonNull(name, "name"), key -> new ArrayList<>())
                .add(Objects.requireNonNull(value, "value"));
            return this;
        }

        /**
         * Applies options left to right. Each option mutates this builder; the value it returns is only there so
         * lambdas can chain builder calls.
         */
        public Builder apply(Opt... opts) {
            if (opts == null) {
                return this;
            }
            return apply(Arrays.asList(opts));
        }

        public Builder apply(List<Opt> opts) {
            for (Opt opt : opts) {
                if (opt != null) {
                    opt.apply(this);
                }
            }
            return this;
        }

        public ApiRequest build() {
            return new ApiRequest(this);
        }

        private URI resolveUri() {
            if (query.isEmpty()) {
                return uri;
            }
            String raw = uri.toString();
            int hash = raw.indexOf('#');
            if (hash >= 0) {
                raw = raw.substring(0, hash);
            }
            StringBuilder result = new StringBuilder(raw);
            boolean first = uri.getRawQuery() == null || uri.getRawQuery().isEmpty();
            if (first && raw.endsWith("?")) {
                result.setLength(result.length() - 1);
            }
            for (Map.Entry<String, List<String>> entry : query.entrySet()) {
                for (String value : entry.getValue()) {
                    result.append(first ? '?' : '&')
                        .append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                        .append('=')
                        .append(URLEncoder.encode(value, StandardCharsets.UTF_8));
                    first = false;
                }
            }
            return URI.create(result.toString());
        }
    }
}
