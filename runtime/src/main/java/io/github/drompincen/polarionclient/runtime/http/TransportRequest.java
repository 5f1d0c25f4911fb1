package io.github.drompincen.polarionclient.runtime.http;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record TransportRequest(
        String method,
        URI uri,
        Map<String, String> headers,
        byte[] body,
        Duration timeout
) {
    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static TransportRequest of(String method, URI uri) {
        return new TransportRequest(method, uri, Map.of(), null, null);
    }

    public TransportRequest withHeader(String name, String value) {
        Map<String, String> next = new LinkedHashMap<>(headers);
        next.put(name, value);
        return new TransportRequest(method, uri, next, body, timeout);
    }

    public TransportRequest withHeaders(Map<String, String> extra) {
        Map<String, String> next = new LinkedHashMap<>(headers);
        next.putAll(extra);
        return new TransportRequest(method, uri, next, body, timeout);
    }

    public TransportRequest withBody(byte[] content) {
        return new TransportRequest(method, uri, headers, content, timeout);
    }

    public TransportRequest withTimeout(Duration value) {
        return new TransportRequest(method, uri, headers, body, value);
    }

    public boolean hasBody() {
        return body != null && body.length > 0;
    }

    public String bodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return method + " " + uri + (hasBody() ? " (" + body.length + " bytes)" : "");
    }
}
