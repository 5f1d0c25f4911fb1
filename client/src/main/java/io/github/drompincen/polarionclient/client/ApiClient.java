package io.github.drompincen.polarionclient.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.polarionclient.protocol.api.ErrorDocument;
import io.github.drompincen.polarionclient.protocol.api.FieldSelector;
import io.github.drompincen.polarionclient.protocol.api.Page;
import io.github.drompincen.polarionclient.protocol.api.QueryOptions;
import io.github.drompincen.polarionclient.runtime.codec.FlexibleAttributeCodec;
import io.github.drompincen.polarionclient.runtime.error.ApiException;
import io.github.drompincen.polarionclient.runtime.error.EncodingException;
import io.github.drompincen.polarionclient.runtime.error.ResponseDecodingException;
import io.github.drompincen.polarionclient.runtime.http.HttpTransport;
import io.github.drompincen.polarionclient.runtime.http.RequestAuthenticator;
import io.github.drompincen.polarionclient.runtime.http.TransportRequest;
import io.github.drompincen.polarionclient.runtime.http.TransportResponse;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.retry.CancellationToken;
import io.github.drompincen.polarionclient.runtime.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * JSON:API plumbing shared by the resource services: URL building, headers, retries and error
 * mapping.
 */
public class ApiClient {

    private static final Logger log = LoggerFactory.getLogger(ApiClient.class);

    static final String JSON = "application/json";
    private static final int MAX_MESSAGE_BODY = 200;

    private final ClientConfig config;
    private final HttpTransport transport;
    private final RequestAuthenticator authenticator;
    private final ObjectMapper mapper;
    private final RetryExecutor retryExecutor;

    public ApiClient(ClientConfig config, HttpTransport transport, RequestAuthenticator authenticator,
                     ObjectMapper mapper, RetryExecutor retryExecutor) {
        this.config = config;
        this.transport = transport;
        this.authenticator = authenticator;
        this.mapper = mapper;
        this.retryExecutor = retryExecutor;
    }

    public ClientConfig config() {
        return config;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /** Joins path segments, escaping each one. */
    public static String path(String... segments) {
        StringJoiner joiner = new StringJoiner("/");
        for (String segment : segments) {
            joiner.add(escape(segment));
        }
        return joiner.toString();
    }

    static String escape(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20").replace("%7E", "~");
    }

    public URI uri(String path, Map<String, String> query) {
        StringBuilder sb = new StringBuilder(config.baseUrl()).append('/').append(path);
        if (query != null && !query.isEmpty()) {
            StringJoiner params = new StringJoiner("&", "?", "");
            query.forEach((k, v) -> params.add(escape(k) + "=" + escape(v)));
            sb.append(params);
        }
        return URI.create(sb.toString());
    }

    public URI uri(String path) {
        return uri(path, Map.of());
    }

    /** Query parameters of a paged collection request. */
    public Map<String, String> pageParams(QueryOptions options, boolean withFields) {
        Map<String, String> params = new LinkedHashMap<>();
        if (options.query() != null && !options.query().isEmpty()) {
            params.put("query", options.query());
        }
        params.put("page[size]", String.valueOf(options.pageSize() > 0 ? options.pageSize() : config.pageSize()));
        params.put("page[number]", String.valueOf(Math.max(1, options.pageNumber())));
        if (withFields) {
            params.putAll((options.fields() != null ? options.fields() : FieldSelector.ALL).toQueryParams());
        }
        if (options.revision() != null && !options.revision().isEmpty()) {
            params.put("revision", options.revision());
        }
        return params;
    }

    public Page<Resource> readPage(JsonNode document, FlexibleAttributeCodec codec) {
        List<Resource> items = codec.decodeAll(document.path("data"));
        String next = document.path("links").path("next").asText("");
        int total = document.path("meta").path("totalCount").asInt(0);
        return new Page<>(items, !next.isEmpty(), total);
    }

    public ObjectNode dataDocument(JsonNode data) {
        ObjectNode doc = mapper.createObjectNode();
        doc.set("data", data);
        return doc;
    }

    public ObjectNode dataArrayDocument(List<? extends JsonNode> items) {
        ObjectNode doc = mapper.createObjectNode();
        ArrayNode array = doc.putArray("data");
        items.forEach(array::add);
        return doc;
    }

    public JsonNode get(String operation, URI uri, CancellationToken token) {
        return readJson(operation, exchange(operation, "GET", uri, null, JSON, token));
    }

    public JsonNode post(String operation, URI uri, JsonNode body, CancellationToken token) {
        return readJson(operation, exchange(operation, "POST", uri, body, JSON, token));
    }

    public JsonNode patch(String operation, URI uri, JsonNode body, CancellationToken token) {
        return readJson(operation, exchange(operation, "PATCH", uri, body, JSON, token));
    }

    public void delete(String operation, URI uri, JsonNode body, CancellationToken token) {
        exchange(operation, "DELETE", uri, body, JSON, token);
    }

    public byte[] download(String operation, URI uri, CancellationToken token) {
        return exchange(operation, "GET", uri, null, "*/*", token).body();
    }

    TransportResponse exchange(String operation, String method, URI uri, JsonNode body,
                               String accept, CancellationToken token) {
        TransportRequest request = TransportRequest.of(method, uri)
                .withHeaders(authenticator.headers())
                .withHeader("Accept", accept)
                .withTimeout(config.requestTimeout());
        if (body != null) {
            request = request.withHeader("Content-Type", JSON).withBody(toBytes(body));
        }
        TransportRequest prepared = request;
        long start = System.currentTimeMillis();
        TransportResponse response = retryExecutor.execute(operation, t -> {
            TransportResponse r = transport.send(prepared, t);
            if (!r.isSuccess()) {
                throw toApiException(r, method, uri);
            }
            return r;
        }, config.retryPolicy(), token);
        log.debug("{}: {} {} -> {} in {} ms", operation, method, uri, response.statusCode(),
                System.currentTimeMillis() - start);
        return response;
    }

    private byte[] toBytes(JsonNode body) {
        try {
            return mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new EncodingException("Cannot serialize request body", e);
        }
    }

    private JsonNode readJson(String operation, TransportResponse response) {
        if (!response.hasBody()) {
            return MissingNode.getInstance();
        }
        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new ResponseDecodingException(operation + ": response is not valid JSON: " + e.getMessage(), e);
        }
    }

    ApiException toApiException(TransportResponse response, String method, URI uri) {
        String raw = response.bodyAsString();
        ErrorDocument errors = null;
        if (!raw.isBlank()) {
            try {
                errors = mapper.readValue(raw, ErrorDocument.class);
            } catch (IOException e) {
                log.trace("Error body of {} {} is not JSON:API: {}", method, uri, e.getMessage());
            }
        }
        if (errors != null && errors.hasErrors()) {
            var first = errors.errors().get(0);
            String message = first.title() != null ? first.title() : "API error";
            return new ApiException(response.statusCode(), message, errors.errors(), raw, method, uri);
        }
        String message = raw.isBlank() ? "" : truncate(raw.strip());
        return new ApiException(response.statusCode(), message, List.of(), raw, method, uri);
    }

    private static String truncate(String text) {
        return text.length() <= MAX_MESSAGE_BODY ? text : text.substring(0, MAX_MESSAGE_BODY) + "...";
    }
}
