package io.github.drompincen.polarionclient.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.polarionclient.protocol.json.JsonSupport;
import io.github.drompincen.polarionclient.runtime.http.BearerTokenAuthenticator;
import io.github.drompincen.polarionclient.runtime.http.HttpTransport;
import io.github.drompincen.polarionclient.runtime.http.JdkHttpTransport;
import io.github.drompincen.polarionclient.runtime.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point. Thread-safe; one instance per server is enough.
 *
 * <pre>{@code
 * PolarionClient client = PolarionClient.create(ClientConfig.builder(url, token).build());
 * List<Resource> open = client.project("DEMO").workItems().queryAll(QueryOptions.of("status:open"));
 * }</pre>
 */
public class PolarionClient {

    private static final Logger log = LoggerFactory.getLogger(PolarionClient.class);

    private final ApiClient api;
    private final UserService users;
    private final ProjectService projects;
    private final Map<String, ProjectClient> projectClients = new ConcurrentHashMap<>();

    PolarionClient(ApiClient api) {
        this.api = api;
        this.users = new UserService(api);
        this.projects = new ProjectService(api);
    }

    public static PolarionClient create(ClientConfig config) {
        return create(config, new JdkHttpTransport(config.connectTimeout(), config.requestTimeout()));
    }

    public static PolarionClient create(ClientConfig config, HttpTransport transport) {
        return create(config, transport, JsonSupport.newObjectMapper());
    }

    public static PolarionClient create(ClientConfig config, HttpTransport transport, ObjectMapper mapper) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(transport, "transport");
        log.info("Polarion client for {}", config.baseUrl());
        ApiClient api = new ApiClient(config, transport, new BearerTokenAuthenticator(config.bearerToken()),
                mapper, new RetryExecutor(new LoggingRetryListener()));
        return new PolarionClient(api);
    }

    public ClientConfig config() {
        return api.config();
    }

    public UserService users() {
        return users;
    }

    public ProjectService projects() {
        return projects;
    }

    public ProjectClient project(String projectId) {
        Objects.requireNonNull(projectId, "projectId");
        return projectClients.computeIfAbsent(projectId, id -> new ProjectClient(api, id));
    }
}
