package io.github.drompincen.polarionclient.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.polarionclient.protocol.api.Enumeration;
import io.github.drompincen.polarionclient.protocol.api.EnumerationId;
import io.github.drompincen.polarionclient.protocol.api.EnumerationOption;
import io.github.drompincen.polarionclient.runtime.error.ResponseDecodingException;
import io.github.drompincen.polarionclient.runtime.retry.CancellationToken;

import java.util.List;

/**
 * Project scoped enumerations. Options are plain records, no schema involved.
 */
public class EnumerationService {

    private static final TypeReference<List<EnumerationOption>> OPTIONS = new TypeReference<>() {};

    private final ApiClient api;
    private final String projectId;

    EnumerationService(ApiClient api, String projectId) {
        this.api = api;
        this.projectId = projectId;
    }

    public Enumeration get(EnumerationId id) {
        String operation = "get enumeration " + id;
        String path = ApiClient.path("projects", projectId, "enumerations", id.context(), id.name(), id.targetType());
        JsonNode options = api.get(operation, api.uri(path), CancellationToken.create())
                .path("data").path("attributes").path("options");
        if (options.isMissingNode() || options.isNull()) {
            return new Enumeration(id, List.of());
        }
        try {
            return new Enumeration(id, api.mapper().convertValue(options, OPTIONS));
        } catch (IllegalArgumentException e) {
            throw new ResponseDecodingException(operation + ": malformed options: " + e.getMessage(), e);
        }
    }
}
