package io.github.drompincen.polarionclient.client;

import io.github.drompincen.polarionclient.client.model.ProjectFields;
import io.github.drompincen.polarionclient.protocol.api.Page;
import io.github.drompincen.polarionclient.protocol.api.QueryOptions;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.retry.CancellationToken;

import java.util.List;

public class ProjectService extends AbstractResourceService {

    ProjectService(ApiClient api) {
        super(api, ProjectFields.SCHEMA);
    }

    public Resource get(String projectId) {
        String operation = "get project " + projectId;
        var document = api.get(operation, api.uri(ApiClient.path("projects", projectId)), CancellationToken.create());
        return readSingle(operation, document);
    }

    public Page<Resource> query(QueryOptions options) {
        return query(options, CancellationToken.create());
    }

    public Page<Resource> query(QueryOptions options, CancellationToken token) {
        var document = api.get("query projects", api.uri("projects", api.pageParams(options, false)), token);
        return api.readPage(document, codec);
    }

    public List<Resource> queryAll(QueryOptions options) {
        CancellationToken token = CancellationToken.create();
        return collectAll(options, token, o -> query(o, token));
    }
}
