package io.github.drompincen.polarionclient.client;

import io.github.drompincen.polarionclient.client.model.UserFields;
import io.github.drompincen.polarionclient.protocol.api.Page;
import io.github.drompincen.polarionclient.protocol.api.QueryOptions;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.retry.CancellationToken;

import java.util.List;
import java.util.Map;

public class UserService extends AbstractResourceService {

    UserService(ApiClient api) {
        super(api, UserFields.SCHEMA);
    }

    public Resource get(String userId) {
        return get(userId, CancellationToken.create());
    }

    public Resource get(String userId, CancellationToken token) {
        var document = api.get("get user " + userId, api.uri(ApiClient.path("users", userId), Map.of()), token);
        return readSingle("get user " + userId, document);
    }

    public Page<Resource> query(QueryOptions options) {
        return query(options, CancellationToken.create());
    }

    public Page<Resource> query(QueryOptions options, CancellationToken token) {
        var document = api.get("query users", api.uri("users", api.pageParams(options, false)), token);
        return api.readPage(document, codec);
    }

    public List<Resource> queryAll(QueryOptions options) {
        CancellationToken token = CancellationToken.create();
        return collectAll(options, token, o -> query(o, token));
    }
}
