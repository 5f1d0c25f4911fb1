package io.github.drompincen.polarionclient.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.polarionclient.protocol.api.Page;
import io.github.drompincen.polarionclient.protocol.api.QueryOptions;
import io.github.drompincen.polarionclient.runtime.codec.FlexibleAttributeCodec;
import io.github.drompincen.polarionclient.runtime.error.ResponseDecodingException;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.retry.CancellationToken;
import io.github.drompincen.polarionclient.runtime.schema.ResourceSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

abstract class AbstractResourceService {

    protected final ApiClient api;
    protected final FlexibleAttributeCodec codec;

    protected AbstractResourceService(ApiClient api, ResourceSchema schema) {
        this.api = api;
        this.codec = new FlexibleAttributeCodec(schema, api.mapper());
    }

    protected Resource readSingle(String operation, JsonNode document) {
        JsonNode data = document.path("data");
        if (!data.isObject()) {
            throw new ResponseDecodingException(operation + ": response has no data object");
        }
        return codec.decode(data);
    }

    /** Fetches pages starting at {@code options.pageNumber()} until the server reports no next link. */
    protected List<Resource> collectAll(QueryOptions options, CancellationToken token,
                                        Function<QueryOptions, Page<Resource>> fetch) {
        List<Resource> all = new ArrayList<>();
        int pageNumber = Math.max(1, options.pageNumber());
        while (true) {
            token.throwIfCancelled();
            Page<Resource> page = fetch.apply(options.withPageNumber(pageNumber));
            all.addAll(page.items());
            if (!page.hasNext() || page.items().isEmpty()) {
                return all;
            }
            pageNumber++;
        }
    }
}
