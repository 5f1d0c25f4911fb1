package io.github.drompincen.polarionclient.protocol.api;

/**
 * Parameters of a paged query. Non-positive page size or number fall back to the client
 * default and to the first page respectively; a null selector means {@link FieldSelector#ALL}.
 */
public record QueryOptions(
        String query,
        int pageSize,
        int pageNumber,
        FieldSelector fields,
        String revision
) {
    public static QueryOptions of(String query) {
        return new QueryOptions(query, 0, 1, null, null);
    }

    public QueryOptions withPageSize(int size) {
        return new QueryOptions(query, size, pageNumber, fields, revision);
    }

    public QueryOptions withPageNumber(int number) {
        return new QueryOptions(query, pageSize, number, fields, revision);
    }

    public QueryOptions withFields(FieldSelector selector) {
        return new QueryOptions(query, pageSize, pageNumber, selector, revision);
    }

    public QueryOptions withRevision(String rev) {
        return new QueryOptions(query, pageSize, pageNumber, fields, rev);
    }
}
