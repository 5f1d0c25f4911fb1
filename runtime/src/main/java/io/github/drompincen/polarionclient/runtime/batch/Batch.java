package io.github.drompincen.polarionclient.runtime.batch;

import java.util.List;

/**
 * Items, in input order, that fit together in one request.
 *
 * @param firstIndex  position of the first item in the partitioned input
 * @param encodedSize estimated request body size, envelope and separators included
 */
public record Batch<T>(List<T> items, int firstIndex, int encodedSize) {

    public Batch {
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }
}
