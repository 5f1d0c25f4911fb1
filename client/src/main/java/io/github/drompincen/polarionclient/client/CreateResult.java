package io.github.drompincen.polarionclient.client;

import io.github.drompincen.polarionclient.runtime.batch.OversizedItem;
import io.github.drompincen.polarionclient.runtime.resource.Resource;

import java.util.List;

/**
 * Outcome of {@link WorkItemService#create}. {@code created} holds the submitted instances,
 * now carrying server ids; {@code skipped} the items too large for a single request.
 */
public record CreateResult(
        List<Resource> created,
        List<OversizedItem<Resource>> skipped,
        int batchCount
) {
    public CreateResult {
        created = List.copyOf(created);
        skipped = List.copyOf(skipped);
    }

    public boolean hasSkipped() {
        return !skipped.isEmpty();
    }
}
