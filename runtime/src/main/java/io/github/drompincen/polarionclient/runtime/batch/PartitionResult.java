package io.github.drompincen.polarionclient.runtime.batch;

import java.util.List;

public record PartitionResult<T>(List<Batch<T>> batches, List<OversizedItem<T>> skipped) {

    public PartitionResult {
        batches = List.copyOf(batches);
        skipped = List.copyOf(skipped);
    }

    public boolean hasSkipped() {
        return !skipped.isEmpty();
    }

    public int itemCount() {
        return batches.stream().mapToInt(Batch::size).sum();
    }
}
