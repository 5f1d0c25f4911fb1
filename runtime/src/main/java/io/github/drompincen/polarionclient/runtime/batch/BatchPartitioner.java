package io.github.drompincen.polarionclient.runtime.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Greedy, order-preserving split of items into batches bounded by item count and by the
 * encoded size of the request body {@code {"data":[item,item,...]}}.
 */
public final class BatchPartitioner<T> {

    /** Length of {@code {"data":[]}}. */
    public static final int DEFAULT_ENVELOPE_OVERHEAD = 11;

    private static final int SEPARATOR_BYTES = 1;

    private final ToIntFunction<T> sizer;
    private final int envelopeOverhead;

    public BatchPartitioner(ToIntFunction<T> sizer) {
        this(sizer, DEFAULT_ENVELOPE_OVERHEAD);
    }

    public BatchPartitioner(ToIntFunction<T> sizer, int envelopeOverhead) {
        if (envelopeOverhead < 0) {
            throw new IllegalArgumentException("envelopeOverhead must be >= 0");
        }
        this.sizer = Objects.requireNonNull(sizer, "sizer");
        this.envelopeOverhead = envelopeOverhead;
    }

    /**
     * Every returned batch holds at most {@code maxCount} items and at most {@code maxBytes}
     * encoded bytes. Items that cannot fit even alone are reported in
     * {@link PartitionResult#skipped()} with their input index.
     */
    public PartitionResult<T> partition(List<T> items, int maxCount, int maxBytes) {
        Objects.requireNonNull(items, "items");
        if (maxCount < 1) {
            throw new IllegalArgumentException("maxCount must be >= 1, got " + maxCount);
        }
        if (maxBytes <= envelopeOverhead) {
            throw new IllegalArgumentException("maxBytes must exceed the envelope overhead of " + envelopeOverhead);
        }

        List<Batch<T>> batches = new ArrayList<>();
        List<OversizedItem<T>> skipped = new ArrayList<>();
        List<T> current = new ArrayList<>();
        int currentFirst = -1;
        int currentSize = envelopeOverhead;

        for (int i = 0; i < items.size(); i++) {
            T item = items.get(i);
            int size = sizer.applyAsInt(item);
            if (size + envelopeOverhead > maxBytes) {
                skipped.add(new OversizedItem<>(i, item, size));
                continue;
            }
            int projected = currentSize + size + (current.isEmpty() ? 0 : SEPARATOR_BYTES);
            if (!current.isEmpty() && (projected > maxBytes || current.size() >= maxCount)) {
                batches.add(new Batch<>(current, currentFirst, currentSize));
                current = new ArrayList<>();
                projected = envelopeOverhead + size;
            }
            if (current.isEmpty()) {
                currentFirst = i;
            }
            current.add(item);
            currentSize = projected;
        }
        if (!current.isEmpty()) {
            batches.add(new Batch<>(current, currentFirst, currentSize));
        }
        return new PartitionResult<>(batches, skipped);
    }
}
