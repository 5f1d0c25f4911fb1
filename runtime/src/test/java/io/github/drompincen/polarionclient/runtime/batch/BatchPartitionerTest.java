package io.github.drompincen.polarionclient.runtime.batch;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchPartitionerTest {

    private final BatchPartitioner<Integer> partitioner = new BatchPartitioner<>(size -> size, 10);

    @Test
    void itemsThatDoNotFitTogetherAreSplit() {
        PartitionResult<Integer> result = partitioner.partition(List.of(40, 70), 10, 100);

        assertThat(result.batches()).hasSize(2);
        assertThat(result.batches().get(0).items()).containsExactly(40);
        assertThat(result.batches().get(0).encodedSize()).isEqualTo(50);
        assertThat(result.batches().get(1).items()).containsExactly(70);
        assertThat(result.batches().get(1).firstIndex()).isEqualTo(1);
    }

    @Test
    void separatorsAndEnvelopeAreCounted() {
        PartitionResult<Integer> result = partitioner.partition(List.of(30, 30, 28), 10, 100);

        assertThat(result.batches()).hasSize(1);
        assertThat(result.batches().get(0).encodedSize()).isEqualTo(10 + 30 + 1 + 30 + 1 + 28);
    }

    @Test
    void countLimitClosesBatch() {
        PartitionResult<Integer> result = partitioner.partition(List.of(1, 1, 1, 1, 1), 2, 1000);

        assertThat(result.batches()).extracting(Batch::size).containsExactly(2, 2, 1);
    }

    @Test
    void oversizedItemsAreSkippedAndReported() {
        PartitionResult<Integer> result = partitioner.partition(List.of(20, 95, 20), 10, 100);

        assertThat(result.itemCount()).isEqualTo(2);
        assertThat(result.skipped()).singleElement().satisfies(skipped -> {
            assertThat(skipped.index()).isEqualTo(1);
            assertThat(skipped.encodedSize()).isEqualTo(95);
        });
    }

    @Test
    void itemExactlyAtLimitFits() {
        PartitionResult<Integer> result = partitioner.partition(List.of(90), 10, 100);

        assertThat(result.hasSkipped()).isFalse();
        assertThat(result.batches().get(0).encodedSize()).isEqualTo(100);
    }

    @Test
    void invariantsHoldForMixedInput() {
        List<Integer> items = new ArrayList<>();
        IntStream.range(0, 200).forEach(i -> items.add(1 + (i * 37) % 120));

        PartitionResult<Integer> result = partitioner.partition(items, 7, 250);

        List<Integer> flattened = new ArrayList<>();
        for (Batch<Integer> batch : result.batches()) {
            assertThat(batch.size()).isBetween(1, 7);
            assertThat(batch.encodedSize()).isLessThanOrEqualTo(250);
            int expected = 10 + batch.items().stream().mapToInt(Integer::intValue).sum() + batch.size() - 1;
            assertThat(batch.encodedSize()).isEqualTo(expected);
            flattened.addAll(batch.items());
        }
        assertThat(flattened).containsExactlyElementsOf(items);
    }

    @Test
    void emptyInputGivesNoBatches() {
        assertThat(partitioner.partition(List.of(), 5, 100).batches()).isEmpty();
    }

    @Test
    void rejectsUnusableLimits() {
        assertThatThrownBy(() -> partitioner.partition(List.of(1), 0, 100))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> partitioner.partition(List.of(1), 1, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultEnvelopeIsDataArrayWrapper() {
        assertThat(BatchPartitioner.DEFAULT_ENVELOPE_OVERHEAD).isEqualTo("{\"data\":[]}".length());
    }
}
