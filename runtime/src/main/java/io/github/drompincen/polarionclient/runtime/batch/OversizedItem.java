package io.github.drompincen.polarionclient.runtime.batch;

/**
 * Item left out of every batch because it alone exceeds the byte limit.
 */
public record OversizedItem<T>(int index, T item, int encodedSize) {
}
