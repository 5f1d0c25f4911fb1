package io.github.drompincen.polarionclient.runtime.error;

/**
 * An item cannot fit in any request, even alone.
 */
public class OversizedItemException extends PolarionException {

    private final int index;
    private final int size;
    private final int limit;

    public OversizedItemException(int index, int size, int limit) {
        super("item at index " + index + " encodes to " + size + " bytes, limit is " + limit);
        this.index = index;
        this.size = size;
        this.limit = limit;
    }

    public int index() {
        return index;
    }

    public int size() {
        return size;
    }

    public int limit() {
        return limit;
    }
}
