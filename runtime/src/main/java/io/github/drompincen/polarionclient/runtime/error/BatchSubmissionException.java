package io.github.drompincen.polarionclient.runtime.error;

/**
 * A batch request failed. Batches before {@code batchIndex} were already accepted by the server.
 */
public class BatchSubmissionException extends PolarionException {

    private final int batchIndex;
    private final int firstItemIndex;

    public BatchSubmissionException(int batchIndex, int firstItemIndex, Throwable cause) {
        super("batch " + batchIndex + " (starting at item " + firstItemIndex + ") failed: " + cause.getMessage(), cause);
        this.batchIndex = batchIndex;
        this.firstItemIndex = firstItemIndex;
    }

    public int batchIndex() {
        return batchIndex;
    }

    public int firstItemIndex() {
        return firstItemIndex;
    }
}
