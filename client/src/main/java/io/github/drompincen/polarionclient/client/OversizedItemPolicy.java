package io.github.drompincen.polarionclient.client;

/**
 * What {@link WorkItemService#create} does with items that exceed the request size limit alone.
 */
public enum OversizedItemPolicy {
    /** Leave them out, log a warning, and list them in {@link CreateResult#skipped()}. */
    SKIP_AND_REPORT,
    /** Fail with {@link io.github.drompincen.polarionclient.runtime.error.OversizedItemException} before sending anything. */
    FAIL
}
