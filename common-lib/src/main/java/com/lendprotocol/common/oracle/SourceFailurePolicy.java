package com.lendprotocol.common.oracle;

/**
 * What {@code fetchPrices} does when a live source's {@code getPrice} call fails.
 */
public enum SourceFailurePolicy {
    /** The whole fetch fails with {@code EXTERNAL_CALL_FAILED}; nothing partial is returned. */
    ABORT,
    /** The failing source is logged and skipped; the remaining sources still count. */
    ISOLATE
}
