package com.lendprotocol.common.model;

/**
 * How {@code aggregatePrice} folds the collected source prices into one value.
 *
 * <p>Persisted as a numeric code. {@link #MEAN} is code 1; every other code resolves to
 * {@link #MEDIAN}, so an unrecognised stored value never disables aggregation.
 */
public enum AggregationMode {
    /** Median after dropping the single lowest and highest reading (when there are at least 3). */
    MEDIAN(0),
    /** Plain arithmetic mean. Not time-weighted. */
    MEAN(1);

    private final long code;

    AggregationMode(long code) {
        this.code = code;
    }

    public long code() {
        return code;
    }

    public static AggregationMode fromCode(long code) {
        return code == MEAN.code ? MEAN : MEDIAN;
    }
}
