package com.lendprotocol.common.governance;

/**
 * What a second {@code vote} from the same voter on the same proposal does to the tally.
 *
 * <p>The receipt is overwritten under both policies; only the tally differs.
 */
public enum RepeatVotePolicy {
    /** Every call adds its weight. Repeat votes inflate the totals. */
    ACCUMULATE,
    /** The voter's previously recorded weight is withdrawn before the new vote counts. */
    REPLACE
}
