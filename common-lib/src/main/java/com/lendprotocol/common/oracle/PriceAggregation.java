package com.lendprotocol.common.oracle;

import com.lendprotocol.common.model.AggregationMode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Folds a list of positive source prices into one value.
 *
 * <h3>MEDIAN (median with outlier trim)</h3>
 * <ol>
 *   <li>Sort ascending.</li>
 *   <li>With 3 or more prices, drop exactly one lowest and one highest reading.</li>
 *   <li>Odd span → middle element; even span → {@code (lo + hi) / 2}, truncated toward zero.</li>
 * </ol>
 *
 * <h3>MEAN</h3>
 * <pre>
 *   sum(prices) / n   (truncated toward zero)
 * </pre>
 *
 * <p>Stateless and pure.
 */
public final class PriceAggregation {

    static final int TRIM_THRESHOLD = 3;

    private static final BigInteger TWO = BigInteger.valueOf(2);

    private PriceAggregation() {}

    /**
     * @return aggregated price, or empty when {@code prices} is empty
     */
    public static Optional<BigInteger> aggregate(List<BigInteger> prices, AggregationMode mode) {
        if (prices.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mode == AggregationMode.MEAN ? mean(prices) : trimmedMedian(prices));
    }

    public static BigInteger mean(List<BigInteger> prices) {
        BigInteger sum = BigInteger.ZERO;
        for (BigInteger p : prices) {
            sum = sum.add(p);
        }
        return sum.divide(BigInteger.valueOf(prices.size()));
    }

    public static BigInteger trimmedMedian(List<BigInteger> prices) {
        List<BigInteger> sorted = new ArrayList<>(prices);
        sorted.sort(null);

        int start = 0;
        int end   = sorted.size();
        if (sorted.size() >= TRIM_THRESHOLD) {
            start = 1;
            end   = sorted.size() - 1;
        }

        int span = end - start;
        int mid  = start + span / 2;
        if (span % 2 == 1) {
            return sorted.get(mid);
        }
        return sorted.get(mid - 1).add(sorted.get(mid)).divide(TWO);
    }
}
