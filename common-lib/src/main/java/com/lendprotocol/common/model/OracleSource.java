package com.lendprotocol.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A price-source contract registered for one asset.
 *
 * <ul>
 *   <li>{@code address}       – identity of the source; unique within an asset's list.</li>
 *   <li>{@code weight}        – relative weight. Stored for operators, not used in aggregation.</li>
 *   <li>{@code lastHeartbeat} – last known liveness timestamp (seconds since epoch).</li>
 * </ul>
 */
public record OracleSource(
    @JsonProperty("address")       Address address,
    @JsonProperty("weight")        long    weight,
    @JsonProperty("lastHeartbeat") long    lastHeartbeat
) {

    /**
     * A source is stale once its heartbeat is older than {@code ttlSeconds}. A heartbeat
     * in the future counts as age zero; an age beyond {@code Long.MAX_VALUE} saturates.
     */
    public boolean isStale(long now, long ttlSeconds) {
        return age(now) > ttlSeconds;
    }

    long age(long now) {
        if (now <= lastHeartbeat) {
            return 0L;
        }
        long age = now - lastHeartbeat;
        return age < 0 ? Long.MAX_VALUE : age;
    }
}
