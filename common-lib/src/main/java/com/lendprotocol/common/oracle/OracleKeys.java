package com.lendprotocol.common.oracle;

import com.lendprotocol.common.model.Address;
import com.lendprotocol.common.store.StorageKey;

/**
 * Storage layout of the oracle subsystem, all under the {@code oracle} namespace.
 */
public final class OracleKeys {

    static final String NAMESPACE = "oracle";

    private OracleKeys() {}

    /** {@code oracle:sources:{asset}} – ordered source list for one asset. */
    public static StorageKey sources(Address asset) {
        return StorageKey.of(NAMESPACE, "sources", asset.value());
    }

    public static StorageKey heartbeatTtl() {
        return StorageKey.of(NAMESPACE, "heartbeat_ttl");
    }

    public static StorageKey mode() {
        return StorageKey.of(NAMESPACE, "mode");
    }

    public static StorageKey perfCount() {
        return StorageKey.of(NAMESPACE, "perf_count");
    }
}
