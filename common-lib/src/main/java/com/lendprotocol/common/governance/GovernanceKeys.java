package com.lendprotocol.common.governance;

import com.lendprotocol.common.model.Address;
import com.lendprotocol.common.store.StorageKey;

/**
 * Storage layout of the governance subsystem, all under the {@code gov} namespace.
 */
public final class GovernanceKeys {

    static final String NAMESPACE = "gov";

    private GovernanceKeys() {}

    /** {@code gov:counter} – last allocated proposal id. */
    public static StorageKey counter() {
        return StorageKey.of(NAMESPACE, "counter");
    }

    /** {@code gov:proposals} – map of proposal id to proposal. */
    public static StorageKey proposals() {
        return StorageKey.of(NAMESPACE, "proposals");
    }

    /** {@code gov:receipts:{id}} – map of voter to receipt for one proposal. */
    public static StorageKey receipts(long proposalId) {
        return StorageKey.of(NAMESPACE, "receipts", proposalId);
    }

    public static StorageKey quorumBps() {
        return StorageKey.of(NAMESPACE, "quorum_bps");
    }

    public static StorageKey timelock() {
        return StorageKey.of(NAMESPACE, "timelock");
    }

    /** {@code gov:delegation:{delegator}} */
    public static StorageKey delegation(Address delegator) {
        return StorageKey.of(NAMESPACE, "delegation", delegator.value());
    }
}
