package com.lendprotocol.common.capability;

/**
 * Source of ledger time, in whole seconds since the epoch.
 */
@FunctionalInterface
public interface LedgerClock {
    long now();
}
