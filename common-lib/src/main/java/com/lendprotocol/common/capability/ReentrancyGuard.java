package com.lendprotocol.common.capability;

import java.util.function.Supplier;

/**
 * Prevents a guarded section from being entered again while it is running, e.g. by an
 * external contract called from inside it.
 */
public interface ReentrancyGuard {

    /** @throws com.lendprotocol.common.exception.ProtocolException {@code REENTRANT_CALL} if already entered */
    void enter();

    void exit();

    default <T> T guard(Supplier<T> work) {
        enter();
        try {
            return work.get();
        } finally {
            exit();
        }
    }
}
