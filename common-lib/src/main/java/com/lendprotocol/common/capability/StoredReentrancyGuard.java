package com.lendprotocol.common.capability;

import com.lendprotocol.common.exception.ProtocolError;
import com.lendprotocol.common.exception.ProtocolException;
import com.lendprotocol.common.store.PersistentKv;
import com.lendprotocol.common.store.ProtocolKeys;

/**
 * {@link ReentrancyGuard} keeping its flag in the key/value store under
 * {@code protocol:reentrancy}, so the flag takes part in the invocation's commit or rollback.
 */
public class StoredReentrancyGuard implements ReentrancyGuard {

    private final PersistentKv kv;

    public StoredReentrancyGuard(PersistentKv kv) {
        this.kv = kv;
    }

    @Override
    public void enter() {
        if (kv.get(ProtocolKeys.reentrancy(), Boolean.class).orElse(false)) {
            throw new ProtocolException(ProtocolError.REENTRANT_CALL, "guarded section already entered");
        }
        kv.set(ProtocolKeys.reentrancy(), true);
    }

    @Override
    public void exit() {
        kv.remove(ProtocolKeys.reentrancy());
    }
}
