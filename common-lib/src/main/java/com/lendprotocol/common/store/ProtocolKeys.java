package com.lendprotocol.common.store;

/**
 * Keys shared by every subsystem: the admin identity and the reentrancy flag.
 */
public final class ProtocolKeys {

    static final String NAMESPACE = "protocol";

    private ProtocolKeys() {}

    public static StorageKey admin() {
        return StorageKey.of(NAMESPACE, "admin");
    }

    public static StorageKey reentrancy() {
        return StorageKey.of(NAMESPACE, "reentrancy");
    }
}
