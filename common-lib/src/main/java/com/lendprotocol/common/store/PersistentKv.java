package com.lendprotocol.common.store;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Namespaced key/value store backing every protocol subsystem.
 *
 * <p>Each top-level entry point runs inside {@link #atomically}: its writes become visible
 * only if it returns normally. A thrown exception discards them all.
 */
public interface PersistentKv {

    <T> Optional<T> get(StorageKey key, Class<T> type);

    <T> Optional<T> get(StorageKey key, TypeReference<T> type);

    void set(StorageKey key, Object value);

    void remove(StorageKey key);

    boolean has(StorageKey key);

    /**
     * Runs {@code work} as one all-or-nothing invocation. Invocations are serialised
     * globally; a nested call from the same thread joins the enclosing invocation.
     *
     * @param operation entry-point name, used for logging only
     */
    <T> T atomically(String operation, Supplier<T> work);

    default void atomically(String operation, Runnable work) {
        atomically(operation, () -> {
            work.run();
            return null;
        });
    }
}
