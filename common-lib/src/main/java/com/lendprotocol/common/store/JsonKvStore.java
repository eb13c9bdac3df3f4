package com.lendprotocol.common.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory {@link PersistentKv} that stores every value as a JSON document.
 *
 * <p>Serialising on write means a caller can never mutate stored state through a
 * reference it still holds; every read yields a fresh copy.
 *
 * <p><strong>Invocation model:</strong> one invocation at a time, guarded by a fair
 * {@link ReentrantLock}. Writes made while the lock is held go to a pending overlay that
 * reads on the same thread see first. The overlay is flushed to the committed map only when
 * the outermost invocation returns normally; otherwise it is dropped.
 *
 * <p>Writes outside any invocation are wrapped in a single-write invocation of their own.
 */
public class JsonKvStore implements PersistentKv {

    private static final Logger log = LoggerFactory.getLogger(JsonKvStore.class);

    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, String> committed = new ConcurrentHashMap<>();
    private final ReentrantLock invocationLock = new ReentrantLock(true);

    // guarded by invocationLock; empty Optional marks a pending removal
    private Map<String, Optional<String>> pending;
    private int depth;

    public JsonKvStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> Optional<T> get(StorageKey key, Class<T> type) {
        return read(key).map(json -> decode(key, json, objectMapper.constructType(type)));
    }

    @Override
    public <T> Optional<T> get(StorageKey key, TypeReference<T> type) {
        return read(key).map(json -> decode(key, json, objectMapper.constructType(type)));
    }

    @Override
    public void set(StorageKey key, Object value) {
        String json = encode(key, value);
        atomically("set", () -> pending.put(key.render(), Optional.of(json)));
    }

    @Override
    public void remove(StorageKey key) {
        atomically("remove", () -> pending.put(key.render(), Optional.empty()));
    }

    @Override
    public boolean has(StorageKey key) {
        return read(key).isPresent();
    }

    @Override
    public <T> T atomically(String operation, Supplier<T> work) {
        invocationLock.lock();
        boolean outermost = depth == 0;
        if (outermost) {
            pending = new LinkedHashMap<>();
        }
        depth++;
        try {
            T result = work.get();
            if (outermost) {
                commit(operation);
            }
            return result;
        } catch (RuntimeException e) {
            if (outermost) {
                log.warn("INVOCATION_ABORTED operation={} discardedWrites={} reason={}",
                         operation, pending.size(), e.getMessage());
            }
            throw e;
        } finally {
            depth--;
            if (outermost) {
                pending = null;
            }
            invocationLock.unlock();
        }
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private Optional<String> read(StorageKey key) {
        String rendered = key.render();
        if (invocationLock.isHeldByCurrentThread() && pending != null && pending.containsKey(rendered)) {
            return pending.get(rendered);
        }
        return Optional.ofNullable(committed.get(rendered));
    }

    private void commit(String operation) {
        pending.forEach((key, value) -> {
            if (value.isPresent()) {
                committed.put(key, value.get());
            } else {
                committed.remove(key);
            }
        });
        log.debug("INVOCATION_COMMITTED operation={} writes={}", operation, pending.size());
    }

    private String encode(StorageKey key, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialise value for key " + key, e);
        }
    }

    private <T> T decode(StorageKey key, String json, JavaType type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot deserialise value for key " + key, e);
        }
    }
}
