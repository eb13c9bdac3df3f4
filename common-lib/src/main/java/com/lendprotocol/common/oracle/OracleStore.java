package com.lendprotocol.common.oracle;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lendprotocol.common.model.Address;
import com.lendprotocol.common.model.OracleSource;
import com.lendprotocol.common.store.PersistentKv;

import java.util.List;
import java.util.function.Supplier;

/**
 * CRUD over per-asset source lists and the oracle tunables (heartbeat TTL, aggregation
 * mode, performance counter).
 */
public class OracleStore {

    public static final long DEFAULT_HEARTBEAT_TTL_SECONDS = 300;
    public static final long DEFAULT_MODE                  = 0;

    private static final TypeReference<List<OracleSource>> SOURCE_LIST =
        new TypeReference<>() {};

    private final PersistentKv kv;

    public OracleStore(PersistentKv kv) {
        this.kv = kv;
    }

    public <T> T inInvocation(String operation, Supplier<T> work) {
        return kv.atomically(operation, work);
    }

    /** Registered sources in registration order; empty for an unknown asset. */
    public List<OracleSource> getSources(Address asset) {
        return kv.get(OracleKeys.sources(asset), SOURCE_LIST).orElseGet(List::of);
    }

    public void putSources(Address asset, List<OracleSource> sources) {
        kv.set(OracleKeys.sources(asset), sources);
    }

    public long getHeartbeatTtl() {
        return kv.get(OracleKeys.heartbeatTtl(), Long.class).orElse(DEFAULT_HEARTBEAT_TTL_SECONDS);
    }

    public void setHeartbeatTtl(long seconds) {
        kv.set(OracleKeys.heartbeatTtl(), seconds);
    }

    public long getMode() {
        return kv.get(OracleKeys.mode(), Long.class).orElse(DEFAULT_MODE);
    }

    public void setMode(long mode) {
        kv.set(OracleKeys.mode(), mode);
    }

    /** Increments the diagnostic aggregation counter and returns the new value. */
    public long incrementPerfCount() {
        long next = getPerfCount() + 1;
        kv.set(OracleKeys.perfCount(), next);
        return next;
    }

    public long getPerfCount() {
        return kv.get(OracleKeys.perfCount(), Long.class).orElse(0L);
    }
}
