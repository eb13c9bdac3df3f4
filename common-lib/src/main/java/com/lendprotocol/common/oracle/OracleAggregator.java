package com.lendprotocol.common.oracle;

import com.lendprotocol.common.capability.AdminGate;
import com.lendprotocol.common.capability.LedgerClock;
import com.lendprotocol.common.capability.PriceSourceResolver;
import com.lendprotocol.common.capability.ReentrancyGuard;
import com.lendprotocol.common.exception.ProtocolException;
import com.lendprotocol.common.model.Address;
import com.lendprotocol.common.model.AggregationMode;
import com.lendprotocol.common.model.OracleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Source registry plus the fetch → filter → aggregate pipeline.
 *
 * <h3>Fetch</h3>
 * <ol>
 *   <li>Skip sources whose heartbeat is older than the TTL.</li>
 *   <li>Call {@code getPrice(asset)} on each live source, in registration order.</li>
 *   <li>Drop non-positive results.</li>
 * </ol>
 * A failing call is handled per {@link SourceFailurePolicy}. Source calls run under the
 * {@link ReentrancyGuard}: a source calling back into the aggregator on the same thread fails
 * with {@code REENTRANT_CALL}. A callback arriving on another thread (e.g. over HTTP) cannot
 * see the guard flag, which is still an uncommitted write; it blocks on the store lock until
 * the outer call's source request times out and fails with {@code EXTERNAL_CALL_FAILED}.
 *
 * <p>Registry mutations and tunables are admin-gated. Each public entry point is one
 * atomic invocation; an aborted fetch leaves no trace, the performance counter included.
 */
public class OracleAggregator {

    private static final Logger log = LoggerFactory.getLogger(OracleAggregator.class);

    private final OracleStore store;
    private final LedgerClock clock;
    private final AdminGate adminGate;
    private final PriceSourceResolver resolver;
    private final ReentrancyGuard reentrancyGuard;
    private final SourceFailurePolicy failurePolicy;

    public OracleAggregator(OracleStore store, LedgerClock clock, AdminGate adminGate,
                            PriceSourceResolver resolver, ReentrancyGuard reentrancyGuard,
                            SourceFailurePolicy failurePolicy) {
        this.store           = store;
        this.clock           = clock;
        this.adminGate       = adminGate;
        this.resolver        = resolver;
        this.reentrancyGuard = reentrancyGuard;
        this.failurePolicy   = failurePolicy;
    }

    /**
     * Registers {@code source} for {@code asset}, replacing an entry with the same address
     * in place or appending otherwise.
     */
    public void setSource(Address caller, Address asset, OracleSource source) {
        store.inInvocation("set_source", () -> {
            adminGate.requireAdmin(caller);
            if (source.weight() < 0 || source.lastHeartbeat() < 0) {
                throw ProtocolException.invalidAmount("source weight and heartbeat must not be negative: weight="
                    + source.weight() + " lastHeartbeat=" + source.lastHeartbeat());
            }
            List<OracleSource> out = new ArrayList<>();
            boolean replaced = false;
            for (OracleSource existing : store.getSources(asset)) {
                if (existing.address().equals(source.address())) {
                    out.add(source);
                    replaced = true;
                } else {
                    out.add(existing);
                }
            }
            if (!replaced) {
                out.add(source);
            }
            store.putSources(asset, out);
            log.info("SOURCE_SET asset={} source={} replaced={} sourceCount={}",
                     asset, source.address(), replaced, out.size());
            return null;
        });
    }

    /** Drops every entry for {@code address}; removing an unknown address is not an error. */
    public void removeSource(Address caller, Address asset, Address address) {
        store.inInvocation("remove_source", () -> {
            adminGate.requireAdmin(caller);
            List<OracleSource> current = store.getSources(asset);
            List<OracleSource> out = current.stream()
                .filter(s -> !s.address().equals(address))
                .toList();
            store.putSources(asset, out);
            log.info("SOURCE_REMOVED asset={} source={} removed={}",
                     asset, address, current.size() - out.size());
            return null;
        });
    }

    /**
     * Live, positive prices for {@code asset}, unsorted.
     */
    public List<BigInteger> fetchPrices(Address asset) {
        return store.inInvocation("fetch_prices",
            () -> reentrancyGuard.guard(() -> collectPrices(asset)));
    }

    /**
     * Aggregated price per the configured {@link AggregationMode}, or empty when no source
     * produced a usable price. Increments the performance counter on every completed call.
     */
    public Optional<BigInteger> aggregatePrice(Address asset) {
        return store.inInvocation("aggregate_price", () -> reentrancyGuard.guard(() -> {
            List<BigInteger> prices = collectPrices(asset);
            long perf = store.incrementPerfCount();
            AggregationMode mode = AggregationMode.fromCode(store.getMode());
            Optional<BigInteger> price = PriceAggregation.aggregate(prices, mode);
            log.info("PRICE_AGGREGATED asset={} mode={} samples={} price={} perfCount={}",
                     asset, mode, prices.size(), price.orElse(null), perf);
            return price;
        }));
    }

    // ── admin-gated tunables ──────────────────────────────────────────────────

    public void setHeartbeatTtl(Address caller, long ttlSeconds) {
        store.inInvocation("set_heartbeat_ttl", () -> {
            adminGate.requireAdmin(caller);
            if (ttlSeconds < 0) {
                throw ProtocolException.invalidAmount("heartbeat ttl must not be negative: " + ttlSeconds);
            }
            store.setHeartbeatTtl(ttlSeconds);
            log.info("HEARTBEAT_TTL_SET ttlSeconds={} caller={}", ttlSeconds, caller);
            return null;
        });
    }

    public void setMode(Address caller, long mode) {
        store.inInvocation("set_mode", () -> {
            adminGate.requireAdmin(caller);
            store.setMode(mode);
            log.info("AGGREGATION_MODE_SET code={} mode={} caller={}",
                     mode, AggregationMode.fromCode(mode), caller);
            return null;
        });
    }

    // ── reads ─────────────────────────────────────────────────────────────────

    public List<OracleSource> getSources(Address asset) {
        return store.getSources(asset);
    }

    public long getHeartbeatTtl() {
        return store.getHeartbeatTtl();
    }

    public long getMode() {
        return store.getMode();
    }

    public long getPerfCount() {
        return store.getPerfCount();
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private List<BigInteger> collectPrices(Address asset) {
        List<OracleSource> sources = store.getSources(asset);
        long ttl = store.getHeartbeatTtl();
        long now = clock.now();

        List<BigInteger> prices = new ArrayList<>();
        for (OracleSource source : sources) {
            if (source.isStale(now, ttl)) {
                log.debug("SOURCE_STALE asset={} source={} lastHeartbeat={} now={} ttl={}",
                          asset, source.address(), source.lastHeartbeat(), now, ttl);
                continue;
            }
            BigInteger price = callSource(asset, source);
            if (price != null && price.signum() > 0) {
                prices.add(price);
            }
        }
        log.debug("PRICES_FETCHED asset={} sources={} usable={}", asset, sources.size(), prices.size());
        return prices;
    }

    /** Returns {@code null} when the source failed and the policy isolates failures. */
    private BigInteger callSource(Address asset, OracleSource source) {
        try {
            return resolver.resolve(source.address()).getPrice(asset);
        } catch (RuntimeException e) {
            if (failurePolicy == SourceFailurePolicy.ISOLATE) {
                log.warn("SOURCE_CALL_FAILED asset={} source={} policy=ISOLATE reason={}",
                         asset, source.address(), e.getMessage());
                return null;
            }
            log.error("SOURCE_CALL_FAILED asset={} source={} policy=ABORT", asset, source.address(), e);
            if (e instanceof ProtocolException pe) {
                throw pe;
            }
            throw ProtocolException.externalCallFailed(
                "price source " + source.address() + " failed for asset " + asset, e);
        }
    }
}
