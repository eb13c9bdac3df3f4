package com.lendprotocol.oracle.service;

import com.lendprotocol.common.model.Address;
import com.lendprotocol.common.model.OracleSource;
import com.lendprotocol.common.oracle.OracleAggregator;
import com.lendprotocol.oracle.dto.PriceResponse;
import com.lendprotocol.oracle.dto.SourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Reactive facade over {@link OracleAggregator}. Price reads call out to the sources and
 * hold the store lock while doing so, so every call runs on the bounded-elastic scheduler.
 */
@Service
public class OracleService {

    private static final Logger log = LoggerFactory.getLogger(OracleService.class);

    private final OracleAggregator aggregator;

    public OracleService(OracleAggregator aggregator) {
        this.aggregator = aggregator;
    }

    public Mono<List<OracleSource>> setSource(String caller, String asset, SourceRequest request) {
        return call(() -> {
            Address assetAddress = Address.of(asset);
            aggregator.setSource(callerAddress(caller), assetAddress,
                new OracleSource(Address.of(request.address()), request.weight(), request.lastHeartbeat()));
            return aggregator.getSources(assetAddress);
        });
    }

    public Mono<List<OracleSource>> removeSource(String caller, String asset, String source) {
        return call(() -> {
            Address assetAddress = Address.of(asset);
            aggregator.removeSource(callerAddress(caller), assetAddress, Address.of(source));
            return aggregator.getSources(assetAddress);
        });
    }

    public Mono<List<OracleSource>> getSources(String asset) {
        return call(() -> aggregator.getSources(Address.of(asset)));
    }

    public Mono<List<BigInteger>> fetchPrices(String asset) {
        return call(() -> aggregator.fetchPrices(Address.of(asset)))
            .doOnError(e -> log.warn("Price fetch failed. asset={} reason={}", asset, e.getMessage()));
    }

    public Mono<PriceResponse> aggregatePrice(String asset) {
        return call(() -> aggregator.aggregatePrice(Address.of(asset))
                .map(price -> new PriceResponse(asset, price, true))
                .orElseGet(() -> new PriceResponse(asset, null, false)))
            .doOnError(e -> log.warn("Price aggregation failed. asset={} reason={}", asset, e.getMessage()));
    }

    public Mono<Long> getHeartbeatTtl() {
        return call(aggregator::getHeartbeatTtl);
    }

    public Mono<Long> setHeartbeatTtl(String caller, long ttlSeconds) {
        return call(() -> {
            aggregator.setHeartbeatTtl(callerAddress(caller), ttlSeconds);
            return aggregator.getHeartbeatTtl();
        });
    }

    public Mono<Long> getMode() {
        return call(aggregator::getMode);
    }

    public Mono<Long> setMode(String caller, long mode) {
        return call(() -> {
            aggregator.setMode(callerAddress(caller), mode);
            return aggregator.getMode();
        });
    }

    public Mono<Long> getPerfCount() {
        return call(aggregator::getPerfCount);
    }

    private static Address callerAddress(String caller) {
        return caller == null || caller.isBlank() ? null : Address.of(caller);
    }

    private static <T> Mono<T> call(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }
}
