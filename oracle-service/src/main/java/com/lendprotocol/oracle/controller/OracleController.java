package com.lendprotocol.oracle.controller;

import com.lendprotocol.common.model.OracleSource;
import com.lendprotocol.oracle.dto.ParameterRequest;
import com.lendprotocol.oracle.dto.ParameterResponse;
import com.lendprotocol.oracle.dto.PriceResponse;
import com.lendprotocol.oracle.dto.SourceRequest;
import com.lendprotocol.oracle.service.OracleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.List;

/**
 * REST API for the price-source registry, price reads and oracle tunables.
 */
@RestController
@RequestMapping("/api/v1/oracle")
public class OracleController {

    private static final Logger log = LoggerFactory.getLogger(OracleController.class);

    static final String CALLER_HEADER = "X-Caller";

    private final OracleService oracleService;

    public OracleController(OracleService oracleService) {
        this.oracleService = oracleService;
    }

    @PutMapping("/assets/{asset}/sources")
    public Mono<ResponseEntity<List<OracleSource>>> setSource(
            @RequestHeader(name = CALLER_HEADER, required = false) String caller,
            @PathVariable String asset,
            @RequestBody SourceRequest request) {
        log.info("Source registration requested. caller={} asset={} source={} heartbeat={}",
                 caller, asset, request.address(), request.lastHeartbeat());
        return oracleService.setSource(caller, asset, request)
            .map(ResponseEntity::ok);
    }

    @DeleteMapping("/assets/{asset}/sources/{address}")
    public Mono<ResponseEntity<List<OracleSource>>> removeSource(
            @RequestHeader(name = CALLER_HEADER, required = false) String caller,
            @PathVariable String asset,
            @PathVariable String address) {
        log.info("Source removal requested. caller={} asset={} source={}", caller, asset, address);
        return oracleService.removeSource(caller, asset, address)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/assets/{asset}/sources")
    public Mono<ResponseEntity<List<OracleSource>>> getSources(@PathVariable String asset) {
        return oracleService.getSources(asset)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/assets/{asset}/prices")
    public Mono<ResponseEntity<List<BigInteger>>> fetchPrices(@PathVariable String asset) {
        log.info("Price fetch requested. asset={}", asset);
        return oracleService.fetchPrices(asset)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/assets/{asset}/price")
    public Mono<ResponseEntity<PriceResponse>> aggregatePrice(@PathVariable String asset) {
        log.info("Aggregated price requested. asset={}", asset);
        return oracleService.aggregatePrice(asset)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Price endpoint error. asset={}", asset, e));
    }

    @GetMapping("/params/heartbeat-ttl")
    public Mono<ResponseEntity<ParameterResponse>> getHeartbeatTtl() {
        return oracleService.getHeartbeatTtl()
            .map(v -> ResponseEntity.ok(new ParameterResponse("heartbeat-ttl", v)));
    }

    @PutMapping("/params/heartbeat-ttl")
    public Mono<ResponseEntity<ParameterResponse>> setHeartbeatTtl(
            @RequestHeader(name = CALLER_HEADER, required = false) String caller,
            @RequestBody ParameterRequest request) {
        log.info("Heartbeat TTL update requested. caller={} ttl={}", caller, request.value());
        return oracleService.setHeartbeatTtl(caller, request.value())
            .map(v -> ResponseEntity.ok(new ParameterResponse("heartbeat-ttl", v)));
    }

    @GetMapping("/params/mode")
    public Mono<ResponseEntity<ParameterResponse>> getMode() {
        return oracleService.getMode()
            .map(v -> ResponseEntity.ok(new ParameterResponse("mode", v)));
    }

    @PutMapping("/params/mode")
    public Mono<ResponseEntity<ParameterResponse>> setMode(
            @RequestHeader(name = CALLER_HEADER, required = false) String caller,
            @RequestBody ParameterRequest request) {
        log.info("Aggregation mode update requested. caller={} mode={}", caller, request.value());
        return oracleService.setMode(caller, request.value())
            .map(v -> ResponseEntity.ok(new ParameterResponse("mode", v)));
    }

    @GetMapping("/params/perf-count")
    public Mono<ResponseEntity<ParameterResponse>> getPerfCount() {
        return oracleService.getPerfCount()
            .map(v -> ResponseEntity.ok(new ParameterResponse("perf-count", v)));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
