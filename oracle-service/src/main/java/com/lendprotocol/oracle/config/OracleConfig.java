package com.lendprotocol.oracle.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lendprotocol.common.capability.LedgerClock;
import com.lendprotocol.common.capability.PriceSourceResolver;
import com.lendprotocol.common.capability.StoredAdminGate;
import com.lendprotocol.common.capability.StoredReentrancyGuard;
import com.lendprotocol.common.capability.SystemLedgerClock;
import com.lendprotocol.common.model.Address;
import com.lendprotocol.common.oracle.OracleAggregator;
import com.lendprotocol.common.oracle.OracleStore;
import com.lendprotocol.common.oracle.SourceFailurePolicy;
import com.lendprotocol.common.store.JsonKvStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class OracleConfig {

    private static final Logger log = LoggerFactory.getLogger(OracleConfig.class);

    @Value("${oracle.admin-address}")
    private String adminAddress;

    @Value("${oracle.source-failure-policy:ABORT}")
    private SourceFailurePolicy sourceFailurePolicy;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    public JsonKvStore oracleKvStore(ObjectMapper objectMapper) {
        return new JsonKvStore(objectMapper);
    }

    @Bean
    public LedgerClock ledgerClock() {
        return new SystemLedgerClock(Clock.systemUTC());
    }

    @Bean
    public StoredAdminGate adminGate(JsonKvStore oracleKvStore) {
        StoredAdminGate gate = new StoredAdminGate(oracleKvStore);
        gate.setAdmin(Address.of(adminAddress));
        return gate;
    }

    @Bean
    public OracleStore oracleStore(JsonKvStore oracleKvStore) {
        return new OracleStore(oracleKvStore);
    }

    @Bean
    public OracleAggregator oracleAggregator(OracleStore oracleStore, LedgerClock ledgerClock,
                                             StoredAdminGate adminGate, PriceSourceResolver priceSourceResolver,
                                             JsonKvStore oracleKvStore) {
        log.info("ORACLE_AGGREGATOR_READY admin={} sourceFailurePolicy={}", adminAddress, sourceFailurePolicy);
        return new OracleAggregator(oracleStore, ledgerClock, adminGate, priceSourceResolver,
                                    new StoredReentrancyGuard(oracleKvStore), sourceFailurePolicy);
    }
}
