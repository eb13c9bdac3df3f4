package com.lendprotocol.governance.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lendprotocol.common.capability.LedgerClock;
import com.lendprotocol.common.capability.StoredAdminGate;
import com.lendprotocol.common.capability.SystemLedgerClock;
import com.lendprotocol.common.governance.GovernanceEngine;
import com.lendprotocol.common.governance.GovernanceStore;
import com.lendprotocol.common.governance.RepeatVotePolicy;
import com.lendprotocol.common.model.Address;
import com.lendprotocol.common.store.JsonKvStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class GovernanceConfig {

    private static final Logger log = LoggerFactory.getLogger(GovernanceConfig.class);

    @Value("${governance.admin-address}")
    private String adminAddress;

    @Value("${governance.repeat-vote-policy:ACCUMULATE}")
    private RepeatVotePolicy repeatVotePolicy;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    public JsonKvStore governanceKvStore(ObjectMapper objectMapper) {
        return new JsonKvStore(objectMapper);
    }

    @Bean
    public LedgerClock ledgerClock() {
        return new SystemLedgerClock(Clock.systemUTC());
    }

    @Bean
    public StoredAdminGate adminGate(JsonKvStore governanceKvStore) {
        StoredAdminGate gate = new StoredAdminGate(governanceKvStore);
        gate.setAdmin(Address.of(adminAddress));
        return gate;
    }

    @Bean
    public GovernanceStore governanceStore(JsonKvStore governanceKvStore) {
        return new GovernanceStore(governanceKvStore);
    }

    @Bean
    public GovernanceEngine governanceEngine(GovernanceStore governanceStore, LedgerClock ledgerClock,
                                             StoredAdminGate adminGate) {
        log.info("GOVERNANCE_ENGINE_READY admin={} repeatVotePolicy={}", adminAddress, repeatVotePolicy);
        return new GovernanceEngine(governanceStore, ledgerClock, adminGate, repeatVotePolicy);
    }
}
