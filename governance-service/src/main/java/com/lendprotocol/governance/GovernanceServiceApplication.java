package com.lendprotocol.governance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Governance service: proposal lifecycle (propose → vote → queue → execute) with quorum
 * and timelock, exposed over REST.
 */
@SpringBootApplication
public class GovernanceServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GovernanceServiceApplication.class, args);
    }
}
