package com.lendprotocol.oracle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Oracle service: per-asset price-source registry and the staleness-filtered
 * median/mean price aggregation, exposed over REST.
 */
@SpringBootApplication
public class OracleServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OracleServiceApplication.class, args);
    }
}
