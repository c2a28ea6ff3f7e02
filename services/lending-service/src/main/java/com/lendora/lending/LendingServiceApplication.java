package com.lendora.lending;

import com.lendora.lending.config.LendingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot Application for the Lendora Lending Service
 *
 * This service owns the collateralized lending protocol core:
 * - Loan origination with a risk-adjusted interest rate
 * - Collateral ledger with external price references
 * - Opaque credit eligibility gate
 * - Liquidation and default settlement
 *
 * Architecture:
 * - RESTful API for synchronous operations
 * - PostgreSQL for persistent storage
 * - Kafka for lifecycle event publication
 * - Per-loan locking for status transitions
 */
@SpringBootApplication
@EnableConfigurationProperties(LendingProperties.class)
@EnableTransactionManagement
@EnableScheduling
public class LendingServiceApplication {

    /**
     * Main entry point for the Lending Service
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        System.setProperty("spring.application.name", "lending-service");

        SpringApplication application = new SpringApplication(LendingServiceApplication.class);
        application.setRegisterShutdownHook(true);
        application.run(args);
    }
}
