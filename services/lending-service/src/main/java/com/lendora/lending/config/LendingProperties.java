package com.lendora.lending.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration for the lending protocol.
 *
 * Rate, collateral and liquidation values only seed the versioned protocol parameters at
 * startup; runtime changes go through the administrative interface and are audited.
 */
@Data
@ConfigurationProperties(prefix = "lending")
public class LendingProperties {

    private Rate rate = new Rate();
    private Collateral collateral = new Collateral();
    private Liquidation liquidation = new Liquidation();
    private Loan loan = new Loan();
    private Locking locking = new Locking();
    private Oracle oracle = new Oracle();
    private CreditGate creditGate = new CreditGate();
    private Events events = new Events();
    private Monitor monitor = new Monitor();

    /**
     * Actors allowed to change protocol parameters.
     */
    private Set<String> administrators = new LinkedHashSet<>(Set.of("protocol-admin"));

    @Data
    public static class Rate {
        private int baseRateBps = 500;
        private int riskPremiumMultiplier = 1000;
    }

    @Data
    public static class Collateral {
        /**
         * Ratio required at origination and after any withdrawal.
         */
        private int minCollateralRatioBps = 15000;
        private Duration priceFreshness = Duration.ofHours(1);
        /**
         * Assets priced at exactly one principal unit per collateral unit, without an oracle call.
         */
        private List<String> peggedAssets = List.of("USDC", "USDT", "DAI");
    }

    @Data
    public static class Liquidation {
        private int thresholdBps = 12000;
        private int bonusBps = 500;
    }

    @Data
    public static class Loan {
        /**
         * 0.1 ETH in wei.
         */
        private BigDecimal minPrincipal = new BigDecimal("100000000000000000");
        private int maxTermMonths = 360;
    }

    @Data
    public static class Locking {
        private Duration waitTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Oracle {
        private String baseUrl = "http://localhost:8091";
        private Duration timeout = Duration.ofSeconds(3);
    }

    @Data
    public static class CreditGate {
        private String baseUrl = "http://localhost:8092";
        private Duration timeout = Duration.ofSeconds(3);
    }

    @Data
    public static class Events {
        private boolean enabled = true;
        private String loanTopic = "lending-loan-events";
        private String parameterTopic = "lending-parameter-events";
    }

    @Data
    public static class Monitor {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(30);
        private String keeperId = "protocol-keeper";
    }
}
