package com.lendora.lending.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable record of a liquidation or a default settlement.
 */
@Entity
@Immutable
@Table(name = "liquidation_events", indexes = {
        @Index(name = "idx_liquidations_loan", columnList = "loan_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class LiquidationEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "loan_id", nullable = false)
    private Long loanId;

    @Column(name = "borrower_id", nullable = false)
    private String borrowerId;

    @Column(name = "reason", nullable = false)
    @Enumerated(EnumType.STRING)
    private LiquidationReason reason;

    @Column(name = "triggering_ratio_bps", nullable = false)
    private Integer triggeringRatioBps;

    @Column(name = "price", nullable = false, precision = 38, scale = 18)
    private BigDecimal price;

    @Column(name = "collateral_before", nullable = false, precision = 38, scale = 0)
    private BigDecimal collateralBefore;

    @Column(name = "seized_amount", nullable = false, precision = 38, scale = 0)
    private BigDecimal seizedAmount;

    @Column(name = "bonus_amount", nullable = false, precision = 38, scale = 0)
    private BigDecimal bonusAmount;

    @Column(name = "lender_proceeds", nullable = false, precision = 38, scale = 0)
    private BigDecimal lenderProceeds;

    @Column(name = "borrower_remainder", nullable = false, precision = 38, scale = 0)
    private BigDecimal borrowerRemainder;

    @Column(name = "debt_covered", nullable = false, precision = 38, scale = 0)
    private BigDecimal debtCovered;

    @Column(name = "liquidator_id")
    private String liquidatorId;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;
}
