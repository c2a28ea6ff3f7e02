package com.lendora.lending.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only record of a change to a collateral position.
 */
@Entity
@Immutable
@Table(name = "collateral_movements", indexes = {
        @Index(name = "idx_movements_position", columnList = "borrower_id, asset_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class CollateralMovement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "borrower_id", nullable = false)
    private String borrowerId;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Column(name = "loan_id")
    private Long loanId;

    @Column(name = "movement_type", nullable = false)
    @Enumerated(EnumType.STRING)
    private CollateralMovementType type;

    @Column(name = "amount", nullable = false, precision = 38, scale = 0)
    private BigDecimal amount;

    @Column(name = "balance_before", nullable = false, precision = 38, scale = 0)
    private BigDecimal balanceBefore;

    @Column(name = "balance_after", nullable = false, precision = 38, scale = 0)
    private BigDecimal balanceAfter;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;
}
