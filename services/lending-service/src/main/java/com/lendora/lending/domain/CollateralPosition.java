package com.lendora.lending.domain;

import com.lendora.lending.exception.InsufficientCollateralException;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Collateral a borrower holds in one asset. Every active loan of the borrower in that asset is
 * secured by the whole position.
 */
@Entity
@Table(name = "collateral_positions",
        uniqueConstraints = @UniqueConstraint(name = "uk_position_borrower_asset", columnNames = {"borrower_id", "asset_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EntityListeners(AuditingEntityListener.class)
public class CollateralPosition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "borrower_id", nullable = false)
    private String borrowerId;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Setter(AccessLevel.NONE)
    @Column(name = "amount", nullable = false, precision = 38, scale = 0)
    @Builder.Default
    private BigDecimal amount = BigDecimal.ZERO;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    public void credit(BigDecimal value) {
        this.amount = amount.add(value);
    }

    public void debit(BigDecimal value) {
        if (value.compareTo(amount) > 0) {
            throw new InsufficientCollateralException("Position " + borrowerId + "/" + assetId + " holds "
                    + amount.toPlainString() + ", cannot remove " + value.toPlainString());
        }
        this.amount = amount.subtract(value);
    }
}
