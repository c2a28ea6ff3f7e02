package com.lendora.lending.domain;

import com.lendora.lending.exception.LoanNotActiveException;
import com.lendora.lending.exception.OverRepaymentException;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Entity representing a collateralized loan.
 *
 * Interest is simple interest fixed at origination and scheduled up front, so the outstanding
 * balance only ever decreases while the loan is active. Repayments settle interest first.
 */
@Entity
@Table(name = "loans", indexes = {
        @Index(name = "idx_loans_borrower", columnList = "borrower_id"),
        @Index(name = "idx_loans_status_maturity", columnList = "status, maturity_at"),
        @Index(name = "idx_loans_position", columnList = "borrower_id, collateral_asset, status")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EntityListeners(AuditingEntityListener.class)
public class Loan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "loan_number", unique = true, nullable = false)
    private String loanNumber;

    @Column(name = "borrower_id", nullable = false)
    private String borrowerId;

    /**
     * Lender identity or liquidity pool reference.
     */
    @Column(name = "lender_id", nullable = false)
    private String lenderId;

    @Column(name = "principal", nullable = false, precision = 38, scale = 0)
    private BigDecimal principal;

    @Column(name = "interest_rate_bps", nullable = false)
    private Integer interestRateBps;

    @Column(name = "term_months", nullable = false)
    private Integer termMonths;

    @Column(name = "total_interest", nullable = false, precision = 38, scale = 0)
    private BigDecimal totalInterest;

    @Column(name = "outstanding_principal", nullable = false, precision = 38, scale = 0)
    private BigDecimal outstandingPrincipal;

    @Column(name = "outstanding_interest", nullable = false, precision = 38, scale = 0)
    private BigDecimal outstandingInterest;

    @Column(name = "collateral_asset", nullable = false)
    private String collateralAsset;

    /**
     * Collateral posted with the origination request.
     */
    @Column(name = "collateral_amount", nullable = false, precision = 38, scale = 0)
    private BigDecimal collateralAmount;

    @Column(name = "origination_ratio_bps", nullable = false)
    private Integer originationRatioBps;

    @Column(name = "credit_eligible", nullable = false)
    private Boolean creditEligible;

    @Column(name = "parameter_version", nullable = false)
    private Long parameterVersion;

    @Setter(AccessLevel.NONE)
    @Column(name = "status", nullable = false)
    @Enumerated(EnumType.STRING)
    private LoanStatus status;

    @Column(name = "originated_at", nullable = false)
    private Instant originatedAt;

    @Column(name = "maturity_at", nullable = false)
    private Instant maturityAt;

    @Setter(AccessLevel.NONE)
    @Column(name = "closed_at")
    private Instant closedAt;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    // Business methods

    public BigDecimal getOutstandingBalance() {
        return outstandingPrincipal.add(outstandingInterest);
    }

    public boolean isActive() {
        return status == LoanStatus.ACTIVE;
    }

    public boolean isMatured(Instant now) {
        return !now.isBefore(maturityAt);
    }

    /**
     * Moves the loan along its lifecycle. A terminal loan never changes status again.
     */
    public void transitionTo(LoanStatus target, Instant at) {
        if (status.isTerminal()) {
            throw new LoanNotActiveException("Loan " + loanNumber + " is already " + status);
        }
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Cannot move loan " + loanNumber + " from " + status + " to " + target);
        }
        this.status = target;
        if (target.isTerminal()) {
            this.closedAt = at;
        }
    }

    /**
     * Applies a repayment, interest first. The loan must be active and the amount must not
     * exceed the outstanding balance.
     */
    public RepaymentAllocation applyRepayment(BigDecimal amount) {
        if (!isActive()) {
            throw new LoanNotActiveException("Loan " + loanNumber + " is " + status + ", repayment rejected");
        }
        BigDecimal balanceBefore = getOutstandingBalance();
        if (amount.compareTo(balanceBefore) > 0) {
            throw new OverRepaymentException("Repayment " + amount.toPlainString()
                    + " exceeds outstanding balance " + balanceBefore.toPlainString() + " of loan " + loanNumber);
        }

        BigDecimal interestPaid = amount.min(outstandingInterest);
        BigDecimal principalPaid = amount.subtract(interestPaid);
        this.outstandingInterest = outstandingInterest.subtract(interestPaid);
        this.outstandingPrincipal = outstandingPrincipal.subtract(principalPaid);

        return new RepaymentAllocation(interestPaid, principalPaid, balanceBefore, getOutstandingBalance());
    }

    /**
     * Maturity is the origination instant plus the term in calendar months (UTC).
     */
    public static Instant maturityOf(Instant originatedAt, int termMonths) {
        return originatedAt.atOffset(ZoneOffset.UTC).plusMonths(termMonths).toInstant();
    }
}
