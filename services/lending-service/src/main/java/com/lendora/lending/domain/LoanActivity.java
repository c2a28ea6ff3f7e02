package com.lendora.lending.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only history of a loan. Replaying the rows in order reconstructs every balance and
 * status the loan went through and who caused each change.
 */
@Entity
@Immutable
@Table(name = "loan_activities", indexes = {
        @Index(name = "idx_activities_loan", columnList = "loan_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class LoanActivity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "loan_id", nullable = false)
    private Long loanId;

    @Column(name = "activity_type", nullable = false)
    @Enumerated(EnumType.STRING)
    private LoanActivityType type;

    @Column(name = "amount", nullable = false, precision = 38, scale = 0)
    private BigDecimal amount;

    @Column(name = "interest_amount", precision = 38, scale = 0)
    private BigDecimal interestAmount;

    @Column(name = "principal_amount", precision = 38, scale = 0)
    private BigDecimal principalAmount;

    @Column(name = "balance_before", nullable = false, precision = 38, scale = 0)
    private BigDecimal balanceBefore;

    @Column(name = "balance_after", nullable = false, precision = 38, scale = 0)
    private BigDecimal balanceAfter;

    @Column(name = "status_before", nullable = false)
    @Enumerated(EnumType.STRING)
    private LoanStatus statusBefore;

    @Column(name = "status_after", nullable = false)
    @Enumerated(EnumType.STRING)
    private LoanStatus statusAfter;

    @Column(name = "actor_id", nullable = false)
    private String actorId;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;
}
