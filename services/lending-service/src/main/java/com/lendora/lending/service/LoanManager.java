package com.lendora.lending.service;

import com.lendora.lending.client.CreditGate;
import com.lendora.lending.client.ExternalCallGuard;
import com.lendora.lending.config.LendingProperties;
import com.lendora.lending.config.ResilienceConfig;
import com.lendora.lending.domain.CollateralPosition;
import com.lendora.lending.domain.LiquidationEvent;
import com.lendora.lending.domain.Loan;
import com.lendora.lending.domain.LoanActivity;
import com.lendora.lending.domain.LoanActivityType;
import com.lendora.lending.domain.LoanStatus;
import com.lendora.lending.domain.ProtocolParameters;
import com.lendora.lending.domain.RepaymentAllocation;
import com.lendora.lending.dto.OriginateLoanRequest;
import com.lendora.lending.exception.ConcurrencyConflictException;
import com.lendora.lending.exception.ExternalCallFailedException;
import com.lendora.lending.exception.InsufficientCollateralException;
import com.lendora.lending.exception.LendingException;
import com.lendora.lending.exception.LoanNotActiveException;
import com.lendora.lending.exception.LoanNotFoundException;
import com.lendora.lending.exception.StalePriceException;
import com.lendora.lending.exception.ValidationException;
import com.lendora.lending.rate.InterestRateModel;
import com.lendora.lending.repository.LiquidationEventRepository;
import com.lendora.lending.repository.LoanActivityRepository;
import com.lendora.lending.repository.LoanRepository;
import com.lendora.lending.util.BasisPoints;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Single entry point for every loan state change.
 *
 * <p>Each operation takes the loan lock (when a loan exists) and then the lock of the collateral
 * position securing it, and runs its writes in one transaction that commits before the locks are
 * released. Any failure rolls back both the loan and the ledger. Events are published only after
 * the commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanManager {

    private final LoanRepository loanRepository;
    private final LoanActivityRepository activityRepository;
    private final LiquidationEventRepository liquidationEventRepository;
    private final CollateralLedger collateralLedger;
    private final InterestRateModel rateModel;
    private final LiquidationEngine liquidationEngine;
    private final CreditGate creditGate;
    private final ExternalCallGuard callGuard;
    private final ProtocolParameterService parameterService;
    private final LoanLockRegistry lockRegistry;
    private final LoanEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final LendingProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Opens a loan: verifies the credit attestation, posts the collateral, prices the loan from
     * the resulting position ratio and activates it.
     */
    public Loan originate(OriginateLoanRequest request) {
        return guarded("originate", () -> {
            requireId(request.getBorrowerId(), "Borrower");
            requireId(request.getLenderId(), "Lender");
            requireId(request.getCollateralAsset(), "Collateral asset");
            BigDecimal principal = BasisPoints.requirePositiveWholeAmount(request.getPrincipal(), "Principal");
            BigDecimal collateral = BasisPoints.requirePositiveWholeAmount(request.getCollateralAmount(), "Collateral amount");
            int termMonths = requireTerm(request.getTermMonths());
            BigDecimal minPrincipal = properties.getLoan().getMinPrincipal();
            if (principal.compareTo(minPrincipal) < 0) {
                throw new ValidationException("Principal " + principal.toPlainString()
                        + " is below the minimum of " + minPrincipal.toPlainString());
            }

            boolean creditEligible = verifyCredit(request.getBorrowerId(), request.getAttestation());

            Loan loan = lockRegistry.withPosition(request.getBorrowerId(), request.getCollateralAsset(),
                    () -> inTransaction(() -> openLoan(request, principal, collateral, termMonths, creditEligible)));

            meterRegistry.counter("lending.loans.originated", "asset", loan.getCollateralAsset()).increment();
            log.info("Originated loan {} for {}: principal={}, rate={}bps, term={}m, collateral={} {}",
                    loan.getLoanNumber(), loan.getBorrowerId(), loan.getPrincipal(), loan.getInterestRateBps(),
                    loan.getTermMonths(), loan.getCollateralAmount(), loan.getCollateralAsset());
            eventPublisher.publishLoanEvent(LoanEventPublisher.LOAN_ORIGINATED, loan, Map.of(
                    "principal", loan.getPrincipal(),
                    "interestRateBps", loan.getInterestRateBps(),
                    "termMonths", loan.getTermMonths(),
                    "collateralAmount", loan.getCollateralAmount(),
                    "creditEligible", loan.getCreditEligible()));
            return loan;
        });
    }

    /**
     * Applies a repayment, interest first. A fully repaid loan releases its pledged collateral as
     * far as the other loans on the same position allow.
     */
    public Loan repay(Long loanId, BigDecimal amount, String payerId) {
        return guarded("repay", () -> {
            BigDecimal value = BasisPoints.requirePositiveWholeAmount(amount, "Repayment amount");
            requireId(payerId, "Payer");
            Loan target = findLoan(loanId);

            RepaymentOutcome outcome = lockRegistry.withLoanAndPosition(loanId, target.getBorrowerId(), target.getCollateralAsset(),
                    () -> inTransaction(() -> applyRepayment(loanId, value, payerId)));

            Loan loan = outcome.loan();
            RepaymentAllocation allocation = outcome.allocation();
            log.info("Repayment of {} on loan {} by {}: interest={}, principal={}, balance {} -> {}",
                    value, loan.getLoanNumber(), payerId, allocation.getInterestPaid(), allocation.getPrincipalPaid(),
                    allocation.getBalanceBefore(), allocation.getBalanceAfter());
            if (loan.getStatus() == LoanStatus.REPAID) {
                meterRegistry.counter("lending.loans.repaid").increment();
            }
            eventPublisher.publishLoanEvent(
                    loan.getStatus() == LoanStatus.REPAID ? LoanEventPublisher.LOAN_REPAID : LoanEventPublisher.LOAN_REPAYMENT,
                    loan, Map.of(
                            "amount", value,
                            "interestPaid", allocation.getInterestPaid(),
                            "principalPaid", allocation.getPrincipalPaid(),
                            "collateralReleased", outcome.collateralReleased(),
                            "payerId", payerId));
            return loan;
        });
    }

    /**
     * Evaluates a loan against the liquidation threshold and liquidates it when eligible.
     *
     * @throws LoanNotActiveException if the loan already reached a terminal state
     * @throws StalePriceException if no fresh price exists for the collateral
     */
    public LiquidationDecision checkHealth(Long loanId, String liquidatorId) {
        return guarded("checkHealth", () -> {
            requireId(liquidatorId, "Liquidator");
            Loan target = findLoan(loanId);

            LiquidationDecision decision = lockRegistry.withLoanAndPosition(loanId, target.getBorrowerId(), target.getCollateralAsset(),
                    () -> inTransaction(() -> liquidateIfEligible(loanId, liquidatorId)));

            if (decision.isEligible()) {
                meterRegistry.counter("lending.liquidations", "asset", target.getCollateralAsset()).increment();
                log.info("Liquidated loan {} at {}bps (threshold {}bps): seized={}, bonus={}, lender={}, remainder={}",
                        target.getLoanNumber(), decision.getRatioBps(), decision.getThresholdBps(), decision.getSeizeAmount(),
                        decision.getBonusAmount(), decision.getLenderProceeds(), decision.getBorrowerRemainder());
                eventPublisher.publishLoanEvent(LoanEventPublisher.LOAN_LIQUIDATED, findLoan(loanId), Map.of(
                        "ratioBps", decision.getRatioBps(),
                        "seizedAmount", decision.getSeizeAmount(),
                        "bonusAmount", decision.getBonusAmount(),
                        "debtCovered", decision.getDebtCovered(),
                        "liquidatorId", liquidatorId));
            } else {
                log.debug("Loan {} healthy at {}bps", target.getLoanNumber(), decision.getRatioBps());
            }
            return decision;
        });
    }

    public LiquidationDecision expire(Long loanId) {
        return expire(loanId, properties.getMonitor().getKeeperId());
    }

    /**
     * Defaults a matured loan with a balance left and settles it from its collateral.
     *
     * @throws ValidationException if the loan has not matured yet
     */
    public LiquidationDecision expire(Long loanId, String actorId) {
        return guarded("expire", () -> {
            requireId(actorId, "Actor");
            Loan target = findLoan(loanId);

            LiquidationDecision decision = lockRegistry.withLoanAndPosition(loanId, target.getBorrowerId(), target.getCollateralAsset(),
                    () -> inTransaction(() -> settleExpired(loanId, actorId)));

            meterRegistry.counter("lending.defaults", "asset", target.getCollateralAsset()).increment();
            log.info("Loan {} defaulted at maturity: seized={}, debtCovered={} of {}, remainder={}",
                    target.getLoanNumber(), decision.getSeizeAmount(), decision.getDebtCovered(), decision.getDebt(),
                    decision.getBorrowerRemainder());
            eventPublisher.publishLoanEvent(LoanEventPublisher.LOAN_DEFAULTED, findLoan(loanId), Map.of(
                    "seizedAmount", decision.getSeizeAmount(),
                    "debtCovered", decision.getDebtCovered(),
                    "borrowerRemainder", decision.getBorrowerRemainder()));
            return decision;
        });
    }

    public CollateralPosition postCollateral(String borrowerId, String assetId, BigDecimal amount) {
        return guarded("postCollateral", () -> {
            requireId(borrowerId, "Borrower");
            requireId(assetId, "Asset");
            return lockRegistry.withPosition(borrowerId, assetId,
                    () -> inTransaction(() -> collateralLedger.post(borrowerId, assetId, amount, null)));
        });
    }

    /**
     * Withdraws collateral as long as the loans secured by the position stay at the minimum ratio.
     */
    public CollateralPosition withdrawCollateral(String borrowerId, String assetId, BigDecimal amount) {
        return guarded("withdrawCollateral", () -> {
            requireId(borrowerId, "Borrower");
            requireId(assetId, "Asset");
            return lockRegistry.withPosition(borrowerId, assetId, () -> inTransaction(() ->
                    collateralLedger.withdraw(borrowerId, assetId, amount, securedPrincipal(borrowerId, assetId, null))));
        });
    }

    /**
     * Outstanding principal of the active loans secured by a position, optionally leaving one loan out.
     */
    public BigDecimal securedPrincipal(String borrowerId, String assetId, Long excludedLoanId) {
        return loanRepository.findByBorrowerIdAndCollateralAssetAndStatus(borrowerId, assetId, LoanStatus.ACTIVE).stream()
                .filter(loan -> !loan.getId().equals(excludedLoanId))
                .map(Loan::getOutstandingPrincipal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    // Transactional steps, run under the locks

    private Loan openLoan(OriginateLoanRequest request, BigDecimal principal, BigDecimal collateral,
                          int termMonths, boolean creditEligible) {
        String borrowerId = request.getBorrowerId();
        String assetId = request.getCollateralAsset();
        ProtocolParameters parameters = parameterService.current();

        BigDecimal secured = securedPrincipal(borrowerId, assetId, null).add(principal);
        CollateralSnapshot snapshot = collateralLedger.snapshot(borrowerId, assetId, secured);
        int ratio = BasisPoints.collateralRatio(snapshot.getCollateralAmount().add(collateral), snapshot.getPrice(), secured);
        if (ratio < parameters.getMinCollateralRatioBps()) {
            throw new InsufficientCollateralException("Collateral ratio " + ratio + "bps is below the minimum of "
                    + parameters.getMinCollateralRatioBps() + "bps");
        }

        int rate = rateModel.computeRate(parameters, ratio, creditEligible);
        BigDecimal totalInterest = InterestRateModel.computeTotalInterest(principal, rate, termMonths);
        Instant now = clock.instant();

        Loan loan = loanRepository.save(Loan.builder()
                .loanNumber(generateLoanNumber())
                .borrowerId(borrowerId)
                .lenderId(request.getLenderId())
                .principal(principal)
                .interestRateBps(rate)
                .termMonths(termMonths)
                .totalInterest(totalInterest)
                .outstandingPrincipal(principal)
                .outstandingInterest(totalInterest)
                .collateralAsset(assetId)
                .collateralAmount(collateral)
                .originationRatioBps(ratio)
                .creditEligible(creditEligible)
                .parameterVersion(parameters.getVersion())
                .status(LoanStatus.PENDING)
                .originatedAt(now)
                .maturityAt(Loan.maturityOf(now, termMonths))
                .build());

        collateralLedger.post(borrowerId, assetId, collateral, loan.getId());
        loan.transitionTo(LoanStatus.ACTIVE, now);
        loan = loanRepository.save(loan);

        recordActivity(loan, LoanActivityType.ORIGINATED, principal, null, null,
                BigDecimal.ZERO, loan.getOutstandingBalance(), LoanStatus.PENDING, borrowerId, now);
        return loan;
    }

    private RepaymentOutcome applyRepayment(Long loanId, BigDecimal amount, String payerId) {
        Loan loan = findLoan(loanId);
        LoanStatus statusBefore = loan.getStatus();
        RepaymentAllocation allocation = loan.applyRepayment(amount);
        Instant now = clock.instant();

        BigDecimal released = BigDecimal.ZERO;
        if (allocation.isSettled()) {
            loan.transitionTo(LoanStatus.REPAID, now);
            released = releaseAfterRepayment(loan);
        }
        loan = loanRepository.save(loan);

        recordActivity(loan, LoanActivityType.REPAYMENT, amount, allocation.getInterestPaid(), allocation.getPrincipalPaid(),
                allocation.getBalanceBefore(), allocation.getBalanceAfter(), statusBefore, payerId, now);
        return new RepaymentOutcome(loan, allocation, released);
    }

    private BigDecimal releaseAfterRepayment(Loan loan) {
        String borrowerId = loan.getBorrowerId();
        String assetId = loan.getCollateralAsset();
        BigDecimal remainingSecured = securedPrincipal(borrowerId, assetId, loan.getId());
        BigDecimal releasable;
        try {
            releasable = collateralLedger.releasableAmount(borrowerId, assetId, loan.getCollateralAmount(), remainingSecured);
        } catch (StalePriceException e) {
            log.warn("Collateral of repaid loan {} kept on the position: {}", loan.getLoanNumber(), e.getMessage());
            return BigDecimal.ZERO;
        }
        collateralLedger.release(borrowerId, assetId, releasable, loan.getId());
        return releasable;
    }

    private LiquidationDecision liquidateIfEligible(Long loanId, String liquidatorId) {
        Loan loan = requireActive(loanId);
        ProtocolParameters parameters = parameterService.current();
        BigDecimal secured = securedPrincipal(loan.getBorrowerId(), loan.getCollateralAsset(), null);

        CollateralSnapshot snapshot = collateralLedger.snapshot(loan.getBorrowerId(), loan.getCollateralAsset(), secured);
        LiquidationDecision decision = liquidationEngine.evaluate(parameters, loan, snapshot);
        if (!decision.isEligible()) {
            return decision;
        }

        // Re-read the position and price right before writing; a recovery in between cancels the liquidation.
        CollateralSnapshot confirmation = collateralLedger.snapshot(loan.getBorrowerId(), loan.getCollateralAsset(), secured);
        if (confirmation.differsFrom(snapshot)) {
            decision = liquidationEngine.evaluate(parameters, loan, confirmation);
            if (!decision.isEligible()) {
                log.info("Liquidation of loan {} cancelled, ratio recovered to {}bps", loan.getLoanNumber(), decision.getRatioBps());
                return decision;
            }
        }

        settle(loan, decision, LoanStatus.LIQUIDATED, LoanActivityType.LIQUIDATED, liquidatorId);
        return decision;
    }

    private LiquidationDecision settleExpired(Long loanId, String actorId) {
        Loan loan = requireActive(loanId);
        Instant now = clock.instant();
        if (!loan.isMatured(now)) {
            throw new ValidationException("Loan " + loan.getLoanNumber() + " matures at " + loan.getMaturityAt());
        }

        ProtocolParameters parameters = parameterService.current();
        BigDecimal secured = securedPrincipal(loan.getBorrowerId(), loan.getCollateralAsset(), null);
        CollateralSnapshot snapshot = collateralLedger.snapshot(loan.getBorrowerId(), loan.getCollateralAsset(), secured);
        LiquidationDecision decision = liquidationEngine.settleDefault(parameters, loan, snapshot);

        settle(loan, decision, LoanStatus.DEFAULTED, LoanActivityType.DEFAULTED, actorId);
        return decision;
    }

    /**
     * Closes the loan from its collateral. The covered debt is booked against the loan before it
     * turns terminal; the remainder goes back to the borrower unless other active loans still
     * rely on the position.
     */
    private void settle(Loan loan, LiquidationDecision decision, LoanStatus target, LoanActivityType activityType, String actorId) {
        Instant now = clock.instant();
        String borrowerId = loan.getBorrowerId();
        String assetId = loan.getCollateralAsset();
        LoanStatus statusBefore = loan.getStatus();

        RepaymentAllocation allocation = loan.applyRepayment(decision.getDebtCovered());
        loan.transitionTo(target, now);

        collateralLedger.seize(borrowerId, assetId, decision.getSeizeAmount(), loan.getId());
        BigDecimal remainder = decision.getBorrowerRemainder();
        boolean positionShared = securedPrincipal(borrowerId, assetId, loan.getId()).signum() > 0;
        if (remainder.signum() > 0 && !positionShared) {
            collateralLedger.release(borrowerId, assetId, remainder, loan.getId());
        } else {
            remainder = BigDecimal.ZERO;
        }
        loanRepository.save(loan);

        liquidationEventRepository.save(LiquidationEvent.builder()
                .loanId(loan.getId())
                .borrowerId(borrowerId)
                .reason(decision.getReason())
                .triggeringRatioBps(decision.getRatioBps())
                .price(decision.getPrice())
                .collateralBefore(decision.getCollateralAmount())
                .seizedAmount(decision.getSeizeAmount())
                .bonusAmount(decision.getBonusAmount())
                .lenderProceeds(decision.getLenderProceeds())
                .borrowerRemainder(remainder)
                .debtCovered(decision.getDebtCovered())
                .liquidatorId(actorId)
                .occurredAt(now)
                .build());

        recordActivity(loan, activityType, decision.getDebtCovered(), allocation.getInterestPaid(), allocation.getPrincipalPaid(),
                allocation.getBalanceBefore(), allocation.getBalanceAfter(), statusBefore, actorId, now);
    }

    // Helpers

    private boolean verifyCredit(String borrowerId, String attestation) {
        if (attestation == null || attestation.isBlank()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(callGuard.execute(ResilienceConfig.CREDIT_GATE,
                    () -> creditGate.verify(borrowerId, attestation)));
        } catch (ExternalCallFailedException e) {
            log.warn("Credit verification unavailable for {} (timedOut={}), pricing as not eligible: {}",
                    borrowerId, e.isTimedOut(), e.getMessage());
            return false;
        }
    }

    private <T> T inTransaction(Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("Concurrent update detected, retry the operation", e);
        }
    }

    private <T> T guarded(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (LendingException e) {
            meterRegistry.counter("lending.operations.rejected", "operation", operation, "code", e.getErrorCode()).increment();
            log.warn("{} rejected [{}]: {}", operation, e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    private Loan findLoan(Long loanId) {
        if (loanId == null) {
            throw new ValidationException("Loan id is required");
        }
        return loanRepository.findById(loanId)
                .orElseThrow(() -> new LoanNotFoundException("Loan not found: " + loanId));
    }

    private Loan requireActive(Long loanId) {
        Loan loan = findLoan(loanId);
        if (!loan.isActive()) {
            throw new LoanNotActiveException("Loan " + loan.getLoanNumber() + " is " + loan.getStatus());
        }
        return loan;
    }

    private int requireTerm(Integer termMonths) {
        int max = properties.getLoan().getMaxTermMonths();
        if (termMonths == null || termMonths < 1 || termMonths > max) {
            throw new ValidationException("Term must be between 1 and " + max + " months, was " + termMonths);
        }
        return termMonths;
    }

    private static void requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " id is required");
        }
    }

    private static String generateLoanNumber() {
        return "LN-" + UUID.randomUUID().toString().replace("-", "").substring(0, 16).toUpperCase();
    }

    private void recordActivity(Loan loan, LoanActivityType type, BigDecimal amount, BigDecimal interest, BigDecimal principal,
                                BigDecimal balanceBefore, BigDecimal balanceAfter, LoanStatus statusBefore,
                                String actorId, Instant at) {
        activityRepository.save(LoanActivity.builder()
                .loanId(loan.getId())
                .type(type)
                .amount(amount)
                .interestAmount(interest)
                .principalAmount(principal)
                .balanceBefore(balanceBefore)
                .balanceAfter(balanceAfter)
                .statusBefore(statusBefore)
                .statusAfter(loan.getStatus())
                .actorId(actorId)
                .occurredAt(at)
                .build());
    }

    private record RepaymentOutcome(Loan loan, RepaymentAllocation allocation, BigDecimal collateralReleased) {
    }
}
