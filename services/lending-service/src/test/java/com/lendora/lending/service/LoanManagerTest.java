package com.lendora.lending.service;

import com.lendora.lending.client.CreditGate;
import com.lendora.lending.client.ExternalCallGuard;
import com.lendora.lending.config.LendingProperties;
import com.lendora.lending.domain.CollateralPosition;
import com.lendora.lending.domain.LiquidationEvent;
import com.lendora.lending.domain.LiquidationReason;
import com.lendora.lending.domain.Loan;
import com.lendora.lending.domain.LoanActivity;
import com.lendora.lending.domain.LoanActivityType;
import com.lendora.lending.domain.LoanStatus;
import com.lendora.lending.domain.ProtocolParameters;
import com.lendora.lending.dto.OriginateLoanRequest;
import com.lendora.lending.exception.InsufficientCollateralException;
import com.lendora.lending.exception.LoanNotActiveException;
import com.lendora.lending.exception.LoanNotFoundException;
import com.lendora.lending.exception.OverRepaymentException;
import com.lendora.lending.exception.StalePriceException;
import com.lendora.lending.exception.ValidationException;
import com.lendora.lending.exception.VerificationUnavailableException;
import com.lendora.lending.rate.InterestRateModel;
import com.lendora.lending.repository.LiquidationEventRepository;
import com.lendora.lending.repository.LoanActivityRepository;
import com.lendora.lending.repository.LoanRepository;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for LoanManager with real rate model, liquidation engine and lock registry, and
 * mocked persistence, ledger and credit gate.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("LoanManager Unit Tests")
class LoanManagerTest {

    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");
    private static final String BORROWER = "borrower-1";
    private static final String LENDER = "pool-1";
    private static final String ASSET = "ETH";
    private static final Long LOAN_ID = 1L;

    private static final ProtocolParameters PARAMETERS = ProtocolParameters.builder()
            .version(4L)
            .baseRateBps(500)
            .riskPremiumMultiplier(1000)
            .minCollateralRatioBps(15000)
            .liquidationThresholdBps(12000)
            .liquidationBonusBps(500)
            .build();

    @Mock
    private LoanRepository loanRepository;

    @Mock
    private LoanActivityRepository activityRepository;

    @Mock
    private LiquidationEventRepository liquidationEventRepository;

    @Mock
    private CollateralLedger collateralLedger;

    @Mock
    private CreditGate creditGate;

    @Mock
    private ProtocolParameterService parameterService;

    @Mock
    private LoanEventPublisher eventPublisher;

    @Mock
    private TransactionTemplate transactionTemplate;

    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private LoanManager loanManager;

    @BeforeEach
    void setUp() {
        LendingProperties properties = new LendingProperties();
        properties.getLoan().setMinPrincipal(new BigDecimal("1000"));
        properties.getLocking().setWaitTimeout(Duration.ofSeconds(1));

        executor = Executors.newCachedThreadPool();
        meterRegistry = new SimpleMeterRegistry();

        loanManager = new LoanManager(loanRepository, activityRepository, liquidationEventRepository, collateralLedger,
                new InterestRateModel(parameterService), new LiquidationEngine(parameterService), creditGate,
                new ExternalCallGuard(TimeLimiterRegistry.ofDefaults(), executor), parameterService,
                new LoanLockRegistry(properties), eventPublisher, transactionTemplate, properties, meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC));

        lenient().when(parameterService.current()).thenReturn(PARAMETERS);
        lenient().when(transactionTemplate.execute(any()))
                .thenAnswer(invocation -> invocation.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
        lenient().when(loanRepository.save(any(Loan.class))).thenAnswer(invocation -> {
            Loan loan = invocation.getArgument(0);
            if (loan.getId() == null) {
                loan.setId(LOAN_ID);
            }
            return loan;
        });
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Loan activeLoan(String outstandingPrincipal, String outstandingInterest) {
        return Loan.builder()
                .id(LOAN_ID)
                .loanNumber("LN-1")
                .borrowerId(BORROWER)
                .lenderId(LENDER)
                .principal(new BigDecimal("10000"))
                .interestRateBps(450)
                .termMonths(12)
                .totalInterest(new BigDecimal("450"))
                .outstandingPrincipal(new BigDecimal(outstandingPrincipal))
                .outstandingInterest(new BigDecimal(outstandingInterest))
                .collateralAsset(ASSET)
                .collateralAmount(new BigDecimal("15000"))
                .originationRatioBps(15000)
                .creditEligible(true)
                .parameterVersion(4L)
                .status(LoanStatus.ACTIVE)
                .originatedAt(NOW.minus(Duration.ofDays(30)))
                .maturityAt(Loan.maturityOf(NOW.minus(Duration.ofDays(30)), 12))
                .build();
    }

    private static CollateralSnapshot snapshot(String collateral, String price, String secured) {
        return CollateralSnapshot.builder()
                .borrowerId(BORROWER)
                .assetId(ASSET)
                .collateralAmount(new BigDecimal(collateral))
                .price(new BigDecimal(price))
                .priceObservedAt(NOW)
                .securedPrincipal(new BigDecimal(secured))
                .build();
    }

    private static OriginateLoanRequest request(String principal, String collateral, String attestation) {
        return OriginateLoanRequest.builder()
                .borrowerId(BORROWER)
                .lenderId(LENDER)
                .principal(new BigDecimal(principal))
                .termMonths(12)
                .collateralAsset(ASSET)
                .collateralAmount(new BigDecimal(collateral))
                .attestation(attestation)
                .build();
    }

    private double counter(String name) {
        return meterRegistry.find(name).counters().stream().mapToDouble(c -> c.count()).sum();
    }

    @Nested
    @DisplayName("Origination")
    class Origination {

        @BeforeEach
        void noExistingLoans() {
            lenient().when(loanRepository.findByBorrowerIdAndCollateralAssetAndStatus(BORROWER, ASSET, LoanStatus.ACTIVE))
                    .thenReturn(List.of());
        }

        @Test
        @DisplayName("Well collateralized eligible borrower gets the prime rate")
        void originatesActiveLoan() {
            when(creditGate.verify(BORROWER, "proof")).thenReturn(true);
            when(collateralLedger.snapshot(eq(BORROWER), eq(ASSET), any())).thenReturn(snapshot("0", "2", "10000"));

            Loan loan = loanManager.originate(request("10000", "10000", "proof"));

            assertThat(loan.getStatus()).isEqualTo(LoanStatus.ACTIVE);
            assertThat(loan.getOriginationRatioBps()).isEqualTo(20000);
            assertThat(loan.getInterestRateBps()).isEqualTo(450);
            assertThat(loan.getTotalInterest()).isEqualByComparingTo("450");
            assertThat(loan.getOutstandingBalance()).isEqualByComparingTo("10450");
            assertThat(loan.getParameterVersion()).isEqualTo(4L);
            assertThat(loan.getCreditEligible()).isTrue();
            assertThat(loan.getMaturityAt()).isEqualTo(Instant.parse("2027-06-01T12:00:00Z"));
            assertThat(loan.getLoanNumber()).startsWith("LN-");

            verify(collateralLedger).post(BORROWER, ASSET, new BigDecimal("10000"), LOAN_ID);
            ArgumentCaptor<LoanActivity> activity = ArgumentCaptor.forClass(LoanActivity.class);
            verify(activityRepository).save(activity.capture());
            assertThat(activity.getValue().getType()).isEqualTo(LoanActivityType.ORIGINATED);
            assertThat(activity.getValue().getStatusBefore()).isEqualTo(LoanStatus.PENDING);
            assertThat(activity.getValue().getStatusAfter()).isEqualTo(LoanStatus.ACTIVE);
            verify(eventPublisher).publishLoanEvent(eq(LoanEventPublisher.LOAN_ORIGINATED), same(loan), anyMap());
            assertThat(counter("lending.loans.originated")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Existing loans on the position count toward the ratio")
        void crossCollateral() {
            when(loanRepository.findByBorrowerIdAndCollateralAssetAndStatus(BORROWER, ASSET, LoanStatus.ACTIVE))
                    .thenReturn(List.of(activeLoan("10000", "450")));
            when(collateralLedger.snapshot(eq(BORROWER), eq(ASSET), any())).thenReturn(snapshot("15000", "1", "20000"));

            // (15000 + 15000) * 1 * 10000 / 20000 = 15000
            Loan loan = loanManager.originate(request("10000", "15000", null));

            assertThat(loan.getOriginationRatioBps()).isEqualTo(15000);
            verify(collateralLedger).snapshot(BORROWER, ASSET, new BigDecimal("20000"));
        }

        @Test
        @DisplayName("Missing attestation prices the loan as not eligible without calling the gate")
        void noAttestation() {
            when(collateralLedger.snapshot(eq(BORROWER), eq(ASSET), any())).thenReturn(snapshot("0", "2", "10000"));

            Loan loan = loanManager.originate(request("10000", "10000", " "));

            assertThat(loan.getCreditEligible()).isFalse();
            assertThat(loan.getInterestRateBps()).isEqualTo(600);
            verifyNoInteractions(creditGate);
        }

        @Test
        @DisplayName("Unavailable verifier is treated as not eligible")
        void verifierUnavailable() {
            when(creditGate.verify(BORROWER, "proof")).thenThrow(new VerificationUnavailableException("down"));
            when(collateralLedger.snapshot(eq(BORROWER), eq(ASSET), any())).thenReturn(snapshot("0", "2", "10000"));

            Loan loan = loanManager.originate(request("10000", "10000", "proof"));

            assertThat(loan.getCreditEligible()).isFalse();
            assertThat(loan.getInterestRateBps()).isEqualTo(600);
        }

        @Test
        @DisplayName("Insufficient collateral is rejected before anything is written")
        void insufficientCollateral() {
            when(collateralLedger.snapshot(eq(BORROWER), eq(ASSET), any())).thenReturn(snapshot("0", "1", "10000"));

            assertThatThrownBy(() -> loanManager.originate(request("10000", "14999", null)))
                    .isInstanceOf(InsufficientCollateralException.class);

            verify(collateralLedger, never()).post(any(), any(), any(), any());
            verify(loanRepository, never()).save(any());
            verifyNoInteractions(activityRepository, eventPublisher);
            assertThat(counter("lending.operations.rejected")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Stale price blocks origination")
        void stalePrice() {
            when(collateralLedger.snapshot(eq(BORROWER), eq(ASSET), any())).thenThrow(new StalePriceException("stale"));

            assertThatThrownBy(() -> loanManager.originate(request("10000", "20000", null)))
                    .isInstanceOf(StalePriceException.class);

            verify(loanRepository, never()).save(any());
        }

        @Test
        @DisplayName("Principal below the minimum is rejected")
        void belowMinimumPrincipal() {
            assertThatThrownBy(() -> loanManager.originate(request("999", "20000", null)))
                    .isInstanceOf(ValidationException.class);

            verifyNoInteractions(collateralLedger, creditGate);
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 361})
        @DisplayName("Term outside [1, 360] months is rejected")
        void invalidTerm(int term) {
            OriginateLoanRequest request = request("10000", "20000", null);
            request.setTermMonths(term);

            assertThatThrownBy(() -> loanManager.originate(request)).isInstanceOf(ValidationException.class);
            verifyNoInteractions(collateralLedger);
        }
    }

    @Nested
    @DisplayName("Repayment")
    class Repayment {

        @Test
        @DisplayName("Partial repayment settles interest first and keeps the loan active")
        void partialRepayment() {
            Loan loan = activeLoan("10000", "450");
            when(loanRepository.findById(LOAN_ID)).thenReturn(Optional.of(loan));

            loanManager.repay(LOAN_ID, new BigDecimal("1000"), BORROWER);

            assertThat(loan.getStatus()).isEqualTo(LoanStatus.ACTIVE);
            assertThat(loan.getOutstandingInterest()).isEqualByComparingTo("0");
            assertThat(loan.getOutstandingPrincipal()).isEqualByComparingTo("9450");
            verify(collateralLedger, never()).release(any(), any(), any(), any());
            verify(eventPublisher).publishLoanEvent(eq(LoanEventPublisher.LOAN_REPAYMENT), same(loan), anyMap());
        }

        @Test
        @DisplayName("Full repayment closes the loan and releases its collateral")
        void fullRepayment() {
            Loan loan = activeLoan("10000", "450");
            when(loanRepository.findById(LOAN_ID)).thenReturn(Optional.of(loan));
            when(loanRepository.findByBorrowerIdAndCollateralAssetAndStatus(BORROWER, ASSET, LoanStatus.ACTIVE))
                    .thenReturn(List.of(loan));
            when(collateralLedger.releasableAmount(BORROWER, ASSET, new BigDecimal("15000"), BigDecimal.ZERO))
                    .thenReturn(new BigDecimal("15000"));

            loanManager.repay(LOAN_ID, new BigDecimal("10450"), BORROWER);

            assertThat(loan.getStatus()).isEqualTo(LoanStatus.REPAID);
            assertThat(loan.getClosedAt()).isEqualTo(NOW);
            verify(collateralLedger).release(BORROWER, ASSET, new BigDecimal("15000"), LOAN_ID);
            verify(eventPublisher).publishLoanEvent(eq(LoanEventPublisher.LOAN_REPAID), same(loan), anyMap());
            assertThat(counter("lending.loans.repaid")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Stale price keeps the collateral on the position but still closes the loan")
        void repaidWithStalePrice() {
            Loan loan = activeLoan("10000", "450");
            when(loanRepository.findById(LOAN_ID)).thenReturn(Optional.of(loan));
            when(loanRepository.findByBorrowerIdAndCollateralAssetAndStatus(BORROWER, ASSET, LoanStatus.ACTIVE))
                    .thenReturn(List.of(loan, activeLoan("5000", "0").toBuilder().id(2L).build()));
            when(collateralLedger.releasableAmount(any(), any(), any(), any())).thenThrow(new StalePriceException("stale"));

            loanManager.repay(LOAN_ID, new BigDecimal("10450"), BORROWER);

            assertThat(loan.getStatus()).isEqualTo(LoanStatus.REPAID);
            verify(collateralLedger, never()).release(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Repaying more than the balance is rejected")
        void overRepayment() {
            Loan loan = activeLoan("10000", "450");
            when(loanRepository.findById(LOAN_ID)).thenReturn(Optional.of(loan));

            assertThatThrownBy(() -> loanManager.repay(LOAN_ID, new BigDecimal("10451"), BORROWER))
                    .isInstanceOf(OverRepaymentException.class);

            assertThat(loan.getOutstandingBalance()).isEqualByComparingTo("10450");
            verify(loanRepository, never()).save(any());
            verifyNoInteractions(activityRepository);
        }

        @Test
        @DisplayName("Closed loans reject repayment")
        void closedLoan() {
            Loan loan = activeLoan("10000", "450");
            loan.transitionTo(LoanStatus.LIQUIDATED, NOW);
            when(loanRepository.findById(LOAN_ID)).thenReturn(Optional.of(loan));

            assertThatThrownBy(() -> loanManager.repay(LOAN_ID, BigDecimal.ONE, BORROWER))
                    .isInstanceOf(LoanNotActiveException.class);
        }

        @Test
        @DisplayName("Unknown loan is reported as not found")
        void unknownLoan() {
            when(loanRepository.findById(99L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> loanManager.repay(99L, BigDecimal.ONE, BORROWER))
                    .isInstanceOf(LoanNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Health check")
    class HealthCheck {

        private Loan loan;

        @BeforeEach
        void setUpLoan() {
            loan = activeLoan("10000", "0");
            lenient().when(loanRepository.findById(LOAN_ID)).thenReturn(Optional.of(loan));
            lenient().when(loanRepository.findByBorrowerIdAndCollateralAssetAndStatus(BORROWER, ASSET, LoanStatus.ACTIVE))
                    .thenReturn(List.of(loan));
        }

        @Test
        @DisplayName("Undercollateralized loan is liquidated and the remainder returned")
        void liquidates() {
            when(collateralLedger.snapshot(eq(BORROWER), eq(ASSET), any())).thenReturn(snapshot("11500", "1", "10000"));

            LiquidationDecision decision = loanManager.checkHealth(LOAN_ID, "keeper-7");

            assertThat(decision.isEligible()).isTrue();
            assertThat(loan.getStatus()).isEqualTo(LoanStatus.LIQUIDATED);
            assertThat(loan.getOutstandingBalance()).isEqualByComparingTo("0");
            verify(collateralLedger).seize(BORROWER, ASSET, new BigDecimal("10527"), LOAN_ID);
            verify(collateralLedger).release(BORROWER, ASSET, new BigDecimal("973"), LOAN_ID);

            ArgumentCaptor<LiquidationEvent> event = ArgumentCaptor.forClass(LiquidationEvent.class);
            verify(liquidationEventRepository).save(event.capture());
            assertThat(event.getValue().getReason()).isEqualTo(LiquidationReason.HEALTH_BREACH);
            assertThat(event.getValue().getTriggeringRatioBps()).isEqualTo(11500);
            assertThat(event.getValue().getBonusAmount()).isEqualByComparingTo("526");
            assertThat(event.getValue().getLiquidatorId()).isEqualTo("keeper-7");
            verify(eventPublisher).publishLoanEvent(eq(LoanEventPublisher.LOAN_LIQUIDATED), same(loan), anyMap());
            assertThat(counter("lending.liquidations")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Remainder stays on a position shared with other active loans")
        void sharedPosition() {
            Loan other = activeLoan("1000", "0").toBuilder().id(2L).loanNumber("LN-2").build();
            when(loanRepository.findByBorrowerIdAndCollateralAssetAndStatus(BORROWER, ASSET, LoanStatus.ACTIVE))
                    .thenReturn(List.of(loan, other));
            when(collateralLedger.snapshot(eq(BORROWER), eq(ASSET), any())).thenReturn(snapshot("12000", "1", "11000"));

            LiquidationDecision decision = loanManager.checkHealth(LOAN_ID, "keeper-7");

            assertThat(decision.getRatioBps()).isEqualTo(10909);
            verify(collateralLedger).seize(BORROWER, ASSET, new BigDecimal("10527"), LOAN_ID);
            verify(collateralLedger, never()).release(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Healthy loan is left alone")
        void healthy() {
            when(collateralLedger.snapshot(eq(BORROWER), eq(ASSET), any())).thenReturn(snapshot("12500", "1", "10000"));

            LiquidationDecision decision = loanManager.checkHealth(LOAN_ID, "keeper-7");

            assertThat(decision.isEligible()).isFalse();
            assertThat(loan.getStatus()).isEqualTo(LoanStatus.ACTIVE);
            verify(collateralLedger, never()).seize(any(), any(), any(), any());
            verifyNoInteractions(liquidationEventRepository, eventPublisher);
        }

        @Test
        @DisplayName("A price recovery seen right before commit cancels the liquidation")
        void recoveredBeforeCommit() {
            when(collateralLedger.snapshot(eq(BORROWER), eq(ASSET), any()))
                    .thenReturn(snapshot("11500", "1", "10000"))
                    .thenReturn(snapshot("11500", "1.2", "10000"));

            LiquidationDecision decision = loanManager.checkHealth(LOAN_ID, "keeper-7");

            assertThat(decision.isEligible()).isFalse();
            assertThat(decision.getRatioBps()).isEqualTo(13800);
            assertThat(loan.getStatus()).isEqualTo(LoanStatus.ACTIVE);
            verify(collateralLedger, never()).seize(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Closed loan fails as not active")
        void closedLoan() {
            loan.transitionTo(LoanStatus.REPAID, NOW);

            assertThatThrownBy(() -> loanManager.checkHealth(LOAN_ID, "keeper-7"))
                    .isInstanceOf(LoanNotActiveException.class);
            verifyNoInteractions(collateralLedger);
        }

        @Test
        @DisplayName("Stale price never liquidates")
        void stalePrice() {
            when(collateralLedger.snapshot(eq(BORROWER), eq(ASSET), any())).thenThrow(new StalePriceException("stale"));

            assertThatThrownBy(() -> loanManager.checkHealth(LOAN_ID, "keeper-7"))
                    .isInstanceOf(StalePriceException.class);
            assertThat(loan.getStatus()).isEqualTo(LoanStatus.ACTIVE);
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("Loan before maturity cannot be expired")
        void notMatured() {
            Loan loan = activeLoan("10000", "450");
            when(loanRepository.findById(LOAN_ID)).thenReturn(Optional.of(loan));

            assertThatThrownBy(() -> loanManager.expire(LOAN_ID)).isInstanceOf(ValidationException.class);
            assertThat(loan.getStatus()).isEqualTo(LoanStatus.ACTIVE);
        }

        @Test
        @DisplayName("Matured loan defaults and is settled from its collateral")
        void defaults() {
            Loan loan = activeLoan("10000", "450").toBuilder()
                    .maturityAt(NOW.minusSeconds(1))
                    .build();
            when(loanRepository.findById(LOAN_ID)).thenReturn(Optional.of(loan));
            when(loanRepository.findByBorrowerIdAndCollateralAssetAndStatus(BORROWER, ASSET, LoanStatus.ACTIVE))
                    .thenReturn(List.of(loan));
            when(collateralLedger.snapshot(eq(BORROWER), eq(ASSET), any())).thenReturn(snapshot("15000", "1", "10000"));

            LiquidationDecision decision = loanManager.expire(LOAN_ID);

            assertThat(loan.getStatus()).isEqualTo(LoanStatus.DEFAULTED);
            assertThat(decision.getBonusAmount()).isEqualByComparingTo("0");
            verify(collateralLedger).seize(BORROWER, ASSET, new BigDecimal("10450"), LOAN_ID);
            verify(collateralLedger).release(BORROWER, ASSET, new BigDecimal("4550"), LOAN_ID);

            ArgumentCaptor<LiquidationEvent> event = ArgumentCaptor.forClass(LiquidationEvent.class);
            verify(liquidationEventRepository).save(event.capture());
            assertThat(event.getValue().getReason()).isEqualTo(LiquidationReason.TERM_EXPIRY);
            assertThat(event.getValue().getLiquidatorId()).isEqualTo("protocol-keeper");
            assertThat(counter("lending.defaults")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Collateral")
    class Collateral {

        @Test
        @DisplayName("Withdrawal is checked against every active loan on the position")
        void withdrawUsesSecuredPrincipal() {
            when(loanRepository.findByBorrowerIdAndCollateralAssetAndStatus(BORROWER, ASSET, LoanStatus.ACTIVE))
                    .thenReturn(List.of(activeLoan("10000", "450"), activeLoan("2500", "0").toBuilder().id(2L).build()));
            CollateralPosition position = CollateralPosition.builder().borrowerId(BORROWER).assetId(ASSET).build();
            when(collateralLedger.withdraw(BORROWER, ASSET, BigDecimal.TEN, new BigDecimal("12500"))).thenReturn(position);

            assertThat(loanManager.withdrawCollateral(BORROWER, ASSET, BigDecimal.TEN)).isSameAs(position);
        }

        @Test
        @DisplayName("Blank borrower is rejected")
        void blankBorrower() {
            assertThatThrownBy(() -> loanManager.postCollateral(" ", ASSET, BigDecimal.TEN))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(collateralLedger);
        }
    }
}
