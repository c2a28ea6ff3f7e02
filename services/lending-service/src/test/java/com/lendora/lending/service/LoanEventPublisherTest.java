package com.lendora.lending.service;

import com.lendora.lending.config.LendingProperties;
import com.lendora.lending.domain.Loan;
import com.lendora.lending.domain.LoanStatus;
import com.lendora.lending.domain.ProtocolParameter;
import com.lendora.lending.domain.ProtocolParameterChange;
import com.lendora.lending.domain.ProtocolParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LoanEventPublisher Unit Tests")
class LoanEventPublisherTest {

    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private LendingProperties properties;
    private LoanEventPublisher publisher;

    private Loan loan;

    @BeforeEach
    void setUp() {
        properties = new LendingProperties();
        publisher = new LoanEventPublisher(kafkaTemplate, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        loan = Loan.builder()
                .id(42L)
                .loanNumber("LN-42")
                .borrowerId("borrower-1")
                .lenderId("pool-1")
                .outstandingPrincipal(new BigDecimal("9000"))
                .outstandingInterest(new BigDecimal("100"))
                .collateralAsset("ETH")
                .status(LoanStatus.ACTIVE)
                .build();
    }

    @Test
    @DisplayName("Loan event is keyed by loan id and carries the loan state and details")
    @SuppressWarnings("unchecked")
    void publishesLoanEvent() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(CompletableFuture.completedFuture(null));

        publisher.publishLoanEvent(LoanEventPublisher.LOAN_REPAYMENT, loan, Map.of("amount", new BigDecimal("500")));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("lending-loan-events"), eq("42"), payload.capture());
        Map<String, Object> event = (Map<String, Object>) payload.getValue();
        assertThat(event)
                .containsEntry("eventType", "LOAN_REPAYMENT")
                .containsEntry("loanNumber", "LN-42")
                .containsEntry("status", LoanStatus.ACTIVE)
                .containsEntry("amount", new BigDecimal("500"))
                .containsEntry("timestamp", NOW);
        assertThat((BigDecimal) event.get("outstandingBalance")).isEqualByComparingTo("9100");
    }

    @Test
    @DisplayName("Parameter change event lists the new values under the version")
    @SuppressWarnings("unchecked")
    void publishesParameterChange() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(CompletableFuture.completedFuture(null));
        ProtocolParameters parameters = ProtocolParameters.builder()
                .version(3L)
                .baseRateBps(600)
                .riskPremiumMultiplier(1000)
                .minCollateralRatioBps(15000)
                .liquidationThresholdBps(12000)
                .liquidationBonusBps(500)
                .build();
        ProtocolParameterChange change = ProtocolParameterChange.builder()
                .parameter(ProtocolParameter.BASE_RATE)
                .oldValue(500)
                .newValue(600)
                .versionNumber(3L)
                .changedBy("protocol-admin")
                .changedAt(NOW)
                .build();

        publisher.publishParameterChange(parameters, List.of(change));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("lending-parameter-events"), eq("3"), payload.capture());
        Map<String, Object> event = (Map<String, Object>) payload.getValue();
        assertThat(event)
                .containsEntry("eventType", LoanEventPublisher.PARAMETERS_CHANGED)
                .containsEntry("version", 3L)
                .containsEntry("changedBy", "protocol-admin");
        assertThat((Map<String, Object>) event.get("changes")).containsEntry("BASE_RATE", 600);
    }

    @Test
    @DisplayName("Nothing is sent when events are disabled")
    void disabled() {
        properties.getEvents().setEnabled(false);

        publisher.publishLoanEvent(LoanEventPublisher.LOAN_ORIGINATED, loan, Map.of());

        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    @DisplayName("Broker failures never reach the caller")
    void failureSwallowed() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("broker down"));

        assertThatCode(() -> publisher.publishLoanEvent(LoanEventPublisher.LOAN_REPAID, loan, Map.of()))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Asynchronous delivery failure is only logged")
    void asyncFailure() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("timeout")));

        assertThatCode(() -> publisher.publishLoanEvent(LoanEventPublisher.LOAN_REPAID, loan, Map.of()))
                .doesNotThrowAnyException();
    }
}
