package com.lendora.lending.scheduler;

import com.lendora.lending.config.LendingProperties;
import com.lendora.lending.domain.Loan;
import com.lendora.lending.domain.LoanStatus;
import com.lendora.lending.exception.StalePriceException;
import com.lendora.lending.repository.LoanRepository;
import com.lendora.lending.service.CollateralLedger;
import com.lendora.lending.service.LiquidationDecision;
import com.lendora.lending.service.LoanManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LoanHealthMonitor Unit Tests")
class LoanHealthMonitorTest {

    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");

    @Mock
    private LoanRepository loanRepository;

    @Mock
    private CollateralLedger collateralLedger;

    @Mock
    private LoanManager loanManager;

    private SimpleMeterRegistry meterRegistry;
    private LoanHealthMonitor monitor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        monitor = new LoanHealthMonitor(loanRepository, collateralLedger, loanManager, new LendingProperties(),
                meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Loan loan(long id, Instant maturity) {
        return Loan.builder()
                .id(id)
                .loanNumber("LN-" + id)
                .collateralAsset("ETH")
                .status(LoanStatus.ACTIVE)
                .maturityAt(maturity)
                .build();
    }

    private static LiquidationDecision eligible() {
        return LiquidationDecision.builder()
                .outcome(LiquidationDecision.Outcome.ELIGIBLE)
                .ratioBps(11000)
                .build();
    }

    @Test
    @DisplayName("Sweep defaults matured loans and liquidates unhealthy ones")
    void sweepsActiveLoans() {
        when(loanRepository.findDistinctCollateralAssetsByStatus(LoanStatus.ACTIVE)).thenReturn(List.of("ETH", "USDC"));
        when(collateralLedger.isPegged("ETH")).thenReturn(false);
        when(collateralLedger.isPegged("USDC")).thenReturn(true);
        when(loanRepository.findByStatus(LoanStatus.ACTIVE)).thenReturn(List.of(
                loan(1L, NOW.minusSeconds(60)),
                loan(2L, NOW.plusSeconds(3600)),
                loan(3L, NOW.plusSeconds(3600))));
        when(loanManager.checkHealth(2L, "protocol-keeper")).thenReturn(eligible());
        when(loanManager.checkHealth(3L, "protocol-keeper"))
                .thenReturn(LiquidationDecision.none(14000, 12000, BigDecimal.ONE, BigDecimal.TEN));

        LoanHealthMonitor.SweepResult result = monitor.sweep();

        assertThat(result.getChecked()).isEqualTo(3);
        assertThat(result.getDefaulted()).isEqualTo(1);
        assertThat(result.getLiquidated()).isEqualTo(1);
        assertThat(result.getFailed()).isZero();
        verify(loanManager).expire(1L, "protocol-keeper");
        verify(collateralLedger).refreshPrice("ETH");
        verify(collateralLedger, never()).refreshPrice("USDC");
    }

    @Test
    @DisplayName("A failing loan is counted and the sweep continues")
    void failureDoesNotStopSweep() {
        when(loanRepository.findDistinctCollateralAssetsByStatus(LoanStatus.ACTIVE)).thenReturn(List.of("ETH"));
        when(collateralLedger.refreshPrice("ETH")).thenThrow(new StalePriceException("oracle down"));
        when(loanRepository.findByStatus(LoanStatus.ACTIVE)).thenReturn(List.of(
                loan(1L, NOW.plusSeconds(3600)),
                loan(2L, NOW.plusSeconds(3600))));
        when(loanManager.checkHealth(1L, "protocol-keeper")).thenThrow(new StalePriceException("no price"));
        when(loanManager.checkHealth(2L, "protocol-keeper")).thenThrow(new IllegalStateException("boom"));

        LoanHealthMonitor.SweepResult result = monitor.sweep();

        assertThat(result.getChecked()).isEqualTo(2);
        assertThat(result.getFailed()).isEqualTo(2);
        assertThat(meterRegistry.find("lending.monitor.failures").counters())
                .extracting(counter -> counter.getId().getTag("code"))
                .containsExactlyInAnyOrder("STALE_PRICE", "UNEXPECTED");
    }
}
