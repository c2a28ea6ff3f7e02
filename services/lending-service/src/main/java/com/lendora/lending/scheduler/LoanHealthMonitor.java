package com.lendora.lending.scheduler;

import com.lendora.lending.config.LendingProperties;
import com.lendora.lending.domain.Loan;
import com.lendora.lending.domain.LoanStatus;
import com.lendora.lending.exception.LendingException;
import com.lendora.lending.repository.LoanRepository;
import com.lendora.lending.service.CollateralLedger;
import com.lendora.lending.service.LiquidationDecision;
import com.lendora.lending.service.LoanManager;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Keeper sweep over active loans: refreshes the prices backing them, defaults matured loans and
 * liquidates unhealthy ones. A failure on one loan is logged and the sweep moves on.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "lending.monitor", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LoanHealthMonitor {

    private final LoanRepository loanRepository;
    private final CollateralLedger collateralLedger;
    private final LoanManager loanManager;
    private final LendingProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${lending.monitor.interval:PT30S}", initialDelayString = "${lending.monitor.interval:PT30S}")
    public void scheduledSweep() {
        SweepResult result = sweep();
        if (result.getLiquidated() > 0 || result.getDefaulted() > 0 || result.getFailed() > 0) {
            log.info("Health sweep: checked={}, liquidated={}, defaulted={}, failed={}",
                    result.getChecked(), result.getLiquidated(), result.getDefaulted(), result.getFailed());
        }
    }

    public SweepResult sweep() {
        refreshPrices();

        String keeperId = properties.getMonitor().getKeeperId();
        Instant now = clock.instant();
        int checked = 0;
        int liquidated = 0;
        int defaulted = 0;
        int failed = 0;

        List<Loan> active = loanRepository.findByStatus(LoanStatus.ACTIVE);
        for (Loan loan : active) {
            checked++;
            try {
                if (loan.isMatured(now)) {
                    loanManager.expire(loan.getId(), keeperId);
                    defaulted++;
                } else {
                    LiquidationDecision decision = loanManager.checkHealth(loan.getId(), keeperId);
                    if (decision.isEligible()) {
                        liquidated++;
                    }
                }
            } catch (LendingException e) {
                failed++;
                meterRegistry.counter("lending.monitor.failures", "code", e.getErrorCode()).increment();
                log.warn("Health sweep skipped loan {} [{}]: {}", loan.getLoanNumber(), e.getErrorCode(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                meterRegistry.counter("lending.monitor.failures", "code", "UNEXPECTED").increment();
                log.error("Health sweep failed on loan {}", loan.getLoanNumber(), e);
            }
        }
        return new SweepResult(checked, liquidated, defaulted, failed);
    }

    private void refreshPrices() {
        for (String assetId : loanRepository.findDistinctCollateralAssetsByStatus(LoanStatus.ACTIVE)) {
            if (collateralLedger.isPegged(assetId)) {
                continue;
            }
            try {
                collateralLedger.refreshPrice(assetId);
            } catch (LendingException e) {
                log.warn("Price refresh for {} failed: {}", assetId, e.getMessage());
            }
        }
    }

    @Value
    public static class SweepResult {
        int checked;
        int liquidated;
        int defaulted;
        int failed;
    }
}
