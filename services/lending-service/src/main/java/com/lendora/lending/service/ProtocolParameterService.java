package com.lendora.lending.service;

import com.lendora.lending.config.LendingProperties;
import com.lendora.lending.domain.ProtocolParameter;
import com.lendora.lending.domain.ProtocolParameterChange;
import com.lendora.lending.domain.ProtocolParameters;
import com.lendora.lending.exception.UnauthorizedParameterChangeException;
import com.lendora.lending.exception.ValidationException;
import com.lendora.lending.repository.ProtocolParameterChangeRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Versioned, audited protocol configuration.
 *
 * The configured values seed version 0; the persisted change log is replayed on top of them at
 * startup so the current version survives restarts. Every administrative call produces exactly
 * one new version and one audit row per parameter it touched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProtocolParameterService {

    private final ProtocolParameterChangeRepository changeRepository;
    private final LendingProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final LoanEventPublisher eventPublisher;
    private final Clock clock;

    private final AtomicReference<ProtocolParameters> current = new AtomicReference<>();
    private final Object writeLock = new Object();

    @PostConstruct
    public void initialize() {
        ProtocolParameters parameters = seedFromProperties();
        for (ProtocolParameterChange change : changeRepository.findAllByOrderByVersionNumberAscIdAsc()) {
            parameters = parameters.with(change.getParameter(), change.getNewValue())
                    .toBuilder()
                    .version(change.getVersionNumber())
                    .build();
        }
        current.set(parameters);
        log.info("Protocol parameters loaded at version {}: baseRate={}bps, minCollateralRatio={}bps, "
                        + "liquidationThreshold={}bps, liquidationBonus={}bps",
                parameters.getVersion(), parameters.getBaseRateBps(), parameters.getMinCollateralRatioBps(),
                parameters.getLiquidationThresholdBps(), parameters.getLiquidationBonusBps());
    }

    public ProtocolParameters current() {
        ProtocolParameters parameters = current.get();
        if (parameters == null) {
            throw new IllegalStateException("Protocol parameters not initialized");
        }
        return parameters;
    }

    public ProtocolParameters setBaseRate(String actorId, int baseRateBps) {
        return apply(actorId, Map.of(ProtocolParameter.BASE_RATE, baseRateBps));
    }

    public ProtocolParameters setRiskPremiumMultiplier(String actorId, int multiplier) {
        return apply(actorId, Map.of(ProtocolParameter.RISK_PREMIUM_MULTIPLIER, multiplier));
    }

    public ProtocolParameters setMinCollateralRatio(String actorId, int ratioBps) {
        return apply(actorId, Map.of(ProtocolParameter.MIN_COLLATERAL_RATIO, ratioBps));
    }

    public ProtocolParameters setLiquidationParams(String actorId, int thresholdBps, int bonusBps) {
        Map<ProtocolParameter, Integer> changes = new LinkedHashMap<>();
        changes.put(ProtocolParameter.LIQUIDATION_THRESHOLD, thresholdBps);
        changes.put(ProtocolParameter.LIQUIDATION_BONUS, bonusBps);
        return apply(actorId, changes);
    }

    public List<ProtocolParameterChange> history() {
        return changeRepository.findAllByOrderByVersionNumberAscIdAsc();
    }

    private ProtocolParameters apply(String actorId, Map<ProtocolParameter, Integer> changes) {
        authorize(actorId);
        changes.forEach(this::requireInRange);

        synchronized (writeLock) {
            ProtocolParameters before = current();
            ProtocolParameters after = before;
            for (Map.Entry<ProtocolParameter, Integer> change : changes.entrySet()) {
                after = after.with(change.getKey(), change.getValue());
            }
            after = after.toBuilder().version(before.getVersion() + 1).build();
            requireConsistent(after);

            Instant now = clock.instant();
            List<ProtocolParameterChange> rows = new ArrayList<>();
            for (Map.Entry<ProtocolParameter, Integer> change : changes.entrySet()) {
                rows.add(ProtocolParameterChange.builder()
                        .parameter(change.getKey())
                        .oldValue(before.valueOf(change.getKey()))
                        .newValue(change.getValue())
                        .versionNumber(after.getVersion())
                        .changedBy(actorId)
                        .changedAt(now)
                        .build());
            }

            transactionTemplate.execute(status -> changeRepository.saveAll(rows));
            current.set(after);

            rows.forEach(row -> log.info("Protocol parameter {} changed from {} to {} by {} (version {})",
                    row.getParameter(), row.getOldValue(), row.getNewValue(), actorId, row.getVersionNumber()));
            eventPublisher.publishParameterChange(after, rows);
            return after;
        }
    }

    private void authorize(String actorId) {
        if (actorId == null || !properties.getAdministrators().contains(actorId)) {
            log.warn("Rejected protocol parameter change by non-administrator: {}", actorId);
            throw new UnauthorizedParameterChangeException("Actor " + actorId + " may not change protocol parameters");
        }
    }

    private void requireInRange(ProtocolParameter parameter, int value) {
        if (!parameter.accepts(value)) {
            throw new ValidationException(parameter + " must be within [" + parameter.getMin() + ", "
                    + parameter.getMax() + "], was " + value);
        }
    }

    private void requireConsistent(ProtocolParameters parameters) {
        if (parameters.getMinCollateralRatioBps() <= parameters.getLiquidationThresholdBps()) {
            throw new ValidationException("Minimum collateral ratio " + parameters.getMinCollateralRatioBps()
                    + "bps must be above the liquidation threshold " + parameters.getLiquidationThresholdBps() + "bps");
        }
    }

    private ProtocolParameters seedFromProperties() {
        ProtocolParameters seeded = ProtocolParameters.builder()
                .version(0L)
                .baseRateBps(properties.getRate().getBaseRateBps())
                .riskPremiumMultiplier(properties.getRate().getRiskPremiumMultiplier())
                .minCollateralRatioBps(properties.getCollateral().getMinCollateralRatioBps())
                .liquidationThresholdBps(properties.getLiquidation().getThresholdBps())
                .liquidationBonusBps(properties.getLiquidation().getBonusBps())
                .build();
        for (ProtocolParameter parameter : ProtocolParameter.values()) {
            if (!parameter.accepts(seeded.valueOf(parameter))) {
                throw new IllegalStateException("Configured " + parameter + " out of range: " + seeded.valueOf(parameter));
            }
        }
        if (seeded.getMinCollateralRatioBps() <= seeded.getLiquidationThresholdBps()) {
            throw new IllegalStateException("lending.collateral.min-collateral-ratio-bps must exceed lending.liquidation.threshold-bps");
        }
        return seeded;
    }
}
