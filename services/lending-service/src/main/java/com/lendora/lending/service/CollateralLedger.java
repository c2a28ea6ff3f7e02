package com.lendora.lending.service;

import com.lendora.lending.client.ExternalCallGuard;
import com.lendora.lending.client.PriceOracle;
import com.lendora.lending.client.PriceQuote;
import com.lendora.lending.config.LendingProperties;
import com.lendora.lending.config.ResilienceConfig;
import com.lendora.lending.domain.CollateralMovement;
import com.lendora.lending.domain.CollateralMovementType;
import com.lendora.lending.domain.CollateralPosition;
import com.lendora.lending.exception.BelowMinimumRatioException;
import com.lendora.lending.exception.ExternalCallFailedException;
import com.lendora.lending.exception.InsufficientCollateralException;
import com.lendora.lending.exception.StalePriceException;
import com.lendora.lending.exception.ValidationException;
import com.lendora.lending.repository.CollateralMovementRepository;
import com.lendora.lending.repository.CollateralPositionRepository;
import com.lendora.lending.util.BasisPoints;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns collateral positions and the price reference of every collateral asset.
 *
 * Mutations join the caller's transaction and expect the caller to hold the position lock;
 * {@link LoanManager} is the only caller. Price reads are lock-free snapshots of immutable quotes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollateralLedger {

    private final CollateralPositionRepository positionRepository;
    private final CollateralMovementRepository movementRepository;
    private final PriceOracle priceOracle;
    private final ExternalCallGuard callGuard;
    private final ProtocolParameterService parameterService;
    private final LendingProperties properties;
    private final Clock clock;

    private final ConcurrentMap<String, PriceQuote> prices = new ConcurrentHashMap<>();

    // Price references

    /**
     * Records an observed price. An observation older than the one already known is ignored.
     *
     * @return whether the observation became the asset's latest price
     */
    public boolean updatePrice(String assetId, BigDecimal price, Instant observedAt) {
        if (assetId == null || assetId.isBlank()) {
            throw new ValidationException("Asset is required");
        }
        if (price == null || price.signum() <= 0) {
            throw new ValidationException("Price for " + assetId + " must be greater than zero");
        }
        if (observedAt == null) {
            throw new ValidationException("Price observation time for " + assetId + " is required");
        }

        PriceQuote candidate = new PriceQuote(assetId, price, observedAt);
        PriceQuote latest = prices.merge(assetId, candidate,
                (existing, incoming) -> incoming.isNewerThan(existing) ? incoming : existing);
        boolean accepted = latest == candidate;
        if (accepted) {
            log.debug("Price of {} updated to {} observed at {}", assetId, price, observedAt);
        } else {
            log.debug("Ignored out-of-order price for {} observed at {}", assetId, observedAt);
        }
        return accepted;
    }

    /**
     * Pulls the latest price from the oracle under a bounded timeout.
     */
    public PriceQuote refreshPrice(String assetId) {
        PriceQuote quote;
        try {
            quote = callGuard.execute(ResilienceConfig.PRICE_ORACLE, () -> priceOracle.getPrice(assetId));
        } catch (ExternalCallFailedException e) {
            throw new StalePriceException("No price available for " + assetId, e);
        }
        if (quote == null || quote.price() == null || quote.observedAt() == null) {
            throw new StalePriceException("Price feed returned nothing for " + assetId);
        }
        updatePrice(assetId, quote.price(), quote.observedAt());
        return prices.get(assetId);
    }

    /**
     * Latest price inside the freshness window, refreshing from the oracle once if needed.
     *
     * @throws StalePriceException if no fresh price can be obtained
     */
    public PriceQuote currentPrice(String assetId) {
        Instant now = clock.instant();
        if (isPegged(assetId)) {
            return new PriceQuote(assetId, BigDecimal.ONE, now);
        }

        Duration freshness = properties.getCollateral().getPriceFreshness();
        PriceQuote cached = prices.get(assetId);
        if (cached != null && cached.isFresh(now, freshness)) {
            return cached;
        }

        PriceQuote refreshed = refreshPrice(assetId);
        if (!refreshed.isFresh(now, freshness)) {
            log.warn("Price of {} is stale: observed at {}, freshness window {}", assetId, refreshed.observedAt(), freshness);
            throw new StalePriceException("Price of " + assetId + " observed at " + refreshed.observedAt()
                    + " is older than " + freshness);
        }
        return refreshed;
    }

    public Optional<PriceQuote> lastKnownPrice(String assetId) {
        return Optional.ofNullable(prices.get(assetId));
    }

    public boolean isPegged(String assetId) {
        return properties.getCollateral().getPeggedAssets().stream().anyMatch(pegged -> pegged.equalsIgnoreCase(assetId));
    }

    // Positions

    public BigDecimal balanceOf(String borrowerId, String assetId) {
        return positionRepository.findByBorrowerIdAndAssetId(borrowerId, assetId)
                .map(CollateralPosition::getAmount)
                .orElse(BigDecimal.ZERO);
    }

    public List<CollateralPosition> positionsOf(String borrowerId) {
        return positionRepository.findByBorrowerIdOrderByAssetIdAsc(borrowerId);
    }

    public List<CollateralMovement> movementsOf(String borrowerId, String assetId) {
        return movementRepository.findByBorrowerIdAndAssetIdOrderByIdAsc(borrowerId, assetId);
    }

    public CollateralSnapshot snapshot(String borrowerId, String assetId, BigDecimal securedPrincipal) {
        BigDecimal amount = balanceOf(borrowerId, assetId);
        PriceQuote quote = currentPrice(assetId);
        return CollateralSnapshot.builder()
                .borrowerId(borrowerId)
                .assetId(assetId)
                .collateralAmount(amount)
                .price(quote.price())
                .priceObservedAt(quote.observedAt())
                .securedPrincipal(securedPrincipal)
                .build();
    }

    /**
     * Collateralization ratio of a position against the given outstanding principal, in bps.
     */
    public int ratio(String borrowerId, String assetId, BigDecimal outstandingPrincipal) {
        return snapshot(borrowerId, assetId, outstandingPrincipal).getRatioBps();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public CollateralPosition post(String borrowerId, String assetId, BigDecimal amount, Long loanId) {
        BigDecimal value = BasisPoints.requirePositiveWholeAmount(amount, "Collateral amount");
        CollateralPosition position = positionRepository.findByBorrowerIdAndAssetId(borrowerId, assetId)
                .orElseGet(() -> CollateralPosition.builder()
                        .borrowerId(borrowerId)
                        .assetId(assetId)
                        .build());
        return applyMovement(position, CollateralMovementType.POST, value, loanId);
    }

    /**
     * Borrower-initiated withdrawal.
     *
     * @param securedPrincipal outstanding principal of the active loans secured by the position
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CollateralPosition withdraw(String borrowerId, String assetId, BigDecimal amount, BigDecimal securedPrincipal) {
        BigDecimal value = BasisPoints.requirePositiveWholeAmount(amount, "Withdrawal amount");
        CollateralPosition position = requirePosition(borrowerId, assetId);
        if (value.compareTo(position.getAmount()) > 0) {
            throw new InsufficientCollateralException("Withdrawal of " + value.toPlainString() + " exceeds balance "
                    + position.getAmount().toPlainString() + " of " + borrowerId + "/" + assetId);
        }

        if (securedPrincipal.signum() > 0) {
            PriceQuote quote = currentPrice(assetId);
            int ratio = BasisPoints.collateralRatio(position.getAmount().subtract(value), quote.price(), securedPrincipal);
            int minimum = parameterService.current().getMinCollateralRatioBps();
            if (ratio < minimum) {
                log.warn("Rejected withdrawal of {} {} by {}: ratio would drop to {}bps, minimum {}bps",
                        value, assetId, borrowerId, ratio, minimum);
                throw new BelowMinimumRatioException("Withdrawal would leave " + borrowerId + "/" + assetId
                        + " at " + ratio + "bps, minimum is " + minimum + "bps");
            }
        }

        return applyMovement(position, CollateralMovementType.WITHDRAW, value, null);
    }

    /**
     * Removes collateral on the liquidation or default path. No ratio check.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CollateralPosition seize(String borrowerId, String assetId, BigDecimal amount, Long loanId) {
        CollateralPosition position = requirePosition(borrowerId, assetId);
        if (amount.signum() == 0) {
            return position;
        }
        return applyMovement(position, CollateralMovementType.SEIZE, amount, loanId);
    }

    /**
     * Returns collateral to the borrower after a loan closes.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CollateralPosition release(String borrowerId, String assetId, BigDecimal amount, Long loanId) {
        CollateralPosition position = requirePosition(borrowerId, assetId);
        if (amount.signum() == 0) {
            return position;
        }
        return applyMovement(position, CollateralMovementType.RELEASE, amount, loanId);
    }

    /**
     * Largest amount, up to {@code requested}, that can leave the position while the remaining
     * secured principal stays at the minimum collateral ratio.
     */
    public BigDecimal releasableAmount(String borrowerId, String assetId, BigDecimal requested, BigDecimal remainingSecuredPrincipal) {
        BigDecimal cap = requested.min(balanceOf(borrowerId, assetId));
        if (remainingSecuredPrincipal.signum() <= 0) {
            return cap;
        }
        PriceQuote quote = currentPrice(assetId);
        int minimum = parameterService.current().getMinCollateralRatioBps();
        BigDecimal required = BasisPoints.ceilDivide(
                remainingSecuredPrincipal.multiply(BigDecimal.valueOf(minimum)),
                BasisPoints.DENOMINATOR_DECIMAL.multiply(quote.price()));
        BigDecimal free = balanceOf(borrowerId, assetId).subtract(required).max(BigDecimal.ZERO);
        return cap.min(free);
    }

    private CollateralPosition requirePosition(String borrowerId, String assetId) {
        return positionRepository.findByBorrowerIdAndAssetId(borrowerId, assetId)
                .orElseThrow(() -> new InsufficientCollateralException("No collateral posted by " + borrowerId + " in " + assetId));
    }

    private CollateralPosition applyMovement(CollateralPosition position, CollateralMovementType type, BigDecimal amount, Long loanId) {
        BigDecimal before = position.getAmount();
        if (type == CollateralMovementType.POST) {
            position.credit(amount);
        } else {
            position.debit(amount);
        }
        CollateralPosition saved = positionRepository.save(position);

        movementRepository.save(CollateralMovement.builder()
                .borrowerId(position.getBorrowerId())
                .assetId(position.getAssetId())
                .loanId(loanId)
                .type(type)
                .amount(amount)
                .balanceBefore(before)
                .balanceAfter(saved.getAmount())
                .occurredAt(clock.instant())
                .build());

        log.info("Collateral {} of {} {} for {} (balance {} -> {})",
                type, amount, position.getAssetId(), position.getBorrowerId(), before, saved.getAmount());
        return saved;
    }
}
