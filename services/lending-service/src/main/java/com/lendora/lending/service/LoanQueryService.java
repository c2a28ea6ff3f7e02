package com.lendora.lending.service;

import com.lendora.lending.domain.CollateralMovement;
import com.lendora.lending.domain.CollateralPosition;
import com.lendora.lending.domain.LiquidationEvent;
import com.lendora.lending.domain.Loan;
import com.lendora.lending.domain.LoanActivity;
import com.lendora.lending.domain.LoanStatus;
import com.lendora.lending.domain.ProtocolParameterChange;
import com.lendora.lending.dto.CollateralRatioResponse;
import com.lendora.lending.dto.ProtocolSummaryResponse;
import com.lendora.lending.exception.LoanNotFoundException;
import com.lendora.lending.repository.LiquidationEventRepository;
import com.lendora.lending.repository.LoanActivityRepository;
import com.lendora.lending.repository.LoanRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of the protocol. Nothing here takes a lock or changes state.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class LoanQueryService {

    private final LoanRepository loanRepository;
    private final LoanActivityRepository activityRepository;
    private final LiquidationEventRepository liquidationEventRepository;
    private final CollateralLedger collateralLedger;
    private final LoanManager loanManager;
    private final ProtocolParameterService parameterService;

    public Loan getLoan(Long loanId) {
        return loanRepository.findById(loanId)
                .orElseThrow(() -> new LoanNotFoundException("Loan not found: " + loanId));
    }

    public Loan getLoanByNumber(String loanNumber) {
        return loanRepository.findByLoanNumber(loanNumber)
                .orElseThrow(() -> new LoanNotFoundException("Loan not found: " + loanNumber));
    }

    public List<Loan> getLoansByBorrower(String borrowerId) {
        return loanRepository.findByBorrowerIdOrderByOriginatedAtDesc(borrowerId);
    }

    public List<Loan> getActiveLoans() {
        return loanRepository.findByStatus(LoanStatus.ACTIVE);
    }

    /**
     * Ratio of the position securing the loan, computed against every active loan on it.
     */
    public CollateralRatioResponse getCollateralRatio(Long loanId) {
        Loan loan = getLoan(loanId);
        CollateralSnapshot snapshot = collateralLedger.snapshot(loan.getBorrowerId(), loan.getCollateralAsset(),
                loanManager.securedPrincipal(loan.getBorrowerId(), loan.getCollateralAsset(), null));
        int threshold = parameterService.current().getLiquidationThresholdBps();
        return CollateralRatioResponse.builder()
                .loanId(loan.getId())
                .borrowerId(loan.getBorrowerId())
                .assetId(loan.getCollateralAsset())
                .collateralAmount(snapshot.getCollateralAmount())
                .securedPrincipal(snapshot.getSecuredPrincipal())
                .price(snapshot.getPrice())
                .priceObservedAt(snapshot.getPriceObservedAt())
                .ratioBps(snapshot.getRatioBps())
                .liquidationThresholdBps(threshold)
                .liquidatable(loan.isActive() && snapshot.getRatioBps() < threshold)
                .build();
    }

    public List<LoanActivity> getActivity(Long loanId) {
        getLoan(loanId);
        return activityRepository.findByLoanIdOrderByIdAsc(loanId);
    }

    public List<LiquidationEvent> getLiquidations() {
        return liquidationEventRepository.findAllByOrderByIdDesc();
    }

    public List<LiquidationEvent> getLiquidations(Long loanId) {
        return liquidationEventRepository.findByLoanIdOrderByIdAsc(loanId);
    }

    public List<CollateralPosition> getPositions(String borrowerId) {
        return collateralLedger.positionsOf(borrowerId);
    }

    public List<CollateralMovement> getMovements(String borrowerId, String assetId) {
        return collateralLedger.movementsOf(borrowerId, assetId);
    }

    public List<ProtocolParameterChange> getParameterHistory() {
        return parameterService.history();
    }

    public ProtocolSummaryResponse getSummary() {
        Map<LoanStatus, Long> byStatus = new EnumMap<>(LoanStatus.class);
        for (LoanStatus status : LoanStatus.values()) {
            byStatus.put(status, loanRepository.countByStatus(status));
        }
        return ProtocolSummaryResponse.builder()
                .loansByStatus(byStatus)
                .totalOutstanding(loanRepository.sumOutstandingBalanceByStatus(LoanStatus.ACTIVE))
                .parameterVersion(parameterService.current().getVersion())
                .liquidationCount(liquidationEventRepository.count())
                .build();
    }
}
