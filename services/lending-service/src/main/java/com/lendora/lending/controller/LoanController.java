package com.lendora.lending.controller;

import com.lendora.lending.domain.LoanActivity;
import com.lendora.lending.dto.CollateralRatioResponse;
import com.lendora.lending.dto.HealthCheckRequest;
import com.lendora.lending.dto.LoanResponse;
import com.lendora.lending.dto.OriginateLoanRequest;
import com.lendora.lending.dto.ProtocolSummaryResponse;
import com.lendora.lending.dto.RepaymentRequest;
import com.lendora.lending.service.LiquidationDecision;
import com.lendora.lending.service.LoanManager;
import com.lendora.lending.service.LoanQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/loans")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Loans", description = "Collateralized loan lifecycle")
public class LoanController {

    private final LoanManager loanManager;
    private final LoanQueryService queryService;

    @PostMapping
    @Operation(summary = "Originate loan", description = "Post collateral and open a loan priced from the collateral ratio")
    @ApiResponse(responseCode = "201", description = "Loan originated")
    public ResponseEntity<LoanResponse> originate(@Valid @RequestBody OriginateLoanRequest request) {
        log.info("Origination requested by {} for {} {}", request.getBorrowerId(), request.getPrincipal(), request.getCollateralAsset());
        LoanResponse response = LoanResponse.from(loanManager.originate(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{loanId}")
    @Operation(summary = "Get loan")
    public ResponseEntity<LoanResponse> getLoan(@Parameter(description = "Loan ID") @PathVariable Long loanId) {
        return ResponseEntity.ok(LoanResponse.from(queryService.getLoan(loanId)));
    }

    @GetMapping("/borrowers/{borrowerId}")
    @Operation(summary = "Get borrower loans", description = "All loans of a borrower, newest first")
    public ResponseEntity<List<LoanResponse>> getBorrowerLoans(@PathVariable String borrowerId) {
        return ResponseEntity.ok(queryService.getLoansByBorrower(borrowerId).stream().map(LoanResponse::from).toList());
    }

    @PostMapping("/{loanId}/repayments")
    @Operation(summary = "Repay loan", description = "Apply a repayment, interest first")
    public ResponseEntity<LoanResponse> repay(@PathVariable Long loanId, @Valid @RequestBody RepaymentRequest request) {
        return ResponseEntity.ok(LoanResponse.from(loanManager.repay(loanId, request.getAmount(), request.getPayerId())));
    }

    @PostMapping("/{loanId}/health-check")
    @Operation(summary = "Check loan health", description = "Liquidate the loan if its position is below the liquidation threshold")
    public ResponseEntity<LiquidationDecision> checkHealth(@PathVariable Long loanId, @Valid @RequestBody HealthCheckRequest request) {
        return ResponseEntity.ok(loanManager.checkHealth(loanId, request.getLiquidatorId()));
    }

    @PostMapping("/{loanId}/expire")
    @Operation(summary = "Expire loan", description = "Default a matured loan and settle it from its collateral")
    public ResponseEntity<LiquidationDecision> expire(@PathVariable Long loanId,
                                                      @RequestHeader(value = "X-Actor-Id", required = false) String actorId) {
        return ResponseEntity.ok(actorId == null ? loanManager.expire(loanId) : loanManager.expire(loanId, actorId));
    }

    @GetMapping("/{loanId}/collateral-ratio")
    @Operation(summary = "Get collateral ratio", description = "Ratio of the position securing the loan, in basis points")
    public ResponseEntity<CollateralRatioResponse> getCollateralRatio(@PathVariable Long loanId) {
        return ResponseEntity.ok(queryService.getCollateralRatio(loanId));
    }

    @GetMapping("/{loanId}/activity")
    @Operation(summary = "Get loan activity", description = "Every balance and status change of the loan")
    public ResponseEntity<List<LoanActivity>> getActivity(@PathVariable Long loanId) {
        return ResponseEntity.ok(queryService.getActivity(loanId));
    }

    @GetMapping("/summary")
    @Operation(summary = "Protocol summary", description = "Loan counts by status and total outstanding balance")
    public ResponseEntity<ProtocolSummaryResponse> getSummary() {
        return ResponseEntity.ok(queryService.getSummary());
    }
}
