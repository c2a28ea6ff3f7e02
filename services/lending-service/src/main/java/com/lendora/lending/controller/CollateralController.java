package com.lendora.lending.controller;

import com.lendora.lending.client.PriceQuote;
import com.lendora.lending.domain.CollateralMovement;
import com.lendora.lending.domain.CollateralPosition;
import com.lendora.lending.dto.CollateralRequest;
import com.lendora.lending.dto.PriceUpdateRequest;
import com.lendora.lending.service.CollateralLedger;
import com.lendora.lending.service.LoanManager;
import com.lendora.lending.service.LoanQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/collateral")
@RequiredArgsConstructor
@Tag(name = "Collateral", description = "Collateral positions and price references")
public class CollateralController {

    private final LoanManager loanManager;
    private final LoanQueryService queryService;
    private final CollateralLedger collateralLedger;

    @PostMapping("/deposits")
    @Operation(summary = "Post collateral")
    public ResponseEntity<CollateralPosition> post(@Valid @RequestBody CollateralRequest request) {
        return ResponseEntity.ok(loanManager.postCollateral(request.getBorrowerId(), request.getAssetId(), request.getAmount()));
    }

    @PostMapping("/withdrawals")
    @Operation(summary = "Withdraw collateral", description = "Rejected if the remaining position would fall below the minimum ratio")
    public ResponseEntity<CollateralPosition> withdraw(@Valid @RequestBody CollateralRequest request) {
        return ResponseEntity.ok(loanManager.withdrawCollateral(request.getBorrowerId(), request.getAssetId(), request.getAmount()));
    }

    @GetMapping("/borrowers/{borrowerId}")
    @Operation(summary = "Get positions")
    public ResponseEntity<List<CollateralPosition>> getPositions(@PathVariable String borrowerId) {
        return ResponseEntity.ok(queryService.getPositions(borrowerId));
    }

    @GetMapping("/borrowers/{borrowerId}/assets/{assetId}/movements")
    @Operation(summary = "Get position movements")
    public ResponseEntity<List<CollateralMovement>> getMovements(@PathVariable String borrowerId, @PathVariable String assetId) {
        return ResponseEntity.ok(queryService.getMovements(borrowerId, assetId));
    }

    @PutMapping("/prices/{assetId}")
    @Operation(summary = "Push price", description = "Record a price observation; older observations are ignored")
    public ResponseEntity<Map<String, Object>> updatePrice(@PathVariable String assetId, @Valid @RequestBody PriceUpdateRequest request) {
        boolean accepted = collateralLedger.updatePrice(assetId, request.getPrice(), request.getObservedAt());
        return ResponseEntity.ok(Map.of("assetId", assetId, "accepted", accepted));
    }

    @GetMapping("/prices/{assetId}")
    @Operation(summary = "Get price", description = "Latest fresh price, refreshed from the oracle when stale")
    public ResponseEntity<PriceQuote> getPrice(@PathVariable String assetId) {
        return ResponseEntity.ok(collateralLedger.currentPrice(assetId));
    }
}
