package com.lendora.lending.controller;

import com.lendora.lending.domain.LiquidationEvent;
import com.lendora.lending.service.LoanQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/liquidations")
@RequiredArgsConstructor
@Tag(name = "Liquidations", description = "Liquidation and default settlement history")
public class LiquidationController {

    private final LoanQueryService queryService;

    @GetMapping
    @Operation(summary = "All liquidations", description = "Newest first")
    public ResponseEntity<List<LiquidationEvent>> getLiquidations() {
        return ResponseEntity.ok(queryService.getLiquidations());
    }

    @GetMapping("/loans/{loanId}")
    @Operation(summary = "Liquidations of a loan")
    public ResponseEntity<List<LiquidationEvent>> getLoanLiquidations(@PathVariable Long loanId) {
        return ResponseEntity.ok(queryService.getLiquidations(loanId));
    }
}
