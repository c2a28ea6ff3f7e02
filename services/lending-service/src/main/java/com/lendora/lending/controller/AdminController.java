package com.lendora.lending.controller;

import com.lendora.lending.domain.ProtocolParameterChange;
import com.lendora.lending.domain.ProtocolParameters;
import com.lendora.lending.dto.LiquidationParamsRequest;
import com.lendora.lending.dto.ParameterValueRequest;
import com.lendora.lending.service.ProtocolParameterService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Protocol parameter administration. The acting administrator is identified by the
 * {@code X-Actor-Id} header and checked against the configured administrator set.
 */
@RestController
@RequestMapping("/api/v1/admin/parameters")
@RequiredArgsConstructor
@Tag(name = "Protocol Parameters", description = "Versioned, audited protocol configuration")
public class AdminController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final ProtocolParameterService parameterService;

    @GetMapping
    @Operation(summary = "Current parameters")
    public ResponseEntity<ProtocolParameters> current() {
        return ResponseEntity.ok(parameterService.current());
    }

    @GetMapping("/history")
    @Operation(summary = "Parameter change history")
    public ResponseEntity<List<ProtocolParameterChange>> history() {
        return ResponseEntity.ok(parameterService.history());
    }

    @PutMapping("/base-rate")
    @Operation(summary = "Set base rate", description = "Base rate in basis points, within [100, 5000]")
    public ResponseEntity<ProtocolParameters> setBaseRate(@RequestHeader(ACTOR_HEADER) String actorId,
                                                          @Valid @RequestBody ParameterValueRequest request) {
        return ResponseEntity.ok(parameterService.setBaseRate(actorId, request.getValue()));
    }

    @PutMapping("/risk-premium-multiplier")
    @Operation(summary = "Set risk premium multiplier", description = "Within [0, 10000]")
    public ResponseEntity<ProtocolParameters> setRiskPremiumMultiplier(@RequestHeader(ACTOR_HEADER) String actorId,
                                                                       @Valid @RequestBody ParameterValueRequest request) {
        return ResponseEntity.ok(parameterService.setRiskPremiumMultiplier(actorId, request.getValue()));
    }

    @PutMapping("/min-collateral-ratio")
    @Operation(summary = "Set minimum collateral ratio", description = "Must stay above the liquidation threshold")
    public ResponseEntity<ProtocolParameters> setMinCollateralRatio(@RequestHeader(ACTOR_HEADER) String actorId,
                                                                    @Valid @RequestBody ParameterValueRequest request) {
        return ResponseEntity.ok(parameterService.setMinCollateralRatio(actorId, request.getValue()));
    }

    @PutMapping("/liquidation")
    @Operation(summary = "Set liquidation threshold and bonus")
    public ResponseEntity<ProtocolParameters> setLiquidationParams(@RequestHeader(ACTOR_HEADER) String actorId,
                                                                   @Valid @RequestBody LiquidationParamsRequest request) {
        return ResponseEntity.ok(parameterService.setLiquidationParams(actorId, request.getThresholdBps(), request.getBonusBps()));
    }
}
