package com.lendora.lending.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Pushed price observation: principal units per collateral unit.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceUpdateRequest {

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal price;

    @NotNull
    private Instant observedAt;
}
