package com.lendora.lending.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LiquidationParamsRequest {

    @NotNull
    private Integer thresholdBps;

    @NotNull
    private Integer bonusBps;
}
